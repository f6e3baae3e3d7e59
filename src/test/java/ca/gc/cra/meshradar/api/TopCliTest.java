package ca.gc.cra.meshradar.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.config.QueryConfig;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import ca.gc.cra.meshradar.infrastructure.persistence.jdbc.JdbcMeshStore;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class TopCliTest {
  private static final long SEEN_AT = 1_700_000_000_000L;
  private static final ClockPort CLOCK = () -> SEEN_AT + Duration.ofHours(1).toMillis();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;
  private String jdbcUrl;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(TopCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    jdbcUrl = "jdbc:h2:mem:top-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    try (JdbcMeshStore store = JdbcMeshStore.open(jdbcUrl, null, null, 2, 2_000L)) {
      store.recordPacket(MeshFixtures.decoded(1L, 0x10L).build());
      store.recordPacket(MeshFixtures.decoded(2L, 0x10L).build());
      store.recordPacket(MeshFixtures.decoded(3L, 0x20L).build());
      store.mergeObservation(0x10L, NodeField.LONG_NAME, "Chatty", SEEN_AT);
      store.touchNode(0x10L, SEEN_AT);
      store.touchNode(0x20L, SEEN_AT);
    }
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void printsRankingBusiestFirst() {
    ExitCode code = TopCli.run(new String[] {"metricsExporter=none", "jdbcUrl=" + jdbcUrl}, CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Top traffic, last 24h: 2 active nodes"));
    int chatty = output.indexOf("!00000010");
    int quiet = output.indexOf("!00000020");
    assertTrue(chatty >= 0 && quiet > chatty);
    assertTrue(output.contains("Chatty"));
  }

  @Test
  void nodeOptionPrintsPerKindTraffic() {
    ExitCode code = TopCli.run(
        new String[] {"metricsExporter=none", "jdbcUrl=" + jdbcUrl, "node=!00000010"}, CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Traffic from !00000010, last 24h"));
    assertTrue(output.contains("TEXT"));
  }

  @Test
  void windowExcludesOldTraffic() {
    ClockPort muchLater = () -> SEEN_AT + Duration.ofDays(3).toMillis();

    ExitCode code = TopCli.run(new String[] {"metricsExporter=none", "jdbcUrl=" + jdbcUrl}, muchLater);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("0 active nodes"));
    assertFalse(buffer.toString().contains("!00000010"));
  }

  @Test
  void missingJdbcUrlIsRejected() {
    ExitCode code = TopCli.run(new String[] {"metricsExporter=none"}, CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: top"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("jdbcUrl is required for top")));
  }

  @Test
  void unknownFlagIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, TopCli.run(new String[] {"--tail", "jdbcUrl=" + jdbcUrl}, CLOCK));
  }

  @Test
  void renderRankingShowsDashForUnknownNames() {
    QueryConfig config = QueryConfig.fromMap(Map.of("jdbcUrl", "jdbc:h2:mem:render", "channel", "LongFast"));

    List<String> lines = TopCli.renderRanking(config, 1, List.of(new TrafficSummary(0x1L, null, null, null, 2, 4)));

    assertEquals("Top traffic, last 24h: 1 active nodes on LongFast", lines.get(0));
    assertEquals(3, lines.size());
    assertTrue(lines.get(2).startsWith("!00000001 "));
    assertTrue(lines.get(2).contains(" - "));
  }

  @Test
  void renderNodeTrafficListsPorts() {
    List<String> lines = TopCli.renderNodeTraffic(
        0x10L, Duration.ofHours(6), List.of(new KindCount(MessageKind.TEXT.portNum(), MessageKind.TEXT, 5)));

    assertEquals("Traffic from !00000010, last 6h", lines.get(0));
    assertTrue(lines.get(2).startsWith("1 "));
    assertTrue(lines.get(2).endsWith("5"));
  }
}
