package ca.gc.cra.meshradar.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class IngestCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(IngestCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
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
  void helpPrintsUsage() {
    ExitCode code = IngestCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("meshradar ingest pipeline"));
  }

  @Test
  void unknownFlagIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"--follow"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: ingest"));
    assertTrue(hasError("Unknown flags"));
  }

  @Test
  void dryRunPrintsPlanWithoutCredentials() {
    ExitCode code = IngestCli.run(new String[] {
        "metricsExporter=none", "brokerUrl=tcp://broker.local:1883", "password=s3cret", "--dry-run", "--tail"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Ingest dry-run: no broker connection will be made."));
    assertTrue(output.contains("brokerUrl=tcp://broker.local:1883"));
    assertTrue(output.contains("password=[REDACTED]"));
    assertTrue(output.contains("tail=true"));
    assertFalse(output.contains("s3cret"));
  }

  @Test
  void invalidBrokerUrlIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"metricsExporter=none", "brokerUrl=http://broker.local", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasError("Invalid ingest arguments"));
  }

  @Test
  void invalidMetricsExporterIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"metricsExporter=prometheus", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasError("Configuration file does not exist"));
  }

  @Test
  void yamlSelectsKafkaSourceAndCliOverrides() throws Exception {
    Path yaml = tempDir.resolve("meshradar.yaml");
    Files.writeString(yaml, String.join("\n",
        "common:",
        "  metricsExporter: none",
        "ingest:",
        "  source: KAFKA",
        "  kafkaBootstrap: kafka.local:9092",
        "  kafkaTopic: mesh.raw",
        ""));

    ExitCode code = IngestCli.run(new String[] {"config=" + yaml, "kafkaTopic=mesh.override", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("source=KAFKA"));
    assertTrue(output.contains("kafkaBootstrap=kafka.local:9092"));
    assertTrue(output.contains("kafkaTopic=mesh.override"));
  }

  @Test
  void jdbcStoreWithoutUrlIsRejected() {
    ExitCode code = IngestCli.run(new String[] {"metricsExporter=none", "store=jdbc", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunMasksJdbcPassword() {
    ExitCode code = IngestCli.run(new String[] {
        "metricsExporter=none", "store=jdbc", "jdbcUrl=jdbc:h2:mem:plan;PASSWORD=hunter2", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("store=JDBC"));
    assertFalse(buffer.toString().contains("hunter2"));
  }

  @Test
  void unreachableStoreFailsStartupWithIoError() {
    ExitCode code = IngestCli.run(new String[] {
        "metricsExporter=none",
        "store=jdbc",
        "jdbcUrl=jdbc:h2:tcp://127.0.0.1:1/nowhere",
        "storeTimeoutMillis=500"});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(hasError("Mesh store unavailable at startup"));
  }

  private boolean hasError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }
}
