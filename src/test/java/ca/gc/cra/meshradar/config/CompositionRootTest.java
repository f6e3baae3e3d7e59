package ca.gc.cra.meshradar.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.adapter.kafka.KafkaBridgeMessageSource;
import ca.gc.cra.meshradar.application.hub.LiveHub;
import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NormalizedEvent;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.infrastructure.decode.ChannelCipher;
import ca.gc.cra.meshradar.infrastructure.transport.TransportListener;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import ca.gc.cra.meshradar.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final String TOPIC = "msh/US/2/e/LongFast/!0000beef";

  @Test
  void defaultDecoderReadsEncryptedPublicChannelTraffic() throws Exception {
    try (CompositionRoot root = new CompositionRoot(IngestConfig.defaults(), new RecordingMetricsPort())) {
      RawMessage message = text(5L, 0x42L).message(TOPIC, 1_000L);

      DecodedEnvelope envelope = root.envelopeDecoder().decode(message).orElseThrow();

      assertEquals(5L, envelope.packetId());
      assertEquals(0x42L, envelope.fromNodeId());
      assertEquals("LongFast", envelope.channel());
      assertEquals("!0000beef", envelope.gatewayId());
      assertEquals(MessageKind.TEXT, envelope.kind());
    }
  }

  @Test
  void defaultDecoderSkipsIgnoredSender() throws Exception {
    try (CompositionRoot root = new CompositionRoot(IngestConfig.defaults(), new RecordingMetricsPort())) {
      RawMessage message = text(6L, IngestConfig.DEFAULT_IGNORED_SENDER).message(TOPIC, 1_000L);

      assertTrue(root.envelopeDecoder().decode(message).isEmpty());
    }
  }

  @Test
  void messageSourceFollowsSourceMode() throws Exception {
    try (CompositionRoot root = new CompositionRoot(IngestConfig.defaults(), new RecordingMetricsPort())) {
      MessageSource source = root.messageSource();
      assertTrue(source instanceof TransportListener);
      source.close();
    }
    IngestConfig kafka = IngestConfig.fromMap(Map.of("source", "kafka", "kafkaBootstrap", "localhost:9092"));
    try (CompositionRoot root = new CompositionRoot(kafka, new RecordingMetricsPort())) {
      MessageSource source = root.messageSource();
      assertTrue(source instanceof KafkaBridgeMessageSource);
      source.close();
    }
  }

  @Test
  void kafkaSourceWithoutBootstrapIsRejected() {
    IngestConfig kafka = IngestConfig.fromMap(Map.of("source", "kafka"));
    try (CompositionRoot root = new CompositionRoot(kafka, new RecordingMetricsPort())) {
      assertThrows(IllegalArgumentException.class, root::messageSource);
    }
  }

  @Test
  void unreachableJdbcStoreFailsBeforeSourceIsBuilt() {
    IngestConfig jdbc = IngestConfig.fromMap(Map.of(
        "store", "jdbc",
        "jdbcUrl", "jdbc:h2:tcp://127.0.0.1:1/nowhere",
        "storeTimeoutMillis", "500"));
    try (CompositionRoot root = new CompositionRoot(jdbc, new RecordingMetricsPort())) {
      assertThrows(StoreException.class, root::ingestPipeline);
    }
  }

  @Test
  void wiredPipelinePublishesStoredPacketsToHub() throws Exception {
    QueueSource source = new QueueSource();
    try (CompositionRoot root = new CompositionRoot(IngestConfig.defaults(), new RecordingMetricsPort())) {
      LiveHub.Subscription tail = root.hub().subscribe("composition-test");
      IngestPipelineUseCase pipeline = root.ingestPipeline(source);
      Thread runner = new Thread(() -> {
        try {
          pipeline.run();
        } catch (Exception ex) {
          throw new IllegalStateException(ex);
        }
      }, "composition-test-runner");
      runner.start();

      source.offer(text(7L, 0x42L).message(TOPIC, 2_000L));
      Optional<NormalizedEvent> event = tail.poll(10, TimeUnit.SECONDS);

      pipeline.stop();
      runner.join(TimeUnit.SECONDS.toMillis(15));

      NormalizedEvent published = event.orElseThrow();
      assertEquals(7L, published.packetId());
      assertEquals("!0000beef", published.gatewayId());
      assertTrue(published.firstSighting());
      assertFalse(runner.isAlive());
      assertTrue(source.closed.get());
    }
  }

  @Test
  void closeShutsHubAndIsRepeatable() {
    CompositionRoot root = new CompositionRoot(IngestConfig.defaults(), new RecordingMetricsPort());
    LiveHub.Subscription subscription = root.hub().subscribe("closing");

    root.close();
    root.close();

    assertFalse(subscription.isOpen());
  }

  private static MeshFixtures.PacketBuilder text(long packetId, long from) {
    return MeshFixtures.packet(packetId, from)
        .payload(MessageKind.TEXT, "hello mesh".getBytes(StandardCharsets.UTF_8))
        .encryptedWith(ChannelCipher.DEFAULT_KEY);
  }

  private static final class QueueSource implements MessageSource {
    private final BlockingQueue<RawMessage> messages = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    void offer(RawMessage message) {
      messages.add(message);
    }

    @Override
    public void start() {}

    @Override
    public Optional<RawMessage> poll() throws InterruptedException {
      return Optional.ofNullable(messages.poll(20, TimeUnit.MILLISECONDS));
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
