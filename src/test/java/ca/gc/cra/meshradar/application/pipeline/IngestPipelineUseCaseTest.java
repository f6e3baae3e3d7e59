package ca.gc.cra.meshradar.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.meshradar.application.health.HealthCounter;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.hub.LiveHub;
import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase.PipelineSettings;
import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase.QueueType;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.PacketObservation;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.mesh.RawMessage;
import ca.gc.cra.meshradar.infrastructure.decode.ChannelCipher;
import ca.gc.cra.meshradar.infrastructure.decode.ServiceEnvelopeDecoder;
import ca.gc.cra.meshradar.infrastructure.decode.TopicLayout;
import ca.gc.cra.meshradar.infrastructure.decode.kind.PayloadDecoders;
import ca.gc.cra.meshradar.infrastructure.persistence.memory.InMemoryMeshStore;
import ca.gc.cra.meshradar.testutil.MeshFixtures;
import ca.gc.cra.meshradar.testutil.RecordingMetricsPort;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IngestPipelineUseCaseTest {
  private static final String LAYOUT = "+/+/{gateway}/{channel}";
  private static final String TOPIC_A = "region/sub/gatewayA/1234";
  private static final String TOPIC_B = "region/sub/gatewayB/1234";
  private static final long SENDER = 42L;

  private RecordingMetricsPort metrics;
  private PipelineHealth health;
  private InMemoryMeshStore store;
  private LiveHub hub;
  private QueueSource source;
  private IngestPipelineUseCase pipeline;
  private Thread runner;
  private final AtomicReference<Throwable> runFailure = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    health = new PipelineHealth(metrics);
    store = new InMemoryMeshStore();
    hub = new LiveHub(64, health);
    source = new QueueSource();
    ServiceEnvelopeDecoder decoder = new ServiceEnvelopeDecoder(
        TopicLayout.parse(LAYOUT), ChannelCipher.defaultKey(), Set.of(), health);
    PacketProcessor processor = new PacketProcessor(store, store, new PayloadDecoders(), hub, health);
    pipeline = new IngestPipelineUseCase(
        source, decoder, processor, health, new PipelineSettings(1, 1, 16, QueueType.ARRAY));
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    if (runner != null) {
      pipeline.stop();
      runner.join(TimeUnit.SECONDS.toMillis(15));
    }
    hub.close();
  }

  @Test
  void positionPacketBecomesNodeStateAndCanonicalPacket() throws Exception {
    LiveHub.Subscription tail = hub.subscribe("test");
    start();

    source.offer(position(77L).message(TOPIC_A, 1_000L));
    awaitCondition(() -> store.findNode(SENDER).flatMap(n -> n.get(NodeField.LAST_POSITION)).isPresent());

    Position position = store.findNode(SENDER).orElseThrow().get(NodeField.LAST_POSITION).orElseThrow();
    assertEquals(37.0, position.latitude(), 1e-6);
    assertEquals(-122.0, position.longitude(), 1e-6);
    CanonicalPacket packet = store.findPacket(77L, SENDER).orElseThrow();
    assertEquals(MessageKind.POSITION, packet.kind());
    assertEquals("1234", packet.channel());
    List<PacketObservation> observations = store.observations(77L, SENDER);
    assertEquals(1, observations.size());
    assertEquals("gatewayA", observations.get(0).gatewayId());
    assertEquals(77L, tail.poll(5, TimeUnit.SECONDS).orElseThrow().packetId());
  }

  @Test
  void samePacketHeardByTwoGatewaysIsStoredOnce() throws Exception {
    start();

    source.offer(position(77L).message(TOPIC_A, 1_000L));
    source.offer(position(77L).message(TOPIC_B, 1_050L));
    source.offer(position(77L).message(TOPIC_A, 1_100L));
    awaitCondition(() -> health.count(HealthCounter.DEDUP_NOOP) == 1);

    assertEquals(2, store.observations(77L, SENDER).size());
    assertEquals(1, store.packetsFrom(SENDER, 0L, 10).size());
  }

  @Test
  void truncatedEnvelopeIsCountedWithoutWritesAndPipelineContinues() throws Exception {
    start();

    source.offer(new RawMessage(TOPIC_A, new byte[] {0x0A, 0x10, 0x01}, 1_000L));
    source.offer(position(78L).message(TOPIC_A, 1_100L));
    awaitCondition(() -> store.findPacket(78L, SENDER).isPresent());

    assertEquals(1, health.count(HealthCounter.DECODE_FAILED));
    assertEquals(1, store.packetsFrom(SENDER, 0L, 10).size());
    assertEquals(0, health.count(HealthCounter.WORKER_ERROR));
  }

  @Test
  void stopDrainsAndClosesSource() throws Exception {
    start();
    source.offer(position(79L).message(TOPIC_A, 1_000L));
    awaitCondition(() -> store.findPacket(79L, SENDER).isPresent());

    pipeline.stop();
    runner.join(TimeUnit.SECONDS.toMillis(15));

    assertFalse(runner.isAlive());
    assertTrue(source.closed.get());
    assertNull(runFailure.get());
    assertTrue(metrics.hasObservation("ingest.store.queue.highWater"));
  }

  @Test
  void pipelineRunsOnlyOnce() throws Exception {
    start();
    pipeline.stop();
    runner.join(TimeUnit.SECONDS.toMillis(15));

    assertThrows(IllegalStateException.class, pipeline::run);
  }

  @Test
  void sourceStartFailurePropagates() {
    source.failOnStart = true;

    Exception ex = assertThrows(Exception.class, pipeline::run);

    assertEquals("broker refused", ex.getMessage());
    assertFalse(source.closed.get());
  }

  private void start() {
    runner = new Thread(() -> {
      try {
        pipeline.run();
      } catch (Throwable t) {
        runFailure.set(t);
      }
    }, "ingest-test-runner");
    runner.start();
  }

  private static MeshFixtures.PacketBuilder position(long packetId) {
    return MeshFixtures.packet(packetId, SENDER)
        .payload(MessageKind.POSITION, MeshFixtures.position(37.0, -122.0, 12, 0L));
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("condition not met within 10s");
      }
      Thread.sleep(10);
    }
  }

  private static final class QueueSource implements MessageSource {
    private final BlockingQueue<RawMessage> messages = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean failOnStart;

    void offer(RawMessage message) {
      messages.add(message);
    }

    @Override
    public void start() throws Exception {
      if (failOnStart) {
        throw new IllegalStateException("broker refused");
      }
    }

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
