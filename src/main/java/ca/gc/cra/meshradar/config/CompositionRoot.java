package ca.gc.cra.meshradar.config;

import ca.gc.cra.meshradar.adapter.kafka.KafkaBridgeMessageSource;
import ca.gc.cra.meshradar.application.health.PipelineHealth;
import ca.gc.cra.meshradar.application.hub.LiveHub;
import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase;
import ca.gc.cra.meshradar.application.pipeline.PacketProcessor;
import ca.gc.cra.meshradar.application.port.ClockPort;
import ca.gc.cra.meshradar.application.port.EnvelopeDecoderPort;
import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.application.port.MessageSource;
import ca.gc.cra.meshradar.application.port.MetricsPort;
import ca.gc.cra.meshradar.application.port.PayloadDecoderPort;
import ca.gc.cra.meshradar.application.query.GraphAggregator;
import ca.gc.cra.meshradar.application.query.TopTrafficAggregator;
import ca.gc.cra.meshradar.domain.error.TransportException;
import ca.gc.cra.meshradar.infrastructure.decode.ChannelCipher;
import ca.gc.cra.meshradar.infrastructure.decode.ServiceEnvelopeDecoder;
import ca.gc.cra.meshradar.infrastructure.decode.TopicLayout;
import ca.gc.cra.meshradar.infrastructure.decode.kind.PayloadDecoders;
import ca.gc.cra.meshradar.infrastructure.persistence.RetryingMeshStore;
import ca.gc.cra.meshradar.infrastructure.persistence.jdbc.JdbcMeshStore;
import ca.gc.cra.meshradar.infrastructure.persistence.memory.InMemoryMeshStore;
import ca.gc.cra.meshradar.infrastructure.transport.ExponentialBackoff;
import ca.gc.cra.meshradar.infrastructure.transport.PahoBrokerClient;
import ca.gc.cra.meshradar.infrastructure.transport.TransportListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the ingest pipeline and the query aggregators to
 * concrete adapters.
 * <p><strong>Role:</strong> Translates {@link IngestConfig} into a runnable {@link IngestPipelineUseCase} and owns
 * the stores it opens.</p>
 * <p><strong>Thread-safety:</strong> Construct and wire on a single thread during startup. The shared
 * {@link PipelineHealth} and {@link LiveHub} instances are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final IngestConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final PipelineHealth health;
  private final LiveHub hub;
  private final PayloadDecoderPort payloads = new PayloadDecoders();
  private final List<MeshStorePort> ownedStores = new ArrayList<>();

  /**
   * Creates a composition root using the system clock.
   *
   * @param config ingest configuration
   * @param metrics metrics sink shared by every stage
   */
  public CompositionRoot(IngestConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with an explicit clock.
   *
   * @param config ingest configuration
   * @param metrics metrics sink shared by every stage
   * @param clock receive-time source
   */
  public CompositionRoot(IngestConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.health = new PipelineHealth(metrics);
    this.hub = new LiveHub(config.hubQueueCapacity(), health);
  }

  public LiveHub hub() {
    return hub;
  }

  /**
   * Builds the full ingest pipeline: message source, envelope decoder, store stage, live hub.
   *
   * @return pipeline ready to {@link IngestPipelineUseCase#run()}
   * @throws TransportException if the MQTT client cannot be created for the configured broker
   */
  public IngestPipelineUseCase ingestPipeline() throws TransportException {
    PacketProcessor processor = packetProcessor();
    return new IngestPipelineUseCase(messageSource(), envelopeDecoder(), processor, health, config.pipeline());
  }

  /**
   * Builds the ingest pipeline over a caller-supplied source.
   *
   * @param source message source
   * @return pipeline ready to run
   */
  public IngestPipelineUseCase ingestPipeline(MessageSource source) {
    Objects.requireNonNull(source, "source");
    PacketProcessor processor = packetProcessor();
    return new IngestPipelineUseCase(source, envelopeDecoder(), processor, health, config.pipeline());
  }

  /**
   * Creates the envelope decoder for the configured topic layout, channel keys and ignored senders.
   *
   * @return decoder
   */
  public EnvelopeDecoderPort envelopeDecoder() {
    return new ServiceEnvelopeDecoder(
        TopicLayout.parse(config.topicLayout()),
        ChannelCipher.fromBase64(config.channelKeys()),
        config.ignoredSenders(),
        health);
  }

  /**
   * Creates the configured message source.
   *
   * @return MQTT listener or Kafka bridge source
   * @throws TransportException if the MQTT client rejects the broker settings
   */
  public MessageSource messageSource() throws TransportException {
    return switch (config.source()) {
      case MQTT -> new TransportListener(
          new PahoBrokerClient(new PahoBrokerClient.Settings(
              config.brokerUrl(),
              config.clientId(),
              config.username().orElse(null),
              config.password().orElse(null),
              config.connectTimeoutSeconds(),
              config.keepAliveSeconds())),
          config.topics(),
          config.ingressQueueCapacity(),
          new ExponentialBackoff(config.reconnectInitialMillis(), config.reconnectMaxMillis()),
          health,
          clock);
      case KAFKA -> new KafkaBridgeMessageSource(
          config.kafkaBootstrap().orElseThrow(
              () -> new IllegalArgumentException("kafkaBootstrap is required when source=KAFKA")),
          config.kafkaTopic(),
          config.kafkaGroupId(),
          clock,
          metrics);
    };
  }

  private PacketProcessor packetProcessor() {
    StoreSettings store = config.store();
    MeshStorePort writes;
    MeshQueryPort reads;
    if (store.mode() == StoreMode.JDBC) {
      JdbcMeshStore jdbc = openJdbcStore(store);
      writes = jdbc;
      reads = jdbc;
    } else {
      InMemoryMeshStore memory = new InMemoryMeshStore();
      writes = memory;
      reads = memory;
    }
    RetryingMeshStore retrying =
        new RetryingMeshStore(writes, store.retryPolicy(), config.pipeline().storeWorkers(), health);
    ownedStores.add(retrying);
    log.info("Mesh store ready: {}", store.mode() == StoreMode.JDBC ? store.describeJdbcUrl() : "in-memory");
    return new PacketProcessor(retrying, reads, payloads, hub, health);
  }

  /**
   * Opens a pooled JDBC store from store settings.
   *
   * @param store settings; {@code jdbcUrl} must be present
   * @return open store owning its connection pool
   */
  public static JdbcMeshStore openJdbcStore(StoreSettings store) {
    Objects.requireNonNull(store, "store");
    return JdbcMeshStore.open(
        store.requireJdbcUrl(),
        store.jdbcUser().orElse(null),
        store.jdbcPassword().orElse(null),
        store.jdbcPoolSize(),
        Math.max(250L, store.retryPolicy().timeoutMillis()));
  }

  /**
   * Creates the top-traffic aggregator over a query store.
   *
   * @param query read side
   * @param clock window anchor
   * @return aggregator
   */
  public static TopTrafficAggregator topTraffic(MeshQueryPort query, ClockPort clock) {
    return new TopTrafficAggregator(query, clock);
  }

  /**
   * Creates the graph aggregator over a query store.
   *
   * @param query read side
   * @param metrics sink for unreadable stored payloads
   * @return aggregator
   */
  public static GraphAggregator graph(MeshQueryPort query, MetricsPort metrics) {
    return new GraphAggregator(query, new PayloadDecoders(), metrics);
  }

  /** Closes the live hub and every store this root opened. */
  @Override
  public void close() {
    hub.close();
    for (MeshStorePort store : ownedStores) {
      store.close();
    }
    ownedStores.clear();
  }
}
