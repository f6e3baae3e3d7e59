package ca.gc.cra.meshradar.config;

import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase.PipelineSettings;
import ca.gc.cra.meshradar.application.pipeline.IngestPipelineUseCase.QueueType;
import ca.gc.cra.meshradar.infrastructure.decode.ChannelCipher;
import ca.gc.cra.meshradar.infrastructure.decode.TopicLayout;
import ca.gc.cra.meshradar.logging.Logs;
import ca.gc.cra.meshradar.validation.Net;
import ca.gc.cra.meshradar.validation.Numbers;
import ca.gc.cra.meshradar.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Configuration for the {@code ingest} pipeline: message source, topic decoding, queue and
 * worker sizing, and the store backend.
 * <p><strong>Role:</strong> Built by the ingest CLI from the merged defaults, YAML and CLI map.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param source message source
 * @param brokerUrl MQTT broker URI ({@code tcp://} or {@code ssl://})
 * @param username optional MQTT username
 * @param password optional MQTT password
 * @param clientId MQTT client id
 * @param topics MQTT topic filters subscribed as one logical subscription
 * @param kafkaBootstrap Kafka bootstrap servers; required for {@link SourceMode#KAFKA}
 * @param kafkaTopic Kafka bridge topic
 * @param kafkaGroupId Kafka consumer group
 * @param topicLayout slash-delimited pattern locating gateway and channel in a topic
 * @param channelKeys base64 channel keys tried on encrypted packets
 * @param ignoredSenders sender node numbers whose packets are skipped
 * @param reconnectInitialMillis first reconnect delay
 * @param reconnectMaxMillis reconnect delay ceiling
 * @param connectTimeoutSeconds MQTT connect timeout
 * @param keepAliveSeconds MQTT keep-alive interval
 * @param ingressQueueCapacity bound of the drop-oldest ingress queue
 * @param pipeline decode and store worker sizing
 * @param hubQueueCapacity per-subscriber live hub queue bound
 * @param store store backend and retry policy
 * @since 0.1.0
 */
public record IngestConfig(
    SourceMode source,
    String brokerUrl,
    Optional<String> username,
    Optional<String> password,
    String clientId,
    List<String> topics,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    String kafkaGroupId,
    String topicLayout,
    List<String> channelKeys,
    Set<Long> ignoredSenders,
    long reconnectInitialMillis,
    long reconnectMaxMillis,
    int connectTimeoutSeconds,
    int keepAliveSeconds,
    int ingressQueueCapacity,
    PipelineSettings pipeline,
    int hubQueueCapacity,
    StoreSettings store) {

  static final String DEFAULT_BROKER_URL = "tcp://mqtt.meshtastic.org:1883";
  static final String DEFAULT_USERNAME = "meshdev";
  static final String DEFAULT_PASSWORD = "large4cats";
  static final String DEFAULT_CLIENT_ID = "meshradar-ingest";
  static final String DEFAULT_TOPICS = "msh/US/CA/#";
  static final String DEFAULT_KAFKA_TOPIC = "meshradar.mqtt";
  static final String DEFAULT_KAFKA_GROUP = "meshradar-ingest";
  static final long DEFAULT_IGNORED_SENDER = 2_144_342_101L;
  static final int DEFAULT_INGRESS_CAPACITY = 10_000;
  static final int DEFAULT_HUB_CAPACITY = 256;

  public IngestConfig {
    source = Objects.requireNonNullElse(source, SourceMode.MQTT);
    brokerUrl = Net.validateBrokerUri(brokerUrl);
    username = Objects.requireNonNullElse(username, Optional.<String>empty());
    password = Objects.requireNonNullElse(password, Optional.<String>empty());
    clientId = Strings.requirePrintableAscii("clientId", clientId, 64);
    topics = sanitizeTopics(topics);
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.<String>empty()).map(Net::validateHostPortList);
    kafkaTopic = Strings.sanitizeKafkaTopic("kafkaTopic", kafkaTopic);
    kafkaGroupId = Strings.requirePrintableAscii("kafkaGroupId", kafkaGroupId, 128);
    topicLayout = TopicLayout.parse(topicLayout).pattern();
    channelKeys = List.copyOf(Objects.requireNonNull(channelKeys, "channelKeys"));
    ChannelCipher.fromBase64(channelKeys);
    ignoredSenders = Set.copyOf(Objects.requireNonNull(ignoredSenders, "ignoredSenders"));
    Numbers.requireRange("reconnectInitialMillis", reconnectInitialMillis, 1, 3_600_000);
    Numbers.requireRange("reconnectMaxMillis", reconnectMaxMillis, reconnectInitialMillis, 3_600_000);
    Numbers.requireRange("connectTimeoutSeconds", connectTimeoutSeconds, 1, 600);
    Numbers.requireRange("keepAliveSeconds", keepAliveSeconds, 0, 3_600);
    Numbers.requireRange("ingressQueueCapacity", ingressQueueCapacity, 1, 1_000_000);
    pipeline = Objects.requireNonNullElse(pipeline, PipelineSettings.defaults());
    Numbers.requireRange("hubQueueCapacity", hubQueueCapacity, 1, 100_000);
    store = Objects.requireNonNullElse(store, StoreSettings.defaults());
    if (source == SourceMode.KAFKA && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when source=KAFKA");
    }
  }

  /**
   * Returns defaults targeting the public mesh broker with an in-memory store.
   *
   * @return default configuration
   */
  public static IngestConfig defaults() {
    return new IngestConfig(
        SourceMode.MQTT,
        DEFAULT_BROKER_URL,
        Optional.of(DEFAULT_USERNAME),
        Optional.of(DEFAULT_PASSWORD),
        DEFAULT_CLIENT_ID,
        List.of(DEFAULT_TOPICS),
        Optional.empty(),
        DEFAULT_KAFKA_TOPIC,
        DEFAULT_KAFKA_GROUP,
        TopicLayout.DEFAULT_PATTERN,
        List.of(ChannelCipher.DEFAULT_KEY),
        Set.of(DEFAULT_IGNORED_SENDER),
        1_000L,
        30_000L,
        10,
        60,
        DEFAULT_INGRESS_CAPACITY,
        PipelineSettings.defaults(),
        DEFAULT_HUB_CAPACITY,
        StoreSettings.defaults());
  }

  /**
   * Builds configuration from flattened key/value options. Absent keys fall back to {@link #defaults()}.
   *
   * @param options merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when any value is malformed or out of range
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    IngestConfig d = defaults();
    PipelineSettings pd = d.pipeline();

    List<String> topics = options.containsKey("topics")
        ? Strings.splitList(options.get("topics"))
        : d.topics();
    List<String> keys = options.containsKey("channelKeys")
        ? Strings.splitList(options.get("channelKeys"))
        : d.channelKeys();
    Set<Long> ignored = options.containsKey("ignoredSenders")
        ? parseNodeSet("ignoredSenders", options.get("ignoredSenders"))
        : d.ignoredSenders();

    PipelineSettings pipeline = new PipelineSettings(
        ConfigValues.boundedInt(options, "decodeWorkers", pd.decodeWorkers(), 1, 256),
        ConfigValues.boundedInt(options, "storeWorkers", pd.storeWorkers(), 1, 256),
        ConfigValues.boundedInt(options, "storeQueueCapacity", pd.queueCapacity(), 1, 1_000_000),
        parseQueueType(options.get("storeQueueType"), pd.queueType()));

    return new IngestConfig(
        SourceMode.parse(options.get("source"), d.source()),
        ConfigValues.string(options, "brokerUrl", d.brokerUrl()),
        optionalOrDefault(options, "username", d.username()),
        optionalOrDefault(options, "password", d.password()),
        ConfigValues.string(options, "clientId", d.clientId()),
        topics,
        ConfigValues.optional(options, "kafkaBootstrap"),
        ConfigValues.string(options, "kafkaTopic", d.kafkaTopic()),
        ConfigValues.string(options, "kafkaGroupId", d.kafkaGroupId()),
        ConfigValues.string(options, "topicLayout", d.topicLayout()),
        keys,
        ignored,
        ConfigValues.boundedLong(options, "reconnectInitialMillis", d.reconnectInitialMillis(), 1, 3_600_000),
        ConfigValues.boundedLong(options, "reconnectMaxMillis", d.reconnectMaxMillis(), 1, 3_600_000),
        ConfigValues.boundedInt(options, "connectTimeoutSeconds", d.connectTimeoutSeconds(), 1, 600),
        ConfigValues.boundedInt(options, "keepAliveSeconds", d.keepAliveSeconds(), 0, 3_600),
        ConfigValues.boundedInt(options, "ingressQueueCapacity", d.ingressQueueCapacity(), 1, 1_000_000),
        pipeline,
        ConfigValues.boundedInt(options, "hubQueueCapacity", d.hubQueueCapacity(), 1, 100_000),
        StoreSettings.fromMap(options, StoreMode.MEMORY));
  }

  /** Renders the credential-free settings as plan lines for {@code --dry-run}. */
  public List<String> describe() {
    List<String> lines = new ArrayList<>();
    lines.add("source=" + source);
    if (source == SourceMode.MQTT) {
      lines.add("brokerUrl=" + brokerUrl);
      lines.add("clientId=" + clientId);
      lines.add("username=" + username.orElse("<none>"));
      lines.add("password=" + password.map(Logs::redact).orElse("<none>"));
      lines.add("topics=" + String.join(",", topics));
      lines.add("reconnect=" + reconnectInitialMillis + "ms.." + reconnectMaxMillis + "ms");
    } else {
      lines.add("kafkaBootstrap=" + kafkaBootstrap.orElse("<none>"));
      lines.add("kafkaTopic=" + kafkaTopic);
      lines.add("kafkaGroupId=" + kafkaGroupId);
    }
    lines.add("topicLayout=" + topicLayout);
    lines.add("channelKeys=" + channelKeys.size());
    lines.add("ignoredSenders=" + ignoredSenders.size());
    lines.add("ingressQueueCapacity=" + ingressQueueCapacity);
    lines.add("decodeWorkers=" + pipeline.decodeWorkers() + ", storeWorkers=" + pipeline.storeWorkers()
        + ", storeQueue=" + pipeline.queueType() + "(" + pipeline.queueCapacity() + ")");
    lines.add("hubQueueCapacity=" + hubQueueCapacity);
    lines.add("store=" + store.mode() + (store.mode() == StoreMode.JDBC ? " " + store.describeJdbcUrl() : ""));
    return List.copyOf(lines);
  }

  @Override
  public String toString() {
    return "IngestConfig" + describe();
  }

  private static Optional<String> optionalOrDefault(
      Map<String, String> options, String key, Optional<String> fallback) {
    if (!options.containsKey(key)) {
      return fallback;
    }
    return ConfigValues.optional(options, key);
  }

  private static List<String> sanitizeTopics(List<String> topics) {
    Objects.requireNonNull(topics, "topics");
    if (topics.isEmpty()) {
      throw new IllegalArgumentException("topics must name at least one filter");
    }
    List<String> sanitized = new ArrayList<>(topics.size());
    for (String topic : topics) {
      sanitized.add(Strings.requireTopicFilter("topics", topic));
    }
    return List.copyOf(sanitized);
  }

  static Set<Long> parseNodeSet(String key, String raw) {
    Set<Long> nodes = new LinkedHashSet<>();
    for (String token : Strings.splitList(raw)) {
      nodes.add(Numbers.parseNodeNumber(key, token));
    }
    return Set.copyOf(nodes);
  }

  private static QueueType parseQueueType(String raw, QueueType fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return QueueType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("storeQueueType must be ARRAY or LINKED (was '" + raw + "')", ex);
    }
  }
}
