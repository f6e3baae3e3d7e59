package ca.gc.cra.meshradar.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each meshradar CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (ingest, top, graph)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "ingest" -> buildIngestDefaults();
      case "top" -> buildTopDefaults();
      case "graph" -> buildGraphDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    StoreSettings store = StoreSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("jdbcUrl", "");
    map.put("jdbcUser", "");
    map.put("jdbcPassword", "");
    map.put("jdbcPoolSize", Integer.toString(store.jdbcPoolSize()));
    map.put("storeTimeoutMillis", Long.toString(store.retryPolicy().timeoutMillis()));
    map.put("storeMaxAttempts", Integer.toString(store.retryPolicy().maxAttempts()));
    map.put("storeRetryBackoffMillis", Long.toString(store.retryPolicy().backoffMillis()));
    map.put("storeDegradedThreshold", Integer.toString(store.retryPolicy().degradedThreshold()));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildIngestDefaults() {
    IngestConfig defaults = IngestConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("source", defaults.source().name());
    map.put("brokerUrl", defaults.brokerUrl());
    map.put("username", defaults.username().orElse(""));
    map.put("password", defaults.password().orElse(""));
    map.put("clientId", defaults.clientId());
    map.put("topics", String.join(",", defaults.topics()));
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", defaults.kafkaTopic());
    map.put("kafkaGroupId", defaults.kafkaGroupId());
    map.put("topicLayout", defaults.topicLayout());
    map.put("channelKeys", String.join(",", defaults.channelKeys()));
    map.put("ignoredSenders", Long.toString(IngestConfig.DEFAULT_IGNORED_SENDER));
    map.put("reconnectInitialMillis", Long.toString(defaults.reconnectInitialMillis()));
    map.put("reconnectMaxMillis", Long.toString(defaults.reconnectMaxMillis()));
    map.put("connectTimeoutSeconds", Integer.toString(defaults.connectTimeoutSeconds()));
    map.put("keepAliveSeconds", Integer.toString(defaults.keepAliveSeconds()));
    map.put("ingressQueueCapacity", Integer.toString(defaults.ingressQueueCapacity()));
    map.put("decodeWorkers", Integer.toString(defaults.pipeline().decodeWorkers()));
    map.put("storeWorkers", Integer.toString(defaults.pipeline().storeWorkers()));
    map.put("storeQueueCapacity", Integer.toString(defaults.pipeline().queueCapacity()));
    map.put("storeQueueType", defaults.pipeline().queueType().name());
    map.put("hubQueueCapacity", Integer.toString(defaults.hubQueueCapacity()));
    map.put("store", defaults.store().mode().name());
    map.put("tail", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildTopDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("store", StoreMode.JDBC.name());
    map.put("since", Integer.toString(QueryConfig.DEFAULT_SINCE_HOURS));
    map.put("limit", Integer.toString(QueryConfig.DEFAULT_LIMIT));
    map.put("node", "");
    map.put("channel", "");
    return map;
  }

  private static Map<String, String> buildGraphDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("store", StoreMode.JDBC.name());
    map.put("since", Integer.toString(QueryConfig.DEFAULT_SINCE_HOURS));
    map.put("limit", "1000");
    return map;
  }
}
