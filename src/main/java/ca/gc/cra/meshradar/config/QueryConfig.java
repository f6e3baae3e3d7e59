package ca.gc.cra.meshradar.config;

import ca.gc.cra.meshradar.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Configuration for the read-side {@code top} and {@code graph} commands.
 *
 * @param store store to query; must be {@link StoreMode#JDBC}
 * @param window look-back window ({@code since}, in hours)
 * @param limit maximum rows printed
 * @param node optional node restricting {@code top} to one node's per-kind traffic
 * @param channel optional channel filtering the active node count
 * @since 0.1.0
 */
public record QueryConfig(
    StoreSettings store, Duration window, int limit, OptionalLong node, Optional<String> channel) {

  static final int DEFAULT_SINCE_HOURS = 24;
  static final int DEFAULT_LIMIT = 20;

  public QueryConfig {
    Objects.requireNonNull(store, "store");
    if (store.mode() != StoreMode.JDBC) {
      throw new IllegalArgumentException("queries require store=JDBC");
    }
    Objects.requireNonNull(window, "window");
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("since must be positive");
    }
    Numbers.requireRange("limit", limit, 1, 10_000);
    node = Objects.requireNonNullElse(node, OptionalLong.empty());
    channel = Objects.requireNonNullElse(channel, Optional.<String>empty());
  }

  /**
   * Builds query settings from flattened key/value options.
   *
   * @param options merged configuration map; {@code jdbcUrl} is required
   * @return validated configuration
   * @throws IllegalArgumentException when {@code jdbcUrl} is missing or a value is out of range
   */
  public static QueryConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    int hours = ConfigValues.boundedInt(options, "since", DEFAULT_SINCE_HOURS, 1, 24 * 365);
    OptionalLong node = ConfigValues.optional(options, "node")
        .map(raw -> OptionalLong.of(Numbers.parseNodeNumber("node", raw)))
        .orElse(OptionalLong.empty());
    return new QueryConfig(
        StoreSettings.fromMap(options, StoreMode.JDBC),
        Duration.ofHours(hours),
        ConfigValues.boundedInt(options, "limit", DEFAULT_LIMIT, 1, 10_000),
        node,
        ConfigValues.optional(options, "channel"));
  }
}
