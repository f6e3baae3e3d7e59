package ca.gc.cra.meshradar.config;

import ca.gc.cra.meshradar.infrastructure.persistence.RetryingMeshStore.RetryPolicy;
import ca.gc.cra.meshradar.validation.Strings;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Store backend selection, JDBC pool settings and the write retry policy.
 *
 * @param mode backend
 * @param jdbcUrl JDBC URL; required for {@link StoreMode#JDBC}
 * @param jdbcUser database user
 * @param jdbcPassword database password
 * @param jdbcPoolSize maximum HikariCP pool size
 * @param retryPolicy write timeout and retry policy
 * @since 0.1.0
 */
public record StoreSettings(
    StoreMode mode,
    Optional<String> jdbcUrl,
    Optional<String> jdbcUser,
    Optional<String> jdbcPassword,
    int jdbcPoolSize,
    RetryPolicy retryPolicy) {

  static final int DEFAULT_POOL_SIZE = 8;

  public StoreSettings {
    mode = Objects.requireNonNullElse(mode, StoreMode.MEMORY);
    jdbcUrl = Objects.requireNonNullElse(jdbcUrl, Optional.<String>empty());
    jdbcUser = Objects.requireNonNullElse(jdbcUser, Optional.<String>empty());
    jdbcPassword = Objects.requireNonNullElse(jdbcPassword, Optional.<String>empty());
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    if (jdbcPoolSize < 1) {
      throw new IllegalArgumentException("jdbcPoolSize must be positive");
    }
    if (mode == StoreMode.JDBC && jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("jdbcUrl is required when store=JDBC");
    }
    jdbcUrl.ifPresent(url -> {
      if (!url.startsWith("jdbc:")) {
        throw new IllegalArgumentException("jdbcUrl must start with jdbc:");
      }
    });
  }

  public static StoreSettings defaults() {
    return new StoreSettings(
        StoreMode.MEMORY, Optional.empty(), Optional.empty(), Optional.empty(), DEFAULT_POOL_SIZE,
        RetryPolicy.defaults());
  }

  /**
   * Reads store keys ({@code store}, {@code jdbcUrl}, {@code jdbcUser}, {@code jdbcPassword}, {@code jdbcPoolSize},
   * {@code storeTimeoutMillis}, {@code storeMaxAttempts}, {@code storeRetryBackoffMillis},
   * {@code storeDegradedThreshold}).
   *
   * @param options flattened configuration
   * @param fallbackMode backend used when {@code store} is absent
   * @return settings
   */
  public static StoreSettings fromMap(Map<String, String> options, StoreMode fallbackMode) {
    RetryPolicy retry = RetryPolicy.defaults();
    long backoff = ConfigValues.boundedLong(options, "storeRetryBackoffMillis", retry.backoffMillis(), 0, 60_000);
    RetryPolicy policy = new RetryPolicy(
        ConfigValues.boundedLong(options, "storeTimeoutMillis", retry.timeoutMillis(), 1, 600_000),
        ConfigValues.boundedInt(options, "storeMaxAttempts", retry.maxAttempts(), 1, 20),
        backoff,
        Math.max(backoff, retry.maxBackoffMillis()),
        ConfigValues.boundedInt(options, "storeDegradedThreshold", retry.degradedThreshold(), 1, 10_000));
    return new StoreSettings(
        StoreMode.parse(options.get("store"), fallbackMode),
        ConfigValues.optional(options, "jdbcUrl"),
        ConfigValues.optional(options, "jdbcUser"),
        ConfigValues.optional(options, "jdbcPassword"),
        ConfigValues.boundedInt(options, "jdbcPoolSize", DEFAULT_POOL_SIZE, 1, 256),
        policy);
  }

  /** JDBC URL with any {@code password=} parameter masked, for logs and dry-run output. */
  public String describeJdbcUrl() {
    return jdbcUrl.map(url -> url.replaceAll("(?i)(password=)[^;&]*", "$1****")).orElse("<none>");
  }

  String requireJdbcUrl() {
    return Strings.requireNonBlank("jdbcUrl", jdbcUrl.orElse(null));
  }

  @Override
  public String toString() {
    return "StoreSettings[mode=" + mode + ", jdbcUrl=" + describeJdbcUrl() + ", jdbcUser=" + jdbcUser.orElse("<none>")
        + ", jdbcPassword=" + (jdbcPassword.isPresent() ? "****" : "<none>") + ", jdbcPoolSize=" + jdbcPoolSize
        + ", retryPolicy=" + retryPolicy + "]";
  }
}
