package ca.gc.cra.meshradar.config;

import java.util.Locale;

/** Mesh store backend. */
public enum StoreMode {
  /** Heap store; contents are lost on exit. */
  MEMORY,
  /** JDBC store pooled with HikariCP. */
  JDBC;

  static StoreMode parse(String raw, StoreMode fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("store must be MEMORY or JDBC (was '" + raw + "')", ex);
    }
  }
}
