package ca.gc.cra.meshradar.infrastructure.persistence.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL for the four mesh tables and their read-path indexes. Statements are idempotent.
 */
final class JdbcSchema {
  static final List<String> STATEMENTS = List.of(
      "CREATE TABLE IF NOT EXISTS node ("
          + "node_id BIGINT PRIMARY KEY,"
          + "hex_id VARCHAR(9) NOT NULL,"
          + "last_seen BIGINT NOT NULL,"
          + "long_name VARCHAR(255), long_name_at BIGINT,"
          + "short_name VARCHAR(32), short_name_at BIGINT,"
          + "hw_model VARCHAR(64), hw_model_at BIGINT,"
          + "role VARCHAR(64), role_at BIGINT,"
          + "firmware VARCHAR(64), firmware_at BIGINT,"
          + "channel VARCHAR, channel_at BIGINT,"
          + "latitude DOUBLE PRECISION, longitude DOUBLE PRECISION, altitude INTEGER, last_position_at BIGINT,"
          + "battery_level INTEGER, voltage REAL, channel_utilization REAL, air_util_tx REAL,"
          + "uptime_seconds BIGINT, temperature REAL, relative_humidity REAL, barometric_pressure REAL,"
          + "last_telemetry_at BIGINT)",
      "CREATE TABLE IF NOT EXISTS packet ("
          + "packet_id BIGINT NOT NULL,"
          + "from_node_id BIGINT NOT NULL,"
          + "to_node_id BIGINT NOT NULL,"
          + "channel VARCHAR NOT NULL,"
          + "kind VARCHAR(32),"
          + "port_num INTEGER NOT NULL,"
          + "payload VARBINARY(4096) NOT NULL,"
          + "decoded BOOLEAN NOT NULL,"
          + "import_time BIGINT NOT NULL,"
          + "PRIMARY KEY (packet_id, from_node_id))",
      "CREATE TABLE IF NOT EXISTS packet_seen ("
          + "packet_id BIGINT NOT NULL,"
          + "from_node_id BIGINT NOT NULL,"
          + "gateway_id VARCHAR NOT NULL,"
          + "rssi INTEGER,"
          + "snr REAL,"
          + "hop_limit INTEGER NOT NULL,"
          + "hop_start INTEGER NOT NULL,"
          + "rx_time BIGINT NOT NULL,"
          + "topic VARCHAR NOT NULL,"
          + "import_time BIGINT NOT NULL,"
          + "PRIMARY KEY (packet_id, from_node_id, gateway_id))",
      "CREATE TABLE IF NOT EXISTS traceroute ("
          + "packet_id BIGINT NOT NULL,"
          + "from_node_id BIGINT NOT NULL,"
          + "to_node_id BIGINT NOT NULL,"
          + "route VARCHAR(2048) NOT NULL,"
          + "snr_towards VARCHAR(2048) NOT NULL,"
          + "route_back VARCHAR(2048) NOT NULL,"
          + "snr_back VARCHAR(2048) NOT NULL,"
          + "done BOOLEAN NOT NULL,"
          + "gateway_id VARCHAR NOT NULL,"
          + "import_time BIGINT NOT NULL,"
          + "PRIMARY KEY (packet_id, from_node_id))",
      "CREATE INDEX IF NOT EXISTS idx_packet_from_time ON packet (from_node_id, import_time)",
      "CREATE INDEX IF NOT EXISTS idx_packet_kind_time ON packet (kind, import_time)",
      "CREATE INDEX IF NOT EXISTS idx_packet_time ON packet (import_time)",
      "CREATE INDEX IF NOT EXISTS idx_packet_seen_packet ON packet_seen (packet_id, from_node_id)",
      "CREATE INDEX IF NOT EXISTS idx_traceroute_packet ON traceroute (packet_id, from_node_id)",
      "CREATE INDEX IF NOT EXISTS idx_traceroute_time ON traceroute (import_time)",
      "CREATE INDEX IF NOT EXISTS idx_node_last_seen ON node (last_seen)");

  private JdbcSchema() {}

  static void apply(Connection connection) throws SQLException {
    try (Statement statement = connection.createStatement()) {
      for (String ddl : STATEMENTS) {
        statement.execute(ddl);
      }
    }
  }
}
