package ca.gc.cra.meshradar.infrastructure.persistence.jdbc;

import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.Position;
import ca.gc.cra.meshradar.domain.mesh.TelemetrySnapshot;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;

/**
 * Column mapping of each {@link NodeField}: value columns plus one {@code *_at} stamp column. Values are checked
 * against the field's type before they are bound.
 */
abstract class NodeColumns {
  private static final NodeColumns POSITION = new PositionColumns();
  private static final NodeColumns TELEMETRY = new TelemetryColumns();

  private static final Map<NodeField<?>, NodeColumns> BY_FIELD = Map.of(
      NodeField.LONG_NAME, new TextColumns(NodeField.LONG_NAME),
      NodeField.SHORT_NAME, new TextColumns(NodeField.SHORT_NAME),
      NodeField.HW_MODEL, new TextColumns(NodeField.HW_MODEL),
      NodeField.ROLE, new TextColumns(NodeField.ROLE),
      NodeField.FIRMWARE, new TextColumns(NodeField.FIRMWARE),
      NodeField.CHANNEL, new TextColumns(NodeField.CHANNEL),
      NodeField.LAST_POSITION, POSITION,
      NodeField.LAST_TELEMETRY, TELEMETRY);

  private final List<String> columns;
  private final String stampColumn;

  NodeColumns(List<String> columns, String stampColumn) {
    this.columns = List.copyOf(columns);
    this.stampColumn = stampColumn;
  }

  static NodeColumns of(NodeField<?> field) {
    NodeColumns columns = BY_FIELD.get(field);
    if (columns == null) {
      throw new IllegalArgumentException("No column mapping for node field " + field);
    }
    return columns;
  }

  String stampColumn() {
    return stampColumn;
  }

  /**
   * Guarded update: writes the value only when the stored stamp is absent or not newer.
   *
   * @return SQL with parameters (values..., stamp, lastSeenCandidate, nodeId, stamp)
   */
  String guardedUpdateSql() {
    StringBuilder sql = new StringBuilder("UPDATE node SET ");
    for (String column : columns) {
      sql.append(column).append(" = ?, ");
    }
    sql.append(stampColumn).append(" = ?, last_seen = GREATEST(last_seen, ?) WHERE node_id = ? AND (")
        .append(stampColumn).append(" IS NULL OR ").append(stampColumn).append(" <= ?)");
    return sql.toString();
  }

  /**
   * Binds the value columns starting at {@code index}.
   *
   * @return next free parameter index
   * @throws ClassCastException when the value does not match the mapped field's type
   */
  abstract int bind(PreparedStatement statement, int index, Object value) throws SQLException;

  /**
   * Reads the value when its stamp column is set.
   *
   * @return value, or {@code null} when absent
   */
  abstract Object read(ResultSet rs) throws SQLException;

  static Integer getInteger(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }

  static Long getLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  static Float getFloat(ResultSet rs, String column) throws SQLException {
    float value = rs.getFloat(column);
    return rs.wasNull() ? null : value;
  }

  static void setNullable(PreparedStatement statement, int index, Number value, int sqlType) throws SQLException {
    if (value == null) {
      statement.setNull(index, sqlType);
    } else {
      statement.setObject(index, value, sqlType);
    }
  }

  /** Columns of one typed field; binding goes through {@link NodeField#cast}. */
  private abstract static class TypedColumns<T> extends NodeColumns {
    private final NodeField<T> field;

    TypedColumns(NodeField<T> field, List<String> columns, String stampColumn) {
      super(columns, stampColumn);
      this.field = field;
    }

    @Override
    final int bind(PreparedStatement statement, int index, Object value) throws SQLException {
      return bindValue(statement, index, field.cast(value));
    }

    @Override
    abstract T read(ResultSet rs) throws SQLException;

    abstract int bindValue(PreparedStatement statement, int index, T value) throws SQLException;
  }

  private static final class TextColumns extends TypedColumns<String> {
    private final String column;

    TextColumns(NodeField<String> field) {
      super(field, List.of(field.name()), field.name() + "_at");
      this.column = field.name();
    }

    @Override
    int bindValue(PreparedStatement statement, int index, String value) throws SQLException {
      statement.setString(index, value);
      return index + 1;
    }

    @Override
    String read(ResultSet rs) throws SQLException {
      return rs.getString(column);
    }
  }

  private static final class PositionColumns extends TypedColumns<Position> {
    PositionColumns() {
      super(NodeField.LAST_POSITION, List.of("latitude", "longitude", "altitude"), "last_position_at");
    }

    @Override
    int bindValue(PreparedStatement statement, int index, Position value) throws SQLException {
      statement.setDouble(index, value.latitude());
      statement.setDouble(index + 1, value.longitude());
      setNullable(statement, index + 2, value.altitude(), Types.INTEGER);
      return index + 3;
    }

    @Override
    Position read(ResultSet rs) throws SQLException {
      return new Position(rs.getDouble("latitude"), rs.getDouble("longitude"), getInteger(rs, "altitude"));
    }
  }

  private static final class TelemetryColumns extends TypedColumns<TelemetrySnapshot> {
    TelemetryColumns() {
      super(NodeField.LAST_TELEMETRY, List.of(
          "battery_level",
          "voltage",
          "channel_utilization",
          "air_util_tx",
          "uptime_seconds",
          "temperature",
          "relative_humidity",
          "barometric_pressure"), "last_telemetry_at");
    }

    @Override
    int bindValue(PreparedStatement statement, int index, TelemetrySnapshot value) throws SQLException {
      setNullable(statement, index, value.batteryLevel(), Types.INTEGER);
      setNullable(statement, index + 1, value.voltage(), Types.REAL);
      setNullable(statement, index + 2, value.channelUtilization(), Types.REAL);
      setNullable(statement, index + 3, value.airUtilTx(), Types.REAL);
      setNullable(statement, index + 4, value.uptimeSeconds(), Types.BIGINT);
      setNullable(statement, index + 5, value.temperature(), Types.REAL);
      setNullable(statement, index + 6, value.relativeHumidity(), Types.REAL);
      setNullable(statement, index + 7, value.barometricPressure(), Types.REAL);
      return index + 8;
    }

    @Override
    TelemetrySnapshot read(ResultSet rs) throws SQLException {
      return new TelemetrySnapshot(
          getInteger(rs, "battery_level"),
          getFloat(rs, "voltage"),
          getFloat(rs, "channel_utilization"),
          getFloat(rs, "air_util_tx"),
          getLong(rs, "uptime_seconds"),
          getFloat(rs, "temperature"),
          getFloat(rs, "relative_humidity"),
          getFloat(rs, "barometric_pressure"));
    }
  }
}
