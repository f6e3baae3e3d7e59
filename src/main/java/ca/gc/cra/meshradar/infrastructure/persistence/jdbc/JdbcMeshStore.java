package ca.gc.cra.meshradar.infrastructure.persistence.jdbc;

import ca.gc.cra.meshradar.application.port.MeshQueryPort;
import ca.gc.cra.meshradar.application.port.MeshStorePort;
import ca.gc.cra.meshradar.domain.error.StoreException;
import ca.gc.cra.meshradar.domain.mesh.CanonicalPacket;
import ca.gc.cra.meshradar.domain.mesh.DecodedEnvelope;
import ca.gc.cra.meshradar.domain.mesh.KindCount;
import ca.gc.cra.meshradar.domain.mesh.MeshNode;
import ca.gc.cra.meshradar.domain.mesh.MessageKind;
import ca.gc.cra.meshradar.domain.mesh.NodeField;
import ca.gc.cra.meshradar.domain.mesh.NodeIds;
import ca.gc.cra.meshradar.domain.mesh.PacketObservation;
import ca.gc.cra.meshradar.domain.mesh.RecordOutcome;
import ca.gc.cra.meshradar.domain.mesh.Stamped;
import ca.gc.cra.meshradar.domain.mesh.Traceroute;
import ca.gc.cra.meshradar.domain.mesh.TrafficSummary;
import ca.gc.cra.meshradar.validation.Strings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Relational mesh store over a JDBC {@link DataSource}, pooled with HikariCP.
 * <p><strong>Why:</strong> Gives the ingest pipeline durable, queryable history that reporting commands can read while
 * ingestion is running.</p>
 * <p><strong>Thread-safety:</strong> Each call borrows its own connection. Uniqueness comes from primary keys, node
 * merges are guarded updates on the field stamp, and traceroute merges lock their row.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link StoreException}; connection-class and lock failures
 * are flagged transient so callers may retry.</p>
 *
 * @since 0.1.0
 */
public final class JdbcMeshStore implements MeshStorePort, MeshQueryPort {
  private static final Logger log = LoggerFactory.getLogger(JdbcMeshStore.class);

  static final String DUPLICATE_KEY_STATE = "23505";

  private static final String PACKET_COLUMNS =
      "packet_id, from_node_id, to_node_id, channel, kind, port_num, payload, decoded, import_time";
  private static final String TRACEROUTE_COLUMNS =
      "packet_id, from_node_id, to_node_id, route, snr_towards, route_back, snr_back, done, gateway_id, import_time";

  private final DataSource dataSource;
  private final HikariDataSource ownedPool;

  /**
   * Creates a store over a caller-managed data source and applies the schema.
   *
   * @param dataSource connection source; not closed by this store
   * @throws StoreException when the schema cannot be applied
   */
  public JdbcMeshStore(DataSource dataSource) {
    this(dataSource, null);
  }

  private JdbcMeshStore(DataSource dataSource, HikariDataSource ownedPool) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.ownedPool = ownedPool;
    try (Connection connection = dataSource.getConnection()) {
      JdbcSchema.apply(connection);
    } catch (SQLException ex) {
      throw translate("apply schema", ex);
    }
  }

  /**
   * Opens a pooled store that owns its HikariCP pool; {@link #close()} releases the pool.
   *
   * @param jdbcUrl JDBC URL
   * @param username user, or {@code null}
   * @param password password, or {@code null}
   * @param poolSize maximum pool size
   * @param connectionTimeoutMillis pool checkout timeout
   * @return open store
   */
  public static JdbcMeshStore open(
      String jdbcUrl, String username, String password, int poolSize, long connectionTimeoutMillis) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(Strings.requireNonBlank("jdbcUrl", jdbcUrl));
    if (username != null) {
      config.setUsername(username);
    }
    if (password != null) {
      config.setPassword(password);
    }
    config.setMaximumPoolSize(poolSize);
    config.setConnectionTimeout(connectionTimeoutMillis);
    config.setPoolName("meshradar-store");
    HikariDataSource pool;
    try {
      pool = new HikariDataSource(config);
    } catch (HikariPool.PoolInitializationException ex) {
      throw new StoreException("Cannot open connection pool for " + config.getJdbcUrl(), ex, true);
    }
    try {
      return new JdbcMeshStore(pool, pool);
    } catch (RuntimeException ex) {
      pool.close();
      throw ex;
    }
  }

  @Override
  public RecordOutcome recordPacket(DecodedEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    try (Connection connection = dataSource.getConnection()) {
      boolean packetCreated = insertPacket(connection, CanonicalPacket.from(envelope));
      boolean enriched = !packetCreated && envelope.decoded() && enrichPacket(connection, envelope);
      boolean observationCreated = insertObservation(connection, PacketObservation.from(envelope));
      return new RecordOutcome(packetCreated, observationCreated, enriched);
    } catch (SQLException ex) {
      throw translate("record packet " + envelope.key(), ex);
    }
  }

  private static boolean insertPacket(Connection connection, CanonicalPacket packet) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(
        "INSERT INTO packet (" + PACKET_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      ps.setLong(1, packet.packetId());
      ps.setLong(2, packet.fromNodeId());
      ps.setLong(3, packet.toNodeId());
      ps.setString(4, packet.channel());
      ps.setString(5, packet.kind() == null ? null : packet.kind().name());
      ps.setInt(6, packet.portNum());
      ps.setBytes(7, packet.payload());
      ps.setBoolean(8, packet.decoded());
      ps.setLong(9, packet.importTime());
      return insertUnlessDuplicate(ps);
    }
  }

  private static boolean enrichPacket(Connection connection, DecodedEnvelope envelope) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(
        "UPDATE packet SET kind = ?, port_num = ?, payload = ?, decoded = TRUE "
            + "WHERE packet_id = ? AND from_node_id = ? AND decoded = FALSE")) {
      ps.setString(1, envelope.kind().name());
      ps.setInt(2, envelope.portNum());
      ps.setBytes(3, envelope.innerPayload());
      ps.setLong(4, envelope.packetId());
      ps.setLong(5, envelope.fromNodeId());
      return ps.executeUpdate() == 1;
    }
  }

  private static boolean insertObservation(Connection connection, PacketObservation seen) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(
        "INSERT INTO packet_seen (packet_id, from_node_id, gateway_id, rssi, snr, hop_limit, hop_start, rx_time, "
            + "topic, import_time) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
      ps.setLong(1, seen.packetId());
      ps.setLong(2, seen.fromNodeId());
      ps.setString(3, seen.gatewayId());
      NodeColumns.setNullable(ps, 4, seen.rssi(), Types.INTEGER);
      NodeColumns.setNullable(ps, 5, seen.snr(), Types.REAL);
      ps.setInt(6, seen.hopLimit());
      ps.setInt(7, seen.hopStart());
      ps.setLong(8, seen.rxTime());
      ps.setString(9, seen.topic());
      ps.setLong(10, seen.importTime());
      return insertUnlessDuplicate(ps);
    }
  }

  /**
   * Executes an insert.
   *
   * @return {@code false} when the row already exists
   */
  private static boolean insertUnlessDuplicate(PreparedStatement ps) throws SQLException {
    try {
      ps.executeUpdate();
      return true;
    } catch (SQLException ex) {
      if (isDuplicateKey(ex)) {
        return false;
      }
      throw ex;
    }
  }

  static boolean isDuplicateKey(SQLException ex) {
    return DUPLICATE_KEY_STATE.equals(ex.getSQLState());
  }

  @Override
  public <T> MeshNode mergeObservation(long nodeId, NodeField<T> field, T value, long observedAt) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
    NodeColumns columns = NodeColumns.of(field);
    try (Connection connection = dataSource.getConnection()) {
      ensureNode(connection, nodeId, observedAt);
      int applied;
      try (PreparedStatement ps = connection.prepareStatement(columns.guardedUpdateSql())) {
        int index = columns.bind(ps, 1, value);
        ps.setLong(index, observedAt);
        ps.setLong(index + 1, observedAt);
        ps.setLong(index + 2, nodeId);
        ps.setLong(index + 3, observedAt);
        applied = ps.executeUpdate();
      }
      if (applied == 0) {
        log.trace("Stale {} for {} at {} ignored", field, NodeIds.toHex(nodeId), observedAt);
        bumpLastSeen(connection, nodeId, observedAt);
      }
      return loadNode(connection, nodeId)
          .orElseThrow(() -> new StoreException("Node " + NodeIds.toHex(nodeId) + " vanished", null, true));
    } catch (SQLException ex) {
      throw translate("merge " + field + " for " + NodeIds.toHex(nodeId), ex);
    }
  }

  @Override
  public MeshNode touchNode(long nodeId, long observedAt) {
    try (Connection connection = dataSource.getConnection()) {
      if (!ensureNode(connection, nodeId, observedAt)) {
        bumpLastSeen(connection, nodeId, observedAt);
      }
      return loadNode(connection, nodeId)
          .orElseThrow(() -> new StoreException("Node " + NodeIds.toHex(nodeId) + " vanished", null, true));
    } catch (SQLException ex) {
      throw translate("touch " + NodeIds.toHex(nodeId), ex);
    }
  }

  private static boolean ensureNode(Connection connection, long nodeId, long observedAt) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(
        "INSERT INTO node (node_id, hex_id, last_seen) VALUES (?, ?, ?)")) {
      ps.setLong(1, nodeId);
      ps.setString(2, NodeIds.toHex(nodeId));
      ps.setLong(3, observedAt);
      return insertUnlessDuplicate(ps);
    }
  }

  private static void bumpLastSeen(Connection connection, long nodeId, long observedAt) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(
        "UPDATE node SET last_seen = ? WHERE node_id = ? AND last_seen < ?")) {
      ps.setLong(1, observedAt);
      ps.setLong(2, nodeId);
      ps.setLong(3, observedAt);
      ps.executeUpdate();
    }
  }

  @Override
  public Traceroute.Merge recordTraceroute(Traceroute incoming) {
    Objects.requireNonNull(incoming, "incoming");
    try (Connection connection = dataSource.getConnection()) {
      boolean autoCommit = connection.getAutoCommit();
      connection.setAutoCommit(false);
      try {
        Traceroute.Merge merge = mergeTraceroute(connection, incoming);
        if (merge == null) {
          // lost the insert race; the row now exists and is merged under its lock
          connection.rollback();
          merge = mergeTraceroute(connection, incoming);
        }
        if (merge == null) {
          throw new StoreException("Traceroute " + incoming.key() + " insert kept colliding", null, true);
        }
        connection.commit();
        return merge;
      } catch (SQLException | RuntimeException ex) {
        connection.rollback();
        throw ex;
      } finally {
        connection.setAutoCommit(autoCommit);
      }
    } catch (SQLException ex) {
      throw translate("record traceroute " + incoming.key(), ex);
    }
  }

  /**
   * Merges under the row lock.
   *
   * @return merge result, or {@code null} when a concurrent insert won the race
   */
  private static Traceroute.Merge mergeTraceroute(Connection connection, Traceroute incoming) throws SQLException {
    Traceroute existing;
    try (PreparedStatement ps = connection.prepareStatement(
        "SELECT " + TRACEROUTE_COLUMNS + " FROM traceroute WHERE packet_id = ? AND from_node_id = ? FOR UPDATE")) {
      ps.setLong(1, incoming.packetId());
      ps.setLong(2, incoming.fromNodeId());
      try (ResultSet rs = ps.executeQuery()) {
        existing = rs.next() ? readTraceroute(rs) : null;
      }
    }
    Traceroute.Merge merge = Traceroute.merge(existing, incoming);
    Traceroute merged = merge.traceroute();
    if (existing == null) {
      try (PreparedStatement ps = connection.prepareStatement(
          "INSERT INTO traceroute (" + TRACEROUTE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
        ps.setLong(1, merged.packetId());
        ps.setLong(2, merged.fromNodeId());
        ps.setLong(3, merged.toNodeId());
        ps.setString(4, RouteCodec.encodeNodes(merged.route()));
        ps.setString(5, RouteCodec.encodeSnr(merged.snrTowards()));
        ps.setString(6, RouteCodec.encodeNodes(merged.routeBack()));
        ps.setString(7, RouteCodec.encodeSnr(merged.snrBack()));
        ps.setBoolean(8, merged.done());
        ps.setString(9, merged.gatewayId());
        ps.setLong(10, merged.importTime());
        return insertUnlessDuplicate(ps) ? merge : null;
      }
    }
    if (!merged.equals(existing)) {
      try (PreparedStatement ps = connection.prepareStatement(
          "UPDATE traceroute SET route = ?, snr_towards = ?, route_back = ?, snr_back = ?, done = ? "
              + "WHERE packet_id = ? AND from_node_id = ?")) {
        ps.setString(1, RouteCodec.encodeNodes(merged.route()));
        ps.setString(2, RouteCodec.encodeSnr(merged.snrTowards()));
        ps.setString(3, RouteCodec.encodeNodes(merged.routeBack()));
        ps.setString(4, RouteCodec.encodeSnr(merged.snrBack()));
        ps.setBoolean(5, merged.done());
        ps.setLong(6, merged.packetId());
        ps.setLong(7, merged.fromNodeId());
        ps.executeUpdate();
      }
    }
    return merge;
  }

  @Override
  public Optional<MeshNode> findNode(long nodeId) {
    try (Connection connection = dataSource.getConnection()) {
      return loadNode(connection, nodeId);
    } catch (SQLException ex) {
      throw translate("find node " + NodeIds.toHex(nodeId), ex);
    }
  }

  private static Optional<MeshNode> loadNode(Connection connection, long nodeId) throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement("SELECT * FROM node WHERE node_id = ?")) {
      ps.setLong(1, nodeId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(readNode(rs)) : Optional.empty();
      }
    }
  }

  private static MeshNode readNode(ResultSet rs) throws SQLException {
    Map<NodeField<?>, Stamped<?>> fields = new LinkedHashMap<>();
    for (NodeField<?> field : NodeField.all()) {
      NodeColumns columns = NodeColumns.of(field);
      Long stamp = NodeColumns.getLong(rs, columns.stampColumn());
      if (stamp == null) {
        continue;
      }
      Object value = columns.read(rs);
      if (value != null) {
        fields.put(field, new Stamped<>(value, stamp));
      }
    }
    return MeshNode.restore(rs.getLong("node_id"), fields, rs.getLong("last_seen"));
  }

  @Override
  public List<MeshNode> searchNodes(String prefix, int limit) {
    String needle = Objects.requireNonNull(prefix, "prefix").trim().toLowerCase(Locale.ROOT);
    if (needle.isEmpty()) {
      throw new IllegalArgumentException("search prefix must not be blank");
    }
    String pattern = escapeLike(needle) + "%";
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(
            "SELECT * FROM node WHERE hex_id LIKE ? ESCAPE '\\' OR SUBSTRING(hex_id, 2) LIKE ? ESCAPE '\\' "
                + "OR LOWER(long_name) LIKE ? ESCAPE '\\' OR LOWER(short_name) LIKE ? ESCAPE '\\' "
                + "ORDER BY node_id LIMIT ?")) {
      for (int i = 1; i <= 4; i++) {
        ps.setString(i, pattern);
      }
      ps.setInt(5, limit);
      List<MeshNode> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(readNode(rs));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate("search nodes", ex);
    }
  }

  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  @Override
  public Optional<CanonicalPacket> findPacket(long packetId, long fromNodeId) {
    List<CanonicalPacket> rows = queryPackets(
        "SELECT " + PACKET_COLUMNS + " FROM packet WHERE packet_id = ? AND from_node_id = ?",
        "find packet", packetId, fromNodeId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<CanonicalPacket> packetsFrom(long nodeId, long sinceMillis, int limit) {
    return queryPackets(
        "SELECT " + PACKET_COLUMNS + " FROM packet WHERE from_node_id = ? AND import_time >= ? "
            + "ORDER BY import_time DESC, packet_id DESC LIMIT ?",
        "packets from " + NodeIds.toHex(nodeId), nodeId, sinceMillis, limit);
  }

  @Override
  public List<CanonicalPacket> packetsOfKindSince(MessageKind kind, long sinceMillis, int limit) {
    return queryPackets(
        "SELECT " + PACKET_COLUMNS + " FROM packet WHERE decoded = TRUE AND kind = ? AND import_time >= ? "
            + "ORDER BY import_time, packet_id LIMIT ?",
        "packets of " + kind, kind.name(), sinceMillis, limit);
  }

  private List<CanonicalPacket> queryPackets(String sql, String what, Object... params) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(sql)) {
      bindAll(ps, params);
      List<CanonicalPacket> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          String kind = rs.getString("kind");
          rows.add(new CanonicalPacket(
              rs.getLong("packet_id"),
              rs.getLong("from_node_id"),
              rs.getLong("to_node_id"),
              rs.getString("channel"),
              kind == null ? null : MessageKind.valueOf(kind),
              rs.getInt("port_num"),
              rs.getBytes("payload"),
              rs.getBoolean("decoded"),
              rs.getLong("import_time")));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate(what, ex);
    }
  }

  @Override
  public List<PacketObservation> observations(long packetId, long fromNodeId) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(
            "SELECT * FROM packet_seen WHERE packet_id = ? AND from_node_id = ? "
                + "ORDER BY import_time DESC, gateway_id")) {
      ps.setLong(1, packetId);
      ps.setLong(2, fromNodeId);
      List<PacketObservation> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(new PacketObservation(
              rs.getLong("packet_id"),
              rs.getLong("from_node_id"),
              rs.getString("gateway_id"),
              NodeColumns.getInteger(rs, "rssi"),
              NodeColumns.getFloat(rs, "snr"),
              rs.getInt("hop_limit"),
              rs.getInt("hop_start"),
              rs.getLong("rx_time"),
              rs.getString("topic"),
              rs.getLong("import_time")));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate("observations of " + packetId, ex);
    }
  }

  @Override
  public Optional<Traceroute> findTraceroute(long packetId, long fromNodeId) {
    List<Traceroute> rows = queryTraceroutes(
        "SELECT " + TRACEROUTE_COLUMNS + " FROM traceroute WHERE packet_id = ? AND from_node_id = ?",
        packetId, fromNodeId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<Traceroute> traceroutesSince(long sinceMillis) {
    return queryTraceroutes(
        "SELECT " + TRACEROUTE_COLUMNS + " FROM traceroute WHERE import_time >= ? ORDER BY import_time, packet_id",
        sinceMillis);
  }

  private List<Traceroute> queryTraceroutes(String sql, Object... params) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(sql)) {
      bindAll(ps, params);
      List<Traceroute> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(readTraceroute(rs));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate("read traceroutes", ex);
    }
  }

  private static Traceroute readTraceroute(ResultSet rs) throws SQLException {
    return new Traceroute(
        rs.getLong("packet_id"),
        rs.getLong("from_node_id"),
        rs.getLong("to_node_id"),
        RouteCodec.decodeNodes(rs.getString("route")),
        RouteCodec.decodeSnr(rs.getString("snr_towards")),
        RouteCodec.decodeNodes(rs.getString("route_back")),
        RouteCodec.decodeSnr(rs.getString("snr_back")),
        rs.getBoolean("done"),
        rs.getString("gateway_id"),
        rs.getLong("import_time"));
  }

  @Override
  public List<TrafficSummary> topTraffic(long sinceMillis, int limit) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(
            "SELECT p.from_node_id, n.long_name, n.short_name, n.channel, "
                + "COUNT(DISTINCT p.packet_id) AS packets_sent, COUNT(s.gateway_id) AS times_seen "
                + "FROM packet p "
                + "LEFT JOIN packet_seen s ON s.packet_id = p.packet_id AND s.from_node_id = p.from_node_id "
                + "LEFT JOIN node n ON n.node_id = p.from_node_id "
                + "WHERE p.import_time >= ? "
                + "GROUP BY p.from_node_id, n.long_name, n.short_name, n.channel "
                + "ORDER BY times_seen DESC, packets_sent DESC, p.from_node_id ASC LIMIT ?")) {
      ps.setLong(1, sinceMillis);
      ps.setInt(2, limit);
      List<TrafficSummary> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(new TrafficSummary(
              rs.getLong("from_node_id"),
              rs.getString("long_name"),
              rs.getString("short_name"),
              rs.getString("channel"),
              rs.getLong("packets_sent"),
              rs.getLong("times_seen")));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate("top traffic", ex);
    }
  }

  @Override
  public List<KindCount> nodeTraffic(long nodeId, long sinceMillis) {
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(
            "SELECT port_num, MAX(kind) AS kind, COUNT(*) AS packets FROM packet "
                + "WHERE from_node_id = ? AND import_time >= ? GROUP BY port_num "
                + "ORDER BY packets DESC, port_num")) {
      ps.setLong(1, nodeId);
      ps.setLong(2, sinceMillis);
      List<KindCount> rows = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          String kind = rs.getString("kind");
          rows.add(new KindCount(
              rs.getInt("port_num"), kind == null ? null : MessageKind.valueOf(kind), rs.getLong("packets")));
        }
      }
      return rows;
    } catch (SQLException ex) {
      throw translate("node traffic of " + NodeIds.toHex(nodeId), ex);
    }
  }

  @Override
  public long activeNodeCount(long sinceMillis, Optional<String> channel) {
    String sql = "SELECT COUNT(*) FROM node WHERE last_seen >= ?" + (channel.isPresent() ? " AND channel = ?" : "");
    try (Connection connection = dataSource.getConnection();
        PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setLong(1, sinceMillis);
      if (channel.isPresent()) {
        ps.setString(2, channel.get());
      }
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getLong(1);
      }
    } catch (SQLException ex) {
      throw translate("active node count", ex);
    }
  }

  private static void bindAll(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      ps.setObject(i + 1, params[i]);
    }
  }

  static StoreException translate(String operation, SQLException ex) {
    return new StoreException("Failed to " + operation + ": " + ex.getMessage(), ex, isTransient(ex));
  }

  static boolean isTransient(SQLException ex) {
    if (ex instanceof SQLTransientException || ex instanceof SQLRecoverableException) {
      return true;
    }
    String state = ex.getSQLState();
    // 08: connection, 40: rollback/deadlock, HYT00: lock timeout
    return state != null && (state.startsWith("08") || state.startsWith("40") || state.equals("HYT00"));
  }

  @Override
  public void close() {
    if (ownedPool != null && !ownedPool.isClosed()) {
      ownedPool.close();
    }
  }
}
