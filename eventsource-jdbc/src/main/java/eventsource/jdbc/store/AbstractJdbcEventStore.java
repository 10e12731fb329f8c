package eventsource.jdbc.store;

import eventsource.DomainEvent;
import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.store.EventFactory;
import eventsource.store.EventHashes;
import eventsource.store.EventQuery;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Base JDBC event store SQL with standard implementations.
 *
 * <p>Methods operate on a caller-supplied connection; {@link JdbcEventStore} owns connection
 * and transaction handling. Subclasses supply the database name and URL prefixes, and may
 * hook {@link #afterInsert} to run statements inside the append transaction. Register custom
 * implementations via {@code META-INF/services/eventsource.jdbc.store.AbstractJdbcEventStore}.
 *
 * @see JdbcEventStores
 */
public abstract class AbstractJdbcEventStore {
  private static final String COLUMNS = "global_position, event_id, aggregate_id, aggregate_type, event_type, "
      + "version, payload, topic, correlation_id, causation_id, occurred_at, event_hash";

  private final String tableName;

  protected AbstractJdbcEventStore() {
    this(TableNames.EVENTS_TABLE);
  }

  protected AbstractJdbcEventStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  /**
   * Unique identifier for this event store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this event store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind writing to {@code tableName}.
   */
  public abstract AbstractJdbcEventStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  public long currentVersion(Connection conn, int timeoutSeconds, String aggregateId) throws SQLException {
    Long version = JdbcTemplate.queryOne(conn, timeoutSeconds,
        "SELECT MAX(version) AS v FROM " + tableName + " WHERE aggregate_id=?",
        rs -> {
          long v = rs.getLong("v");
          return rs.wasNull() ? 0L : v;
        },
        aggregateId);
    return version == null ? 0L : version;
  }

  public void insert(Connection conn, int timeoutSeconds, DomainEvent event) throws SQLException {
    String sql = "INSERT INTO " + tableName + " (" +
        "event_id, aggregate_id, aggregate_type, event_type, version, payload, topic, " +
        "correlation_id, causation_id, occurred_at, created_at, event_hash" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, timeoutSeconds, sql,
        event.eventId(),
        event.aggregateId(),
        event.aggregateType(),
        event.eventType(),
        event.version(),
        event.payloadJson(),
        event.topic(),
        event.correlationId(),
        event.causationId(),
        event.timestamp(),
        Instant.now(),
        EventHashes.sha256(event));
    afterInsert(conn, timeoutSeconds, event);
  }

  /**
   * Runs after the row is inserted, in the same transaction. No-op by default.
   */
  protected void afterInsert(Connection conn, int timeoutSeconds, DomainEvent event) throws SQLException {
  }

  public List<DomainEvent> query(Connection conn, int timeoutSeconds, EventQuery query, EventFactory factory)
      throws SQLException {
    StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName + " WHERE 1=1");
    List<Object> params = new ArrayList<>();
    if (query.aggregateId() != null) {
      sql.append(" AND aggregate_id=?");
      params.add(query.aggregateId());
    }
    if (query.aggregateType() != null) {
      sql.append(" AND aggregate_type=?");
      params.add(query.aggregateType());
    }
    if (query.sinceVersion() != null) {
      sql.append(" AND version>=?");
      params.add(query.sinceVersion());
    }
    if (query.sinceTimestamp() != null) {
      sql.append(" AND occurred_at>=?");
      params.add(query.sinceTimestamp());
    }
    sql.append(" ORDER BY global_position");
    if (query.limit() != null) {
      sql.append(" LIMIT ?");
      params.add(query.limit());
    }
    return JdbcTemplate.query(conn, timeoutSeconds, sql.toString(), rs -> mapEvent(rs, factory), params.toArray());
  }

  /**
   * Reads up to {@code limit} events with a global position strictly greater than
   * {@code afterPosition}, in position order.
   */
  public List<StoredEvent> readAfter(Connection conn, int timeoutSeconds, long afterPosition, int limit,
      EventFactory factory) throws SQLException {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE global_position>? ORDER BY global_position LIMIT ?";
    return JdbcTemplate.query(conn, timeoutSeconds, sql,
        rs -> new StoredEvent(rs.getLong("global_position"), mapEvent(rs, factory)),
        afterPosition, limit);
  }

  /** True if an event with this id is already stored. */
  public boolean containsEventId(Connection conn, int timeoutSeconds, String eventId) throws SQLException {
    return JdbcTemplate.queryOne(conn, timeoutSeconds,
        "SELECT 1 AS found FROM " + tableName + " WHERE event_id=?",
        rs -> Boolean.TRUE, eventId) != null;
  }

  protected static DomainEvent mapEvent(ResultSet rs, EventFactory factory) throws SQLException {
    String eventType = rs.getString("event_type");
    DomainEvent.Builder builder = DomainEvent.builder(eventType)
        .eventId(rs.getString("event_id"))
        .aggregateId(rs.getString("aggregate_id"))
        .aggregateType(rs.getString("aggregate_type"))
        .version(rs.getLong("version"))
        .payloadJson(rs.getString("payload"))
        .topic(rs.getString("topic"))
        .correlationId(rs.getString("correlation_id"))
        .causationId(rs.getString("causation_id"))
        .timestamp(rs.getTimestamp("occurred_at").toInstant());
    return factory.create(eventType, builder);
  }
}
