package eventsource.jdbc.snapshot;

import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.snapshot.AbstractSnapshotStore;
import eventsource.snapshot.Snapshot;
import eventsource.snapshot.SnapshotStoreException;
import eventsource.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Relational snapshot store keeping one row per aggregate. Subclasses supply the
 * database-specific upsert in {@link #upsert}.
 */
public abstract class AbstractJdbcSnapshotStore extends AbstractSnapshotStore {
  protected static final JdbcTemplate.RowMapper<Snapshot> SNAPSHOT_ROW_MAPPER = rs -> new Snapshot(
      rs.getString("aggregate_id"),
      rs.getString("aggregate_type"),
      rs.getLong("version"),
      rs.getTimestamp("created_at").toInstant(),
      rs.getString("data"));

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final int timeoutSeconds;

  protected AbstractJdbcSnapshotStore(ConnectionProvider connectionProvider, String tableName,
      int timeoutSeconds, Clock clock) {
    super(clock);
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    if (timeoutSeconds < 0) {
      throw new IllegalArgumentException("timeoutSeconds must be >= 0");
    }
    this.timeoutSeconds = timeoutSeconds;
  }

  protected String tableName() {
    return tableName;
  }

  /**
   * Inserts the snapshot or replaces the aggregate's existing row.
   */
  protected abstract void upsert(Connection conn, int timeoutSeconds, Snapshot snapshot) throws SQLException;

  @Override
  protected void save(Snapshot snapshot) {
    try (Connection conn = connectionProvider.getConnection()) {
      upsert(conn, timeoutSeconds, snapshot);
    } catch (SQLException e) {
      throw new SnapshotStoreException("Failed to save snapshot for " + snapshot.aggregateId(), e);
    }
  }

  @Override
  public Optional<Snapshot> loadSnapshot(String aggregateId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return Optional.ofNullable(JdbcTemplate.queryOne(conn, timeoutSeconds,
          "SELECT aggregate_id, aggregate_type, version, created_at, data FROM " + tableName +
              " WHERE aggregate_id=?",
          SNAPSHOT_ROW_MAPPER, aggregateId));
    } catch (SQLException e) {
      throw new SnapshotStoreException("Failed to load snapshot for " + aggregateId, e);
    }
  }

  @Override
  public void deleteSnapshot(String aggregateId) {
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, timeoutSeconds, "DELETE FROM " + tableName + " WHERE aggregate_id=?", aggregateId);
    } catch (SQLException e) {
      throw new SnapshotStoreException("Failed to delete snapshot for " + aggregateId, e);
    }
  }
}
