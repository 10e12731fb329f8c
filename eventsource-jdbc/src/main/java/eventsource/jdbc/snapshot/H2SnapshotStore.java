package eventsource.jdbc.snapshot;

import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.snapshot.Snapshot;
import eventsource.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * H2 snapshot store using {@code MERGE INTO ... KEY}.
 */
public final class H2SnapshotStore extends AbstractJdbcSnapshotStore {

  public H2SnapshotStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.SNAPSHOTS_TABLE, 30, Clock.systemUTC());
  }

  public H2SnapshotStore(ConnectionProvider connectionProvider, String tableName, int timeoutSeconds, Clock clock) {
    super(connectionProvider, tableName, timeoutSeconds, clock);
  }

  @Override
  protected void upsert(Connection conn, int timeoutSeconds, Snapshot snapshot) throws SQLException {
    JdbcTemplate.update(conn, timeoutSeconds,
        "MERGE INTO " + tableName() + " (aggregate_id, aggregate_type, version, created_at, data) " +
            "KEY (aggregate_id) VALUES (?,?,?,?,?)",
        snapshot.aggregateId(), snapshot.aggregateType(), snapshot.version(), snapshot.timestamp(),
        snapshot.state());
  }
}
