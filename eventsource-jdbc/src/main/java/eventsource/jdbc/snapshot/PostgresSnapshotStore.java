package eventsource.jdbc.snapshot;

import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.snapshot.Snapshot;
import eventsource.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;

/**
 * PostgreSQL snapshot store using {@code INSERT ... ON CONFLICT DO UPDATE}.
 */
public final class PostgresSnapshotStore extends AbstractJdbcSnapshotStore {

  public PostgresSnapshotStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.SNAPSHOTS_TABLE, 30, Clock.systemUTC());
  }

  public PostgresSnapshotStore(ConnectionProvider connectionProvider, String tableName, int timeoutSeconds,
      Clock clock) {
    super(connectionProvider, tableName, timeoutSeconds, clock);
  }

  @Override
  protected void upsert(Connection conn, int timeoutSeconds, Snapshot snapshot) throws SQLException {
    JdbcTemplate.update(conn, timeoutSeconds,
        "INSERT INTO " + tableName() + " (aggregate_id, aggregate_type, version, created_at, data) " +
            "VALUES (?,?,?,?,?) ON CONFLICT (aggregate_id) DO UPDATE SET " +
            "aggregate_type=EXCLUDED.aggregate_type, version=EXCLUDED.version, " +
            "created_at=EXCLUDED.created_at, data=EXCLUDED.data",
        snapshot.aggregateId(), snapshot.aggregateType(), snapshot.version(), snapshot.timestamp(),
        snapshot.state());
  }
}
