package eventsource.jdbc.listen;

import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.spi.ConnectionProvider;
import eventsource.store.EventStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;

/**
 * Checkpoint stored in the {@code event_listener_checkpoints} table. Saves try an UPDATE
 * first and INSERT the row when none exists.
 */
public final class JdbcListenerCheckpoint implements ListenerCheckpoint {
  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final int timeoutSeconds;

  public JdbcListenerCheckpoint(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.CHECKPOINTS_TABLE, 30);
  }

  public JdbcListenerCheckpoint(ConnectionProvider connectionProvider, String tableName, int timeoutSeconds) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    this.timeoutSeconds = timeoutSeconds;
  }

  @Override
  public long load(String listenerName) {
    Objects.requireNonNull(listenerName, "listenerName");
    try (Connection conn = connectionProvider.getConnection()) {
      Long position = JdbcTemplate.queryOne(conn, timeoutSeconds,
          "SELECT last_position FROM " + tableName + " WHERE listener_name=?",
          rs -> rs.getLong("last_position"), listenerName);
      return position == null ? 0L : position;
    } catch (SQLException e) {
      throw new EventStoreException("Failed to load checkpoint for listener " + listenerName, e);
    }
  }

  @Override
  public void save(String listenerName, long position) {
    Objects.requireNonNull(listenerName, "listenerName");
    try (Connection conn = connectionProvider.getConnection()) {
      if (update(conn, listenerName, position) > 0) {
        return;
      }
      try {
        JdbcTemplate.update(conn, timeoutSeconds,
            "INSERT INTO " + tableName + " (listener_name, last_position, updated_at) VALUES (?,?,?)",
            listenerName, position, Instant.now());
      } catch (SQLException e) {
        // another instance inserted the row first
        if (!JdbcTemplate.isConstraintViolation(e) || update(conn, listenerName, position) == 0) {
          throw e;
        }
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to save checkpoint for listener " + listenerName, e);
    }
  }

  private int update(Connection conn, String listenerName, long position) throws SQLException {
    return JdbcTemplate.update(conn, timeoutSeconds,
        "UPDATE " + tableName + " SET last_position=?, updated_at=? WHERE listener_name=?",
        position, Instant.now(), listenerName);
  }
}
