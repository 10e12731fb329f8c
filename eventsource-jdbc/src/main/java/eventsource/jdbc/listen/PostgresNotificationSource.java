package eventsource.jdbc.listen;

import eventsource.jdbc.TableNames;
import eventsource.jdbc.store.PostgresEventStore;
import eventsource.spi.ConnectionProvider;
import eventsource.util.JsonCodec;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PostgreSQL {@code LISTEN} source holding one dedicated connection.
 *
 * <p>The connection is opened lazily and re-opened after a failure; notifications sent while
 * it was down are lost, which the listener's checkpoint catch-up covers.
 */
public final class PostgresNotificationSource implements NotificationSource {
  private static final Logger logger = Logger.getLogger(PostgresNotificationSource.class.getName());

  private final ConnectionProvider connectionProvider;
  private final String channel;
  private final JsonCodec jsonCodec;
  private Connection connection;
  private volatile boolean closed;

  public PostgresNotificationSource(ConnectionProvider connectionProvider) {
    this(connectionProvider, PostgresEventStore.DEFAULT_CHANNEL, JsonCodec.getDefault());
  }

  public PostgresNotificationSource(ConnectionProvider connectionProvider, String channel, JsonCodec jsonCodec) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.channel = TableNames.validateChannel(channel);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public synchronized List<EventNotification> await(Duration timeout) throws InterruptedException {
    if (closed) {
      throw new IllegalStateException("PostgresNotificationSource has been closed");
    }
    if (Thread.interrupted()) {
      throw new InterruptedException("LISTEN " + channel + " interrupted");
    }
    int timeoutMs = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    try {
      PGNotification[] received = listeningConnection().unwrap(PGConnection.class).getNotifications(timeoutMs);
      if (received == null || received.length == 0) {
        return List.of();
      }
      List<EventNotification> notifications = new ArrayList<>(received.length);
      for (PGNotification n : received) {
        notifications.add(new EventNotification(n.getName(), decode(n.getParameter())));
      }
      return notifications;
    } catch (SQLException e) {
      logger.log(Level.WARNING, "LISTEN connection failed on channel " + channel + "; reconnecting", e);
      closeConnection();
      Thread.sleep(Math.min(timeoutMs, 1000));
      return List.of();
    }
  }

  private Connection listeningConnection() throws SQLException {
    if (connection == null || connection.isClosed()) {
      Connection conn = connectionProvider.getConnection();
      try (Statement stmt = conn.createStatement()) {
        conn.setAutoCommit(true);
        stmt.execute("LISTEN " + channel);
      } catch (SQLException e) {
        conn.close();
        throw e;
      }
      connection = conn;
      logger.log(Level.FINE, "Listening on channel {0}", channel);
    }
    return connection;
  }

  private Map<String, String> decode(String payload) {
    try {
      return jsonCodec.parseObject(payload);
    } catch (IllegalArgumentException e) {
      logger.log(Level.FINE, "Undecodable notification payload on " + channel, e);
      return Map.of();
    }
  }

  private void closeConnection() {
    if (connection != null) {
      try {
        connection.close();
      } catch (SQLException e) {
        logger.log(Level.FINE, "Failed to close LISTEN connection", e);
      }
      connection = null;
    }
  }

  @Override
  public void close() {
    closed = true;
    synchronized (this) {
      closeConnection();
    }
  }
}
