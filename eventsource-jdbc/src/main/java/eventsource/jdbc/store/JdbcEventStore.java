package eventsource.jdbc.store;

import eventsource.DomainEvent;
import eventsource.jdbc.DataSourceConnectionProvider;
import eventsource.jdbc.JdbcTemplate;
import eventsource.spi.ConnectionProvider;
import eventsource.store.ConcurrencyConflictException;
import eventsource.store.EventFactory;
import eventsource.store.EventQuery;
import eventsource.store.EventStore;
import eventsource.store.EventStoreException;
import eventsource.store.VersionGuard;
import eventsource.util.Cancellation;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relational {@link EventStore}. Each operation borrows one connection from the
 * {@link ConnectionProvider}; each append runs in its own transaction that reads the
 * aggregate's current version, checks it with {@link VersionGuard} and inserts the row.
 *
 * <p>The {@code UNIQUE(aggregate_id, version)} constraint is the final arbiter between
 * concurrent writers: a constraint violation on insert is reported as a
 * {@link ConcurrencyConflictException}.
 *
 * <pre>{@code
 * EventStore store = JdbcEventStore.builder()
 *     .dataSource(dataSource)           // dialect detected from the JDBC URL
 *     .queryTimeout(Duration.ofSeconds(5))
 *     .build();
 * }</pre>
 */
public final class JdbcEventStore implements EventStore {
  private static final Logger logger = Logger.getLogger(JdbcEventStore.class.getName());

  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcEventStore store;
  private final EventFactory eventFactory;
  private final int timeoutSeconds;

  private JdbcEventStore(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = builder.store != null ? builder.store : detect(builder);
    this.eventFactory = builder.eventFactory;
    this.timeoutSeconds = (int) Math.min(Integer.MAX_VALUE, builder.queryTimeout.toSeconds());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public void append(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    String aggregateId = VersionGuard.requireAggregateId(event);
    Cancellation.throwIfCancelled("append");
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      RuntimeException failure = null;
      try {
        VersionGuard.checkAppendable(event, store.currentVersion(conn, timeoutSeconds, aggregateId));
        store.insert(conn, timeoutSeconds, event);
        conn.commit();
      } catch (SQLException e) {
        JdbcTemplate.rollbackQuietly(conn, e);
        failure = translateInsertFailure(conn, event, e);
      } catch (RuntimeException e) {
        JdbcTemplate.rollbackQuietly(conn, e);
        failure = e;
      }
      try {
        conn.setAutoCommit(autoCommit);
      } catch (SQLException e) {
        if (failure == null) {
          // the append is committed; only the connection's mode could not be restored
          logger.log(Level.WARNING, "Failed to restore autoCommit after appending " + event.eventId(), e);
        } else {
          failure.addSuppressed(e);
        }
      }
      if (failure != null) {
        throw failure;
      }
    } catch (SQLException e) {
      throw new EventStoreException("Failed to append event " + event.eventId(), e);
    }
    logger.log(Level.FINE, "Appended {0} v{1} to {2}",
        new Object[]{event.eventType(), event.version(), aggregateId});
  }

  private RuntimeException translateInsertFailure(Connection conn, DomainEvent event, SQLException e) {
    if (!JdbcTemplate.isConstraintViolation(e)) {
      return new EventStoreException("Failed to append event " + event.eventId(), e);
    }
    try {
      if (store.containsEventId(conn, timeoutSeconds, event.eventId())) {
        return new EventStoreException("Duplicate event id " + event.eventId(), e);
      }
      long current = store.currentVersion(conn, timeoutSeconds, event.aggregateId());
      if (current >= event.version()) {
        return new ConcurrencyConflictException(event.aggregateId(), current + 1, event.version(), e);
      }
    } catch (SQLException re) {
      e.addSuppressed(re);
    }
    return new EventStoreException("Failed to append event " + event.eventId(), e);
  }

  @Override
  public List<DomainEvent> getEvents(EventQuery query) {
    Objects.requireNonNull(query, "query");
    try (Connection conn = connectionProvider.getConnection()) {
      return store.query(conn, timeoutSeconds, query, eventFactory);
    } catch (SQLException e) {
      throw new EventStoreException("Failed to read events for " + query, e);
    }
  }

  @Override
  public long currentVersion(String aggregateId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return store.currentVersion(conn, timeoutSeconds, aggregateId);
    } catch (SQLException e) {
      throw new EventStoreException("Failed to read version of " + aggregateId, e);
    }
  }

  /**
   * Reads events appended after {@code afterPosition} across all aggregates.
   *
   * @param afterPosition exclusive lower bound, {@code 0} for the beginning
   * @param limit         maximum number of events returned
   */
  public List<StoredEvent> readAfter(long afterPosition, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return store.readAfter(conn, timeoutSeconds, afterPosition, limit, eventFactory);
    } catch (SQLException e) {
      throw new EventStoreException("Failed to read events after position " + afterPosition, e);
    }
  }

  public AbstractJdbcEventStore store() {
    return store;
  }

  private static AbstractJdbcEventStore detect(Builder builder) {
    AbstractJdbcEventStore detected;
    try (Connection conn = builder.connectionProvider.getConnection()) {
      detected = JdbcEventStores.detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect event store from connection", e);
    }
    return builder.tableName == null ? detected : detected.withTableName(builder.tableName);
  }

  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbstractJdbcEventStore store;
    private String tableName;
    private EventFactory eventFactory = EventFactory.DEFAULT;
    private Duration queryTimeout = Duration.ofSeconds(30);

    private Builder() {
    }

    /**
     * <p><b>Required</b> unless {@link #dataSource} is set.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
      return this;
    }

    public Builder dataSource(DataSource dataSource) {
      return connectionProvider(new DataSourceConnectionProvider(dataSource));
    }

    /**
     * <p>Optional. Defaults to the registered store matching the connection's JDBC URL.
     */
    public Builder store(AbstractJdbcEventStore store) {
      this.store = Objects.requireNonNull(store, "store");
      return this;
    }

    /**
     * <p>Optional. Applied to the detected store only; ignored when {@link #store} is set.
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link EventFactory#DEFAULT}.
     */
    public Builder eventFactory(EventFactory eventFactory) {
      this.eventFactory = Objects.requireNonNull(eventFactory, "eventFactory");
      return this;
    }

    /**
     * <p>Optional. Defaults to 30 seconds; {@link Duration#ZERO} disables the timeout.
     */
    public Builder queryTimeout(Duration queryTimeout) {
      Objects.requireNonNull(queryTimeout, "queryTimeout");
      if (queryTimeout.isNegative()) {
        throw new IllegalArgumentException("queryTimeout must be >= 0");
      }
      this.queryTimeout = queryTimeout;
      return this;
    }

    public JdbcEventStore build() {
      return new JdbcEventStore(this);
    }
  }
}
