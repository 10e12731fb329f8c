package eventsource.jdbc.listen;

import eventsource.DomainEvent;
import eventsource.jdbc.store.JdbcEventStore;
import eventsource.jdbc.store.StoredEvent;
import eventsource.spi.StructuredLogger;
import eventsource.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;

/**
 * Background loop that feeds committed events to a consumer in global append order.
 *
 * <p>Each cycle first catches up: it reads events after the checkpoint in batches, hands
 * them to the consumer and advances the checkpoint. It then waits on the
 * {@link NotificationSource} until new events may exist or the wait timeout elapses.
 * Delivery is at-least-once: a consumer failure or crash before the checkpoint is saved
 * redelivers the affected events on the next cycle.
 *
 * <p>Global positions are assigned at insert, not at commit, so a committed row may be
 * visible while a lower position is still in flight. The listener never delivers past
 * such a gap until it fills or has stayed open for {@code gapTimeout}; after that the
 * gap is taken to be a rolled-back append and skipped. {@code gapTimeout} must exceed
 * the longest append transaction.
 *
 * <pre>{@code
 * EventStreamListener listener = EventStreamListener.builder()
 *     .name("projections")
 *     .eventStore(jdbcEventStore)
 *     .consumer(eventBus::publish)
 *     .checkpoint(new JdbcListenerCheckpoint(connectionProvider))
 *     .notificationSource(new PostgresNotificationSource(connectionProvider))
 *     .build();
 * listener.start();
 * }</pre>
 *
 * <p>{@link #start()} and {@link #close()} are thread-safe; {@link #catchUp()} may also be
 * called directly when no background thread is running.
 */
public final class EventStreamListener implements AutoCloseable {
  private static final String LOGGER_NAME = EventStreamListener.class.getName();

  private final String name;
  private final JdbcEventStore eventStore;
  private final Consumer<? super DomainEvent> consumer;
  private final ListenerCheckpoint checkpoint;
  private final NotificationSource notificationSource;
  private final int batchSize;
  private final Duration waitTimeout;
  private final Duration errorBackoff;
  private final Duration gapTimeout;
  private final Clock clock;
  private final StructuredLogger log;

  private ExecutorService executor;
  private volatile long position = -1;
  private volatile boolean closed;
  private long gapPosition = -1;
  private Instant gapSince;

  private EventStreamListener(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.consumer = Objects.requireNonNull(builder.consumer, "consumer");
    this.checkpoint = builder.checkpoint;
    this.notificationSource = builder.notificationSource;
    this.batchSize = builder.batchSize;
    this.waitTimeout = builder.waitTimeout;
    this.errorBackoff = builder.errorBackoff;
    this.gapTimeout = builder.gapTimeout;
    this.clock = builder.clock;
    this.log = builder.log;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the background loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("EventStreamListener has been closed");
    }
    if (executor != null) {
      return;
    }
    executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("event-stream-listener-" + name + "-"));
    executor.execute(this::run);
  }

  private void run() {
    log.log(Level.FINE, "Event stream listener started", LOGGER_NAME, Map.of("listener", name));
    while (!closed && !Thread.currentThread().isInterrupted()) {
      try {
        catchUp();
        notificationSource.await(waitTimeout);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        if (closed) {
          break;
        }
        logFailure(e);
        try {
          Thread.sleep(errorBackoff.toMillis());
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
    log.log(Level.FINE, "Event stream listener stopped", LOGGER_NAME, Map.of("listener", name));
  }

  /**
   * Delivers every event after the checkpoint and advances it, stopping at a position
   * gap that may still be filled by an uncommitted append.
   *
   * @return number of events delivered
   * @throws RuntimeException the consumer's failure, after saving the checkpoint of the
   *                          last event delivered successfully
   */
  public int catchUp() {
    if (position < 0) {
      position = checkpoint.load(name);
    }
    int delivered = 0;
    while (!closed) {
      List<StoredEvent> batch = eventStore.readAfter(position, batchSize);
      if (batch.isEmpty()) {
        return delivered;
      }
      long batchStart = position;
      boolean blocked = false;
      try {
        for (StoredEvent stored : batch) {
          if (stored.position() != position + 1 && !gapExpired(position + 1, stored.position())) {
            blocked = true;
            break;
          }
          consumer.accept(stored.event());
          position = stored.position();
          delivered++;
        }
      } finally {
        if (position != batchStart) {
          checkpoint.save(name, position);
        }
      }
      if (blocked || batch.size() < batchSize) {
        return delivered;
      }
    }
    return delivered;
  }

  private boolean gapExpired(long missing, long next) {
    Instant now = clock.instant();
    if (gapPosition != missing) {
      gapPosition = missing;
      gapSince = now;
    }
    if (Duration.between(gapSince, now).compareTo(gapTimeout) < 0) {
      return false;
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("listener", name);
    fields.put("from", missing);
    fields.put("to", next - 1);
    log.log(Level.FINE, "Skipping position gap", LOGGER_NAME, fields);
    return true;
  }

  /**
   * Returns the last delivered global position, or {@code -1} before the checkpoint is loaded.
   */
  public long position() {
    return position;
  }

  public String name() {
    return name;
  }

  private void logFailure(RuntimeException e) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("listener", name);
    fields.put("position", position);
    fields.put("error", e);
    log.log(Level.WARNING, "Event stream listener cycle failed; retrying", LOGGER_NAME, fields);
  }

  /**
   * Stops the loop, waits briefly for the thread to exit and closes the notification source.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    notificationSource.close();
  }

  /**
   * Builder for {@link EventStreamListener}.
   */
  public static final class Builder {
    private String name;
    private JdbcEventStore eventStore;
    private Consumer<? super DomainEvent> consumer;
    private ListenerCheckpoint checkpoint = new InMemoryListenerCheckpoint();
    private NotificationSource notificationSource = new PollingNotificationSource();
    private int batchSize = 100;
    private Duration waitTimeout = Duration.ofSeconds(1);
    private Duration errorBackoff = Duration.ofSeconds(1);
    private Duration gapTimeout = Duration.ofSeconds(10);
    private Clock clock = Clock.systemUTC();
    private StructuredLogger log = StructuredLogger.jul();

    private Builder() {
    }

    /**
     * <p><b>Required.</b> Identifies the checkpoint row.
     */
    public Builder name(String name) {
      Objects.requireNonNull(name, "name");
      if (name.isEmpty()) {
        throw new IllegalArgumentException("name must not be empty");
      }
      this.name = name;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventStore(JdbcEventStore eventStore) {
      this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
      return this;
    }

    /**
     * <p><b>Required.</b> Receives events in global position order; typically {@code eventBus::publish}.
     */
    public Builder consumer(Consumer<? super DomainEvent> consumer) {
      this.consumer = Objects.requireNonNull(consumer, "consumer");
      return this;
    }

    /**
     * <p>Optional. Defaults to an {@link InMemoryListenerCheckpoint}.
     */
    public Builder checkpoint(ListenerCheckpoint checkpoint) {
      this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
      return this;
    }

    /**
     * <p>Optional. Defaults to a {@link PollingNotificationSource}.
     */
    public Builder notificationSource(NotificationSource notificationSource) {
      this.notificationSource = Objects.requireNonNull(notificationSource, "notificationSource");
      return this;
    }

    /**
     * <p>Optional. Defaults to 100.
     */
    public Builder batchSize(int batchSize) {
      if (batchSize <= 0) {
        throw new IllegalArgumentException("batchSize must be > 0");
      }
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Longest wait for a notification before re-reading. Defaults to 1 second.
     */
    public Builder waitTimeout(Duration waitTimeout) {
      Objects.requireNonNull(waitTimeout, "waitTimeout");
      if (waitTimeout.isNegative() || waitTimeout.isZero()) {
        throw new IllegalArgumentException("waitTimeout must be > 0");
      }
      this.waitTimeout = waitTimeout;
      return this;
    }

    /**
     * <p>Optional. Pause after a failed cycle. Defaults to 1 second.
     */
    public Builder errorBackoff(Duration errorBackoff) {
      Objects.requireNonNull(errorBackoff, "errorBackoff");
      if (errorBackoff.isNegative()) {
        throw new IllegalArgumentException("errorBackoff must be >= 0");
      }
      this.errorBackoff = errorBackoff;
      return this;
    }

    /**
     * How long a missing position may hold delivery back before it is treated as a
     * rolled-back append.
     *
     * <p>Optional. Defaults to 10 seconds.
     */
    public Builder gapTimeout(Duration gapTimeout) {
      Objects.requireNonNull(gapTimeout, "gapTimeout");
      if (gapTimeout.isNegative()) {
        throw new IllegalArgumentException("gapTimeout must be >= 0");
      }
      this.gapTimeout = gapTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link StructuredLogger#jul()}.
     */
    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public EventStreamListener build() {
      return new EventStreamListener(this);
    }
  }
}
