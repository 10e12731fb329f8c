package eventsource;

import eventsource.aggregate.AggregateRoot;
import eventsource.aggregate.EventSourcedRepository;
import eventsource.bus.EventBus;
import eventsource.handler.ErrorClassifier;
import eventsource.middleware.EventMiddleware;
import eventsource.publish.EventPublisher;
import eventsource.snapshot.SnapshotStore;
import eventsource.snapshot.SnapshotStrategy;
import eventsource.snapshot.SnapshotType;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;
import eventsource.store.EventStore;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Composition root that wires an {@link EventStore}, an {@link EventBus} with its
 * middleware, an {@link EventPublisher} and an optional {@link SnapshotStore} into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (EventSourcing es = EventSourcing.builder()
 *     .eventStore(new FileEventStore(Path.of("events.jsonl")))
 *     .snapshotStore(new FileSystemSnapshotStore(Path.of("snapshots")))
 *     .snapshotStrategy(new EventCountSnapshotStrategy(50))
 *     .middleware(RetryMiddleware.of(RetryOptions.defaults()))
 *     .build()) {
 *   es.eventBus().subscribe(OrderPlaced.class, this::onOrderPlaced);
 *   EventSourcedRepository<Order> orders = es.repository(ORDER_SNAPSHOT, Order::new);
 *   ...
 * }
 * }</pre>
 *
 * @see EventSourcedRepository
 * @see EventPublisher
 */
public final class EventSourcing implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventSourcing.class.getName());

  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final SnapshotStrategy snapshotStrategy;
  private final EventBus eventBus;
  private final EventPublisher publisher;
  private final StructuredLogger log;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private EventSourcing(Builder builder) {
    this.eventStore = builder.eventStore;
    this.snapshotStore = builder.snapshotStore;
    this.snapshotStrategy = builder.snapshotStrategy;
    this.log = builder.log;
    this.metrics = builder.metrics;
    this.eventBus = EventBus.builder()
        .middlewares(builder.middlewares)
        .asyncTimeout(builder.asyncTimeout)
        .errorClassifier(builder.errorClassifier)
        .structuredLogger(builder.log)
        .build();
    this.publisher = EventPublisher.builder()
        .eventBus(eventBus)
        .eventStore(eventStore)
        .structuredLogger(builder.log)
        .metricsExporter(builder.metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public EventStore eventStore() {
    return eventStore;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  public EventPublisher publisher() {
    return publisher;
  }

  /**
   * Returns the snapshot store, or {@code null} if none was configured.
   */
  public SnapshotStore snapshotStore() {
    return snapshotStore;
  }

  /**
   * Creates a repository that loads from this instance's store and snapshots, and
   * saves through its publisher.
   *
   * @param snapshotType restores aggregates from snapshots; may be {@code null} without a snapshot store
   * @param factory      creates an empty aggregate for an id
   */
  public <A extends AggregateRoot> EventSourcedRepository<A> repository(SnapshotType<A> snapshotType,
      Function<String, A> factory) {
    return EventSourcedRepository.<A>builder()
        .eventStore(eventStore)
        .publisher(publisher)
        .snapshotStore(snapshotStore)
        .snapshotStrategy(snapshotStrategy)
        .snapshotType(snapshotType)
        .factory(factory)
        .structuredLogger(log)
        .metricsExporter(metrics)
        .build();
  }

  /**
   * Closes the event store, the snapshot store and the metrics exporter, in that order,
   * when they are {@link AutoCloseable}. Closing twice is a no-op.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (Object component : new Object[] {eventStore, snapshotStore, metrics}) {
      if (!(component instanceof AutoCloseable closeable)) {
        continue;
      }
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.fine("EventSourcing closed");
  }

  public static final class Builder {
    private EventStore eventStore;
    private SnapshotStore snapshotStore;
    private SnapshotStrategy snapshotStrategy;
    private final List<EventMiddleware> middlewares = new ArrayList<>();
    private Duration asyncTimeout = Duration.ofSeconds(30);
    private ErrorClassifier errorClassifier = ErrorClassifier.DEFAULT;
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * <p>Optional. Without a snapshot store aggregates are always rebuilt from events.
     */
    public Builder snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * <p>Optional. Without a strategy repositories never write snapshots.
     */
    public Builder snapshotStrategy(SnapshotStrategy snapshotStrategy) {
      this.snapshotStrategy = snapshotStrategy;
      return this;
    }

    /**
     * Appends a bus middleware stage. The first stage added is the outermost.
     */
    public Builder middleware(EventMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    /**
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder asyncTimeout(Duration asyncTimeout) {
      this.asyncTimeout = Objects.requireNonNull(asyncTimeout, "asyncTimeout");
      return this;
    }

    public Builder errorClassifier(ErrorClassifier errorClassifier) {
      this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link StructuredLogger#jul()}.
     */
    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with this instance
     * when it is {@link AutoCloseable}.
     */
    public Builder metricsExporter(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /**
     * @throws IllegalStateException if build() was already called
     */
    public EventSourcing build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(eventStore, "eventStore");
      return new EventSourcing(this);
    }
  }
}
