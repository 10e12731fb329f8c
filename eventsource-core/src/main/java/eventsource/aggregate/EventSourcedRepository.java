package eventsource.aggregate;

import eventsource.DomainEvent;
import eventsource.publish.EventPublisher;
import eventsource.publish.PublishResult;
import eventsource.snapshot.Snapshot;
import eventsource.snapshot.SnapshotStore;
import eventsource.snapshot.SnapshotStoreException;
import eventsource.snapshot.SnapshotStrategy;
import eventsource.snapshot.SnapshotType;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;
import eventsource.store.ConcurrencyConflictException;
import eventsource.store.EventQuery;
import eventsource.store.EventStore;
import eventsource.store.EventStoreException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Loads and saves one kind of {@link AggregateRoot}.
 *
 * <p>{@link #load} starts from the latest snapshot when a snapshot store is configured
 * and replays only the events after it. {@link #save} persists the aggregate's
 * uncommitted events, through the publisher when one is configured so that handlers
 * see them, and then asks the snapshot strategy whether to capture the new state.
 *
 * <p>When a publisher is configured it must append to the same event store this
 * repository reads from.
 *
 * @param <A> the aggregate type
 */
public final class EventSourcedRepository<A extends AggregateRoot> {
  private static final String LOGGER_NAME = EventSourcedRepository.class.getName();

  private final EventStore eventStore;
  private final EventPublisher publisher;
  private final SnapshotStore snapshotStore;
  private final SnapshotStrategy snapshotStrategy;
  private final SnapshotType<A> snapshotType;
  private final Function<String, A> factory;
  private final StructuredLogger log;
  private final MetricsExporter metrics;

  private EventSourcedRepository(Builder<A> builder) {
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.factory = Objects.requireNonNull(builder.factory, "factory");
    this.publisher = builder.publisher;
    this.snapshotStore = builder.snapshotStore;
    this.snapshotStrategy = builder.snapshotStrategy;
    this.snapshotType = builder.snapshotType;
    if (snapshotStore != null && snapshotType == null) {
      throw new IllegalArgumentException("snapshotType is required when a snapshotStore is set");
    }
    this.log = builder.log;
    this.metrics = builder.metrics;
  }

  public static <A extends AggregateRoot> Builder<A> builder() {
    return new Builder<>();
  }

  /**
   * Rebuilds an aggregate from its snapshot and the events after it.
   *
   * @return the aggregate, or empty if it has neither a snapshot nor any events
   */
  public Optional<A> load(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    A aggregate = null;
    if (snapshotStore != null) {
      aggregate = snapshotStore.getSnapshot(aggregateId, snapshotType).orElse(null);
    }
    long sinceVersion = aggregate == null ? 1 : aggregate.version() + 1;
    List<DomainEvent> events = eventStore.getEvents(EventQuery.builder()
        .aggregateId(aggregateId)
        .sinceVersion(sinceVersion)
        .build());
    if (aggregate == null) {
      if (events.isEmpty()) {
        return Optional.empty();
      }
      aggregate = factory.apply(aggregateId);
    }
    aggregate.replay(events);
    return Optional.of(aggregate);
  }

  /**
   * Persists the aggregate's uncommitted events in order and marks them committed.
   * Saving an aggregate without uncommitted events is a no-op.
   *
   * <p>Events are appended one at a time and the save stops at the first failure, so
   * no later event is stored or dispatched. Earlier events stay stored and the
   * aggregate's uncommitted list is untouched; reload the aggregate before retrying. A snapshot failure after the events are stored is logged
   * and does not fail the save.
   *
   * @throws ConcurrencyConflictException if another writer appended to the aggregate first
   * @throws EventStoreException          if the events cannot be stored
   */
  public void save(A aggregate) {
    List<DomainEvent> events = aggregate.uncommittedEvents();
    if (events.isEmpty()) {
      return;
    }
    if (publisher != null) {
      // one at a time: events after a rejected one were raised against stale state
      for (DomainEvent event : events) {
        if (publisher.publish(event) instanceof PublishResult.Rejected rejected) {
          throw rejection(rejected);
        }
      }
    } else {
      for (DomainEvent event : events) {
        try {
          eventStore.append(event);
        } catch (ConcurrencyConflictException e) {
          metrics.incrementConcurrencyConflict();
          throw e;
        }
        metrics.incrementEventsAppended();
      }
    }
    aggregate.markCommitted();
    maybeSnapshot(aggregate);
  }

  private RuntimeException rejection(PublishResult.Rejected rejected) {
    if (rejected.cause() instanceof RuntimeException e) {
      return e;
    }
    return new EventStoreException(rejected.message(), rejected.cause());
  }

  private void maybeSnapshot(A aggregate) {
    if (snapshotStore == null || snapshotStrategy == null) {
      return;
    }
    if (!snapshotStrategy.shouldSnapshot(aggregate.aggregateId(), aggregate.eventsSinceSnapshot())) {
      return;
    }
    try {
      snapshotStore.saveSnapshot(aggregate);
      aggregate.markSnapshotTaken();
      metrics.incrementSnapshotsSaved();
    } catch (SnapshotStoreException e) {
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("aggregateId", aggregate.aggregateId());
      fields.put("version", aggregate.version());
      fields.put("error", e);
      log.log(Level.WARNING, "Snapshot failed; events are stored", LOGGER_NAME, fields);
    }
  }

  /**
   * Returns the stored snapshot for an aggregate, whatever its type.
   */
  public Optional<Snapshot> latestSnapshot(String aggregateId) {
    return snapshotStore == null ? Optional.empty() : snapshotStore.loadSnapshot(aggregateId);
  }

  public static final class Builder<A extends AggregateRoot> {
    private EventStore eventStore;
    private EventPublisher publisher;
    private SnapshotStore snapshotStore;
    private SnapshotStrategy snapshotStrategy;
    private SnapshotType<A> snapshotType;
    private Function<String, A> factory;
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * Store aggregates are loaded from, and appended to when no publisher is set.
     *
     * <p><b>Required.</b>
     */
    public Builder<A> eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * Creates an empty aggregate for an id before its history is replayed.
     *
     * <p><b>Required.</b>
     */
    public Builder<A> factory(Function<String, A> factory) {
      this.factory = factory;
      return this;
    }

    /**
     * <p>Optional. Without a publisher saved events are appended but not dispatched.
     */
    public Builder<A> publisher(EventPublisher publisher) {
      this.publisher = publisher;
      return this;
    }

    /**
     * <p>Optional. Requires {@link #snapshotType}.
     */
    public Builder<A> snapshotStore(SnapshotStore snapshotStore) {
      this.snapshotStore = snapshotStore;
      return this;
    }

    /**
     * <p>Optional. Without a strategy snapshots are only read, never written.
     */
    public Builder<A> snapshotStrategy(SnapshotStrategy snapshotStrategy) {
      this.snapshotStrategy = snapshotStrategy;
      return this;
    }

    public Builder<A> snapshotType(SnapshotType<A> snapshotType) {
      this.snapshotType = snapshotType;
      return this;
    }

    public Builder<A> structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public Builder<A> metricsExporter(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public EventSourcedRepository<A> build() {
      return new EventSourcedRepository<>(this);
    }
  }
}
