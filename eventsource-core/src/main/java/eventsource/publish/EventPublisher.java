package eventsource.publish;

import eventsource.DomainEvent;
import eventsource.bus.EventBus;
import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;
import eventsource.store.ConcurrencyConflictException;
import eventsource.store.EventStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;

/**
 * Persists events, then dispatches them on an {@link EventBus}.
 *
 * <p>An event is dispatched only after it has been appended to the event store; if the
 * append fails the event is reported as {@link PublishResult.Rejected} and no handler
 * sees it. Batches are best-effort: a rejected event does not stop the rest of the batch.
 * Without an event store the publisher only dispatches.
 *
 * <p>Events can be buffered with {@link #add} and released with {@link #publishPending()},
 * which drains the buffer atomically: an event added concurrently with a drain is either
 * part of that drain or stays buffered for the next one.
 *
 * <pre>{@code
 * EventPublisher publisher = EventPublisher.builder()
 *     .eventBus(bus)
 *     .eventStore(store)
 *     .build();
 *
 * publisher.add(orderPlaced);
 * publisher.add(paymentCaptured);
 * List<PublishResult> results = publisher.publishPending();
 * }</pre>
 */
public final class EventPublisher {
  private static final String LOGGER_NAME = EventPublisher.class.getName();

  private final EventBus eventBus;
  private final EventStore eventStore;
  private final StructuredLogger log;
  private final MetricsExporter metrics;
  private final Object bufferLock = new Object();
  private List<DomainEvent> pending = new ArrayList<>();

  private EventPublisher(Builder builder) {
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.eventStore = builder.eventStore;
    this.log = builder.log;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Buffers an event without publishing it.
   */
  public void add(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    synchronized (bufferLock) {
      pending.add(event);
    }
  }

  /**
   * Buffers events in list order without publishing them.
   */
  public void addMany(List<? extends DomainEvent> events) {
    for (DomainEvent event : events) {
      Objects.requireNonNull(event, "event");
    }
    synchronized (bufferLock) {
      pending.addAll(events);
    }
  }

  public int pendingCount() {
    synchronized (bufferLock) {
      return pending.size();
    }
  }

  /**
   * Drains the buffer, persists every drained event in order, then dispatches the
   * persisted ones in the same order. An empty buffer is a no-op.
   *
   * @return one result per drained event, in buffer order
   */
  public List<PublishResult> publishPending() {
    List<DomainEvent> drained;
    synchronized (bufferLock) {
      if (pending.isEmpty()) {
        return Collections.emptyList();
      }
      drained = pending;
      pending = new ArrayList<>();
    }
    return persistThenDispatch(drained, Map.of());
  }

  public PublishResult publish(DomainEvent event) {
    return publish(event, Map.of());
  }

  /**
   * Persists and dispatches one event immediately, bypassing the buffer.
   *
   * @param metadata caller metadata passed to middleware
   */
  public PublishResult publish(DomainEvent event, Map<String, ?> metadata) {
    Objects.requireNonNull(event, "event");
    return persistThenDispatch(List.of(event), metadata).get(0);
  }

  /**
   * Persists all events in order, then dispatches the persisted ones in order,
   * bypassing the buffer.
   *
   * @return one result per event, in list order
   */
  public List<PublishResult> publishMany(List<? extends DomainEvent> events) {
    if (events.isEmpty()) {
      return Collections.emptyList();
    }
    return persistThenDispatch(new ArrayList<>(events), Map.of());
  }

  private List<PublishResult> persistThenDispatch(List<DomainEvent> events, Map<String, ?> metadata) {
    PublishResult[] results = new PublishResult[events.size()];
    boolean[] persisted = new boolean[events.size()];
    for (int i = 0; i < events.size(); i++) {
      DomainEvent event = events.get(i);
      PublishResult.Rejected rejected = persist(event);
      if (rejected != null) {
        results[i] = rejected;
      } else {
        persisted[i] = true;
      }
    }
    for (int i = 0; i < events.size(); i++) {
      if (!persisted[i]) {
        continue;
      }
      List<HandlerResult> handlerResults = eventBus.publish(events.get(i), metadata);
      metrics.incrementEventsPublished();
      results[i] = new PublishResult.Published(events.get(i), handlerResults);
    }
    return List.of(results);
  }

  private PublishResult.Rejected persist(DomainEvent event) {
    if (eventStore == null) {
      return null;
    }
    try {
      eventStore.append(event);
      metrics.incrementEventsAppended();
      return null;
    } catch (ConcurrencyConflictException e) {
      metrics.incrementConcurrencyConflict();
      return reject(event, ErrorKind.CONCURRENCY_CONFLICT, e);
    } catch (CancellationException e) {
      return reject(event, ErrorKind.CANCELLED, e);
    } catch (RuntimeException e) {
      return reject(event, ErrorKind.PERSISTENCE_FAILURE, e);
    }
  }

  private PublishResult.Rejected reject(DomainEvent event, ErrorKind kind, RuntimeException cause) {
    metrics.incrementPublishRejected();
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("eventType", event.eventType());
    fields.put("eventId", event.eventId());
    fields.put("aggregateId", event.aggregateId());
    fields.put("version", event.version());
    fields.put("errorKind", kind);
    fields.put("error", cause);
    log.log(Level.WARNING, "Event not persisted; dispatch skipped", LOGGER_NAME, fields);
    return new PublishResult.Rejected(event, kind, cause.getMessage(), cause);
  }

  public static final class Builder {
    private EventBus eventBus;
    private EventStore eventStore;
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Store every event is appended to before dispatch.
     *
     * <p>Optional. Without a store events are dispatched only.
     */
    public Builder eventStore(EventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metricsExporter(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public EventPublisher build() {
      return new EventPublisher(this);
    }
  }
}
