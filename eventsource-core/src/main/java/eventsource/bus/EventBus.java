package eventsource.bus;

import eventsource.DomainEvent;
import eventsource.handler.AsyncEventHandler;
import eventsource.handler.ErrorClassifier;
import eventsource.handler.EventHandler;
import eventsource.handler.HandlerResult;
import eventsource.middleware.EventMiddleware;
import eventsource.middleware.HandlerContext;
import eventsource.middleware.MiddlewarePipeline;
import eventsource.spi.StructuredLogger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;

/**
 * In-process publish/subscribe hub with priority ordering, topic routing and a
 * middleware pipeline around every handler call.
 *
 * <p>For one {@link #publish} call, matching handlers run sequentially on the calling
 * thread in priority order, so side effects are observed in a deterministic order.
 * A failing handler is logged and reported in the returned results; it never prevents
 * the remaining handlers from running. Concurrent publishes of different events may
 * interleave freely.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBus bus = EventBus.builder()
 *     .middleware(MetricsMiddleware.builder().build())
 *     .middleware(RetryMiddleware.of(RetryOptions.defaults()))
 *     .build();
 *
 * bus.subscribe(OrderPlaced.class, event -> inventory.reserve(event), EventPriority.HIGH);
 * bus.subscribe(EventSubscription.sync(e -> audit.record(e)).topic("orders\\..+").build());
 *
 * List<HandlerResult> results = bus.publish(orderPlaced);
 * }</pre>
 */
public final class EventBus {
  private static final String LOGGER_NAME = EventBus.class.getName();

  private final CopyOnWriteArrayList<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final Object registrationLock = new Object();
  private final Duration asyncTimeout;
  private final ErrorClassifier classifier;
  private final StructuredLogger log;
  private volatile MiddlewarePipeline pipeline;

  private EventBus(Builder builder) {
    this.asyncTimeout = builder.asyncTimeout;
    this.classifier = builder.classifier;
    this.log = builder.log;
    this.pipeline = MiddlewarePipeline.of(builder.middlewares, builder.classifier);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a bus without middleware and with default settings.
   */
  public static EventBus create() {
    return builder().build();
  }

  /**
   * Registers a subscription, keeping subscriptions sorted by priority. Within one
   * priority, earlier registrations run first.
   *
   * @return the registered subscription
   */
  public EventSubscription subscribe(EventSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    synchronized (registrationLock) {
      int index = subscriptions.size();
      for (int i = 0; i < subscriptions.size(); i++) {
        if (subscriptions.get(i).priority().compareTo(subscription.priority()) > 0) {
          index = i;
          break;
        }
      }
      subscriptions.add(index, subscription);
    }
    log.log(Level.FINE, "Subscribed handler", LOGGER_NAME, Map.of(
        "handler", subscription.name(), "priority", subscription.priority(), "kind", subscription.kind()));
    return subscription;
  }

  public <E extends DomainEvent> EventSubscription subscribe(Class<E> eventClass, EventHandler<? super E> handler) {
    return subscribe(EventSubscription.sync(eventClass, handler).build());
  }

  public <E extends DomainEvent> EventSubscription subscribe(Class<E> eventClass, EventHandler<? super E> handler,
      EventPriority priority) {
    return subscribe(EventSubscription.sync(eventClass, handler).priority(priority).build());
  }

  public <E extends DomainEvent> EventSubscription subscribeAsync(Class<E> eventClass,
      AsyncEventHandler<? super E> handler) {
    return subscribe(EventSubscription.async(eventClass, handler).build());
  }

  /**
   * Subscribes a handler to every event whose topic fully matches {@code topicPattern}.
   */
  public EventSubscription subscribeTopic(String topicPattern, EventHandler<DomainEvent> handler) {
    Objects.requireNonNull(topicPattern, "topicPattern");
    return subscribe(EventSubscription.sync(handler).topic(topicPattern).build());
  }

  /**
   * Removes every subscription of {@code handler} (compared by identity).
   *
   * @return whether anything was removed
   */
  public boolean unsubscribe(Object handler) {
    return unsubscribe(handler, null, null);
  }

  /**
   * Removes subscriptions of {@code handler} (compared by identity) whose filters equal the
   * given non-null filters. A {@code null} filter argument matches any value.
   *
   * @return whether anything was removed
   */
  public boolean unsubscribe(Object handler, Class<? extends DomainEvent> eventClass, String topicPattern) {
    Objects.requireNonNull(handler, "handler");
    boolean removed;
    synchronized (registrationLock) {
      removed = subscriptions.removeIf(s -> s.handler() == handler
          && (eventClass == null || eventClass.equals(s.eventClass()))
          && (topicPattern == null || topicPattern.equals(s.topicPattern())));
    }
    if (removed) {
      log.log(Level.FINE, "Unsubscribed handler", LOGGER_NAME, Map.of("handler", handler.getClass().getName()));
    }
    return removed;
  }

  /**
   * Removes one subscription instance.
   */
  public boolean unsubscribe(EventSubscription subscription) {
    synchronized (registrationLock) {
      return subscriptions.remove(subscription);
    }
  }

  /**
   * Appends a middleware stage as the innermost stage for subsequent publishes.
   */
  public EventBus addMiddleware(EventMiddleware middleware) {
    synchronized (registrationLock) {
      pipeline = pipeline.with(middleware);
    }
    return this;
  }

  /**
   * Returns the current subscriptions in dispatch order.
   */
  public List<EventSubscription> subscriptions() {
    return Collections.unmodifiableList(new ArrayList<>(subscriptions));
  }

  public List<HandlerResult> publish(DomainEvent event) {
    return publish(event, Map.of());
  }

  /**
   * Dispatches {@code event} to every matching subscription in priority order.
   *
   * @param event    the event to dispatch
   * @param metadata caller metadata exposed to middleware through {@link HandlerContext}
   * @return one result per matching subscription, in dispatch order; empty if none matched
   */
  public List<HandlerResult> publish(DomainEvent event, Map<String, ?> metadata) {
    Objects.requireNonNull(event, "event");
    MiddlewarePipeline current = pipeline;
    List<HandlerResult> results = new ArrayList<>();
    for (EventSubscription subscription : subscriptions) {
      if (!subscription.matches(event)) {
        continue;
      }
      HandlerContext context = new HandlerContext(event, metadata, subscription.name());
      HandlerResult result = current.execute(context,
          ctx -> subscription.invoke(ctx.event(), asyncTimeout, classifier));
      if (result instanceof HandlerResult.Failure failure) {
        logFailure(event, subscription, failure);
      }
      results.add(result);
    }
    if (results.isEmpty()) {
      log.log(Level.FINE, "No subscribers for event", LOGGER_NAME, Map.of(
          "eventType", event.eventType(), "eventId", event.eventId()));
    }
    return results;
  }

  /**
   * Publishes each event in list order. A failure for one event does not stop the rest.
   *
   * @return per-event results, in the same order as {@code events}
   */
  public List<List<HandlerResult>> publishMany(List<? extends DomainEvent> events) {
    List<List<HandlerResult>> results = new ArrayList<>(events.size());
    for (DomainEvent event : events) {
      results.add(publish(event));
    }
    return results;
  }

  private void logFailure(DomainEvent event, EventSubscription subscription, HandlerResult.Failure failure) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("eventType", event.eventType());
    fields.put("eventId", event.eventId());
    fields.put("handler", subscription.name());
    fields.put("errorKind", failure.kind());
    fields.put("error", failure.cause() != null ? failure.cause() : failure.message());
    log.log(Level.WARNING, "Event handler failed", LOGGER_NAME, fields);
  }

  public static final class Builder {
    private final List<EventMiddleware> middlewares = new ArrayList<>();
    private Duration asyncTimeout = Duration.ofSeconds(30);
    private ErrorClassifier classifier = ErrorClassifier.DEFAULT;
    private StructuredLogger log = StructuredLogger.jul();

    private Builder() {
    }

    /**
     * Appends a middleware stage. The first stage added is the outermost.
     *
     * <p>Optional. Defaults to no middleware.
     */
    public Builder middleware(EventMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    public Builder middlewares(List<? extends EventMiddleware> middlewares) {
      for (EventMiddleware m : middlewares) {
        middleware(m);
      }
      return this;
    }

    /**
     * Maximum time to await an asynchronous handler's stage.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder asyncTimeout(Duration asyncTimeout) {
      Objects.requireNonNull(asyncTimeout, "asyncTimeout");
      if (asyncTimeout.isZero() || asyncTimeout.isNegative()) {
        throw new IllegalArgumentException("asyncTimeout must be positive");
      }
      this.asyncTimeout = asyncTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link ErrorClassifier#DEFAULT}.
     */
    public Builder errorClassifier(ErrorClassifier classifier) {
      this.classifier = Objects.requireNonNull(classifier, "classifier");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link StructuredLogger#jul()}.
     */
    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public EventBus build() {
      return new EventBus(this);
    }
  }
}
