package eventsource.bus;

import eventsource.DomainEvent;
import eventsource.handler.AsyncEventHandler;
import eventsource.handler.ErrorClassifier;
import eventsource.handler.EventHandler;
import eventsource.handler.HandlerResult;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A handler registered with an {@link EventBus}, with its filters and priority.
 *
 * <p>An event matches when all of the following hold:
 * <ul>
 *   <li>the event is an instance of the event class filter, if one is set (subclasses match)</li>
 *   <li>the event's topic matches the whole topic pattern, if one is set; an event without a
 *       topic never matches a pattern</li>
 *   <li>the handler's {@code canHandle} accepts it</li>
 * </ul>
 *
 * <pre>{@code
 * EventSubscription subscription = EventSubscription.sync(OrderPlaced.class, this::onOrderPlaced)
 *     .topic("orders\\..+")
 *     .priority(EventPriority.HIGH)
 *     .build();
 * }</pre>
 */
public final class EventSubscription {

  /**
   * How the handler is invoked, fixed at construction.
   */
  public enum Kind {
    SYNC,
    ASYNC
  }

  private final Object handler;
  private final Class<? extends DomainEvent> eventClass;
  private final String topicPattern;
  private final Pattern topicRegex;
  private final EventPriority priority;
  private final String name;
  private final SubscriptionInvoker invoker;

  @SuppressWarnings("unchecked")
  private EventSubscription(Builder builder) {
    this.handler = builder.handler;
    this.eventClass = builder.eventClass;
    this.topicPattern = builder.topicPattern;
    this.topicRegex = builder.topicPattern == null ? null : Pattern.compile(builder.topicPattern);
    this.priority = builder.priority;
    this.name = builder.name != null ? builder.name : handler.getClass().getName();
    if (handler instanceof AsyncEventHandler<?> async) {
      this.invoker = new SubscriptionInvoker.Async((AsyncEventHandler<DomainEvent>) async);
    } else {
      this.invoker = new SubscriptionInvoker.Sync((EventHandler<DomainEvent>) handler);
    }
  }

  /**
   * Starts a subscription for a synchronous handler receiving events of {@code eventClass}
   * and its subclasses.
   */
  public static <E extends DomainEvent> Builder sync(Class<E> eventClass, EventHandler<? super E> handler) {
    return new Builder(Objects.requireNonNull(handler, "handler"), Objects.requireNonNull(eventClass, "eventClass"));
  }

  /**
   * Starts a subscription for a synchronous handler with no event class filter.
   */
  public static Builder sync(EventHandler<DomainEvent> handler) {
    return new Builder(Objects.requireNonNull(handler, "handler"), null);
  }

  /**
   * Starts a subscription for an asynchronous handler receiving events of {@code eventClass}
   * and its subclasses.
   */
  public static <E extends DomainEvent> Builder async(Class<E> eventClass, AsyncEventHandler<? super E> handler) {
    return new Builder(Objects.requireNonNull(handler, "handler"), Objects.requireNonNull(eventClass, "eventClass"));
  }

  public static Builder async(AsyncEventHandler<DomainEvent> handler) {
    return new Builder(Objects.requireNonNull(handler, "handler"), null);
  }

  boolean matches(DomainEvent event) {
    if (eventClass != null && !eventClass.isInstance(event)) {
      return false;
    }
    if (topicRegex != null) {
      if (event.topic() == null || !topicRegex.matcher(event.topic()).matches()) {
        return false;
      }
    }
    return invoker.canHandle(event);
  }

  HandlerResult invoke(DomainEvent event, Duration asyncTimeout, ErrorClassifier classifier) {
    return invoker.invoke(event, asyncTimeout, classifier);
  }

  /**
   * Returns the registered handler instance, an {@link EventHandler} or {@link AsyncEventHandler}.
   */
  public Object handler() {
    return handler;
  }

  /**
   * Returns the event class filter, or {@code null} when every event type is accepted.
   */
  public Class<? extends DomainEvent> eventClass() {
    return eventClass;
  }

  /**
   * Returns the topic regex, or {@code null} when topics are not filtered.
   */
  public String topicPattern() {
    return topicPattern;
  }

  public EventPriority priority() {
    return priority;
  }

  public String name() {
    return name;
  }

  public Kind kind() {
    return invoker instanceof SubscriptionInvoker.Async ? Kind.ASYNC : Kind.SYNC;
  }

  @Override
  public String toString() {
    return "EventSubscription{name=" + name + ", eventClass="
        + (eventClass == null ? "*" : eventClass.getSimpleName())
        + ", topicPattern=" + topicPattern + ", priority=" + priority + ", kind=" + kind() + '}';
  }

  public static final class Builder {
    private final Object handler;
    private final Class<? extends DomainEvent> eventClass;
    private String topicPattern;
    private EventPriority priority = EventPriority.NORMAL;
    private String name;

    private Builder(Object handler, Class<? extends DomainEvent> eventClass) {
      this.handler = handler;
      this.eventClass = eventClass;
    }

    /**
     * Restricts the subscription to events whose topic fully matches {@code topicPattern}.
     *
     * <p>Optional. Defaults to no topic filter.
     *
     * @throws java.util.regex.PatternSyntaxException at build time if the pattern is invalid
     */
    public Builder topic(String topicPattern) {
      this.topicPattern = topicPattern;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link EventPriority#NORMAL}.
     */
    public Builder priority(EventPriority priority) {
      this.priority = Objects.requireNonNull(priority, "priority");
      return this;
    }

    /**
     * Sets the name used in logs, metrics and breaker keys.
     *
     * <p>Optional. Defaults to the handler's class name.
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public EventSubscription build() {
      return new EventSubscription(this);
    }
  }
}
