package eventsource.middleware;

import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * Guards handler invocations with one {@link CircuitBreakerState} per key.
 *
 * <p>The key defaults to the event type. When an event-type allow-list is configured,
 * events outside it bypass the breaker entirely. While a key's breaker is open the
 * handler is not invoked and a {@link ErrorKind#CIRCUIT_OPEN} failure is returned.
 *
 * <p>Breaker states are created lazily and live as long as this middleware instance.
 */
public final class CircuitBreakerMiddleware implements EventMiddleware {
  private static final String LOGGER_NAME = CircuitBreakerMiddleware.class.getName();

  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final int successThreshold;
  private final Set<String> eventTypes;
  private final Function<HandlerContext, String> keyExtractor;
  private final Clock clock;
  private final StructuredLogger log;
  private final MetricsExporter metrics;
  private final ConcurrentHashMap<String, CircuitBreakerState> breakers = new ConcurrentHashMap<>();

  private CircuitBreakerMiddleware(Builder builder) {
    if (builder.failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be > 0");
    }
    if (builder.successThreshold <= 0) {
      throw new IllegalArgumentException("successThreshold must be > 0");
    }
    if (builder.recoveryTimeout.isNegative()) {
      throw new IllegalArgumentException("recoveryTimeout must not be negative");
    }
    this.failureThreshold = builder.failureThreshold;
    this.recoveryTimeout = builder.recoveryTimeout;
    this.successThreshold = builder.successThreshold;
    this.eventTypes = Set.copyOf(builder.eventTypes);
    this.keyExtractor = builder.keyExtractor;
    this.clock = builder.clock;
    this.log = builder.log;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public HandlerResult process(HandlerContext context, Next next) {
    if (!eventTypes.isEmpty() && !eventTypes.contains(context.event().eventType())) {
      return next.proceed(context);
    }
    String key = keyExtractor.apply(context);
    CircuitBreakerState breaker = breakers.computeIfAbsent(key, this::newState);
    if (!breaker.canExecute()) {
      metrics.incrementCircuitRejected(key);
      log.log(Level.FINE, "Circuit breaker rejected invocation", LOGGER_NAME, Map.of(
          "key", key, "eventId", context.event().eventId(), "handler", context.handlerName()));
      return HandlerResult.failure(ErrorKind.CIRCUIT_OPEN, "Circuit breaker open for event type " + key);
    }
    HandlerResult result;
    try {
      result = next.proceed(context);
    } catch (RuntimeException e) {
      breaker.recordFailure();
      throw e;
    }
    if (result.isSuccess()) {
      breaker.recordSuccess();
    } else {
      breaker.recordFailure();
    }
    return result;
  }

  /**
   * Returns the breaker for {@code key} if one has been created.
   */
  public Optional<CircuitBreakerState> state(String key) {
    return Optional.ofNullable(breakers.get(key));
  }

  private CircuitBreakerState newState(String key) {
    return new CircuitBreakerState(key, failureThreshold, recoveryTimeout, successThreshold, clock,
        this::onTransition);
  }

  private void onTransition(String key, CircuitState from, CircuitState to) {
    Level level = to == CircuitState.OPEN ? Level.WARNING : Level.INFO;
    log.log(level, "Circuit breaker state changed", LOGGER_NAME, Map.of(
        "key", key, "from", from, "to", to));
    metrics.recordCircuitState(key, to.name());
  }

  public static final class Builder {
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(30);
    private int successThreshold = 2;
    private Set<String> eventTypes = Set.of();
    private Function<HandlerContext, String> keyExtractor = ctx -> ctx.event().eventType();
    private Clock clock = Clock.systemUTC();
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to 5.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder recoveryTimeout(Duration recoveryTimeout) {
      this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
      return this;
    }

    /**
     * <p>Optional. Defaults to 2.
     */
    public Builder successThreshold(int successThreshold) {
      this.successThreshold = successThreshold;
      return this;
    }

    /**
     * Restricts the breaker to the given event types; other events pass through unguarded.
     *
     * <p>Optional. Defaults to empty, meaning every event is guarded.
     */
    public Builder eventTypes(Set<String> eventTypes) {
      this.eventTypes = Objects.requireNonNull(eventTypes, "eventTypes");
      return this;
    }

    /**
     * Chooses the breaker key for an invocation, e.g. per handler instead of per event type.
     *
     * <p>Optional. Defaults to the event type.
     */
    public Builder keyExtractor(Function<HandlerContext, String> keyExtractor) {
      this.keyExtractor = Objects.requireNonNull(keyExtractor, "keyExtractor");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public Builder metricsExporter(MetricsExporter metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public CircuitBreakerMiddleware build() {
      return new CircuitBreakerMiddleware(this);
    }
  }
}
