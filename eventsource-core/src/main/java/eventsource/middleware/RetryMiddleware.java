package eventsource.middleware;

import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;

/**
 * Re-invokes the rest of the pipeline after retryable failures, waiting
 * {@link RetryPolicy#delayMs(int)} between attempts.
 *
 * <p>At most {@code maxRetries + 1} attempts are made and no wait follows the last one.
 * Non-retryable failures are returned immediately. Waits block only the publishing
 * thread; an interrupt during a wait aborts the loop with {@link ErrorKind#CANCELLED}
 * and leaves the thread's interrupt flag set.
 *
 * <p>Placed outside a {@link CircuitBreakerMiddleware}, each attempt is itself subject to
 * breaker rejection; placed inside, the breaker sees only the final outcome.
 */
public final class RetryMiddleware implements EventMiddleware {
  private static final String LOGGER_NAME = RetryMiddleware.class.getName();

  /**
   * Blocking wait between attempts.
   */
  @FunctionalInterface
  public interface Sleeper {
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final StructuredLogger log;
  private final MetricsExporter metrics;

  private RetryMiddleware(Builder builder) {
    this.policy = builder.policy;
    this.sleeper = builder.sleeper;
    this.log = builder.log;
    this.metrics = builder.metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a retry stage with the given policy and default collaborators.
   */
  public static RetryMiddleware of(RetryPolicy policy) {
    return builder().policy(policy).build();
  }

  @Override
  public HandlerResult process(HandlerContext context, Next next) {
    String eventType = context.event().eventType();
    int attempt = 0;
    while (true) {
      HandlerResult result = next.proceed(context);
      if (result instanceof HandlerResult.Success) {
        if (attempt > 0) {
          log.log(Level.INFO, "Handler succeeded after retry", LOGGER_NAME,
              fields(context, attempt + 1, null));
        }
        return result;
      }
      HandlerResult.Failure failure = (HandlerResult.Failure) result;
      if (!policy.shouldRetry(failure)) {
        log.log(Level.FINE, "Failure is not retryable", LOGGER_NAME, fields(context, attempt + 1, failure));
        return failure;
      }
      if (attempt >= policy.maxRetries()) {
        log.log(Level.SEVERE, "Handler failed after all retry attempts", LOGGER_NAME,
            fields(context, attempt + 1, failure));
        return failure;
      }
      long delayMs = policy.delayMs(attempt);
      if (log.isLoggable(Level.FINE, LOGGER_NAME)) {
        Map<String, Object> fields = fields(context, attempt + 1, failure);
        fields.put("delayMs", delayMs);
        log.log(Level.FINE, "Retrying handler", LOGGER_NAME, fields);
      }
      metrics.incrementRetryAttempt(eventType);
      try {
        sleeper.sleep(delayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return HandlerResult.failure(ErrorKind.CANCELLED,
            "Retry wait interrupted after " + (attempt + 1) + " attempts for " + eventType, e);
      }
      attempt++;
    }
  }

  private static Map<String, Object> fields(HandlerContext context, int attempts, HandlerResult.Failure failure) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("eventType", context.event().eventType());
    fields.put("eventId", context.event().eventId());
    fields.put("handler", context.handlerName());
    fields.put("attempts", attempts);
    if (failure != null) {
      fields.put("errorKind", failure.kind());
      fields.put("error", failure.message());
    }
    return fields;
  }

  public static final class Builder {
    private RetryPolicy policy = RetryOptions.defaults();
    private Sleeper sleeper = Sleeper.THREAD;
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter metrics = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to {@link RetryOptions#defaults()}.
     */
    public Builder policy(RetryPolicy policy) {
      this.policy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Overrides how waits are performed, mainly for tests.
     *
     * <p>Optional. Defaults to {@link Thread#sleep(long)}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
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

    public RetryMiddleware build() {
      return new RetryMiddleware(this);
    }
  }
}
