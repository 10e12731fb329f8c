package eventsource.middleware;

import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable exponential-backoff retry policy.
 *
 * <p>Delay formula: {@code min(baseDelayMs * backoffFactor^attempt, maxDelayMs)} for the
 * 0-based attempt that failed. With the defaults the sequence is 100, 200, 400, 800, 1600,
 * 3200, 5000, 5000, ... milliseconds.
 *
 * <p>When no retryable kinds are configured every failure is retried; otherwise only
 * failures whose {@link ErrorKind} is in the set.
 */
public final class RetryOptions implements RetryPolicy {
  private static final RetryOptions DEFAULTS = builder().build();

  private final int maxRetries;
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double backoffFactor;
  private final Set<ErrorKind> retryableKinds;

  private RetryOptions(Builder builder) {
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + builder.maxRetries);
    }
    if (builder.baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + builder.baseDelayMs);
    }
    if (builder.maxDelayMs < builder.baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + builder.maxDelayMs);
    }
    if (!(builder.backoffFactor >= 1.0)) {
      throw new IllegalArgumentException("backoffFactor must be >= 1.0, got: " + builder.backoffFactor);
    }
    this.maxRetries = builder.maxRetries;
    this.baseDelayMs = builder.baseDelayMs;
    this.maxDelayMs = builder.maxDelayMs;
    this.backoffFactor = builder.backoffFactor;
    this.retryableKinds = builder.retryableKinds.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(EnumSet.copyOf(builder.retryableKinds));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options with every default: 3 retries, 100 ms base, 5000 ms cap, factor 2.0,
   * all failures retryable.
   */
  public static RetryOptions defaults() {
    return DEFAULTS;
  }

  @Override
  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public boolean shouldRetry(HandlerResult.Failure failure) {
    return retryableKinds.isEmpty() || retryableKinds.contains(failure.kind());
  }

  @Override
  public long delayMs(int attempt) {
    if (attempt < 0) {
      return 0L;
    }
    double delay = baseDelayMs * Math.pow(backoffFactor, attempt);
    // pow overflows to Infinity for large attempts; min() caps it
    return (long) Math.min(delay, (double) maxDelayMs);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double backoffFactor() {
    return backoffFactor;
  }

  public Set<ErrorKind> retryableKinds() {
    return retryableKinds;
  }

  @Override
  public String toString() {
    return "RetryOptions{maxRetries=" + maxRetries + ", baseDelayMs=" + baseDelayMs
        + ", maxDelayMs=" + maxDelayMs + ", backoffFactor=" + backoffFactor
        + ", retryableKinds=" + retryableKinds + '}';
  }

  public static final class Builder {
    private int maxRetries = 3;
    private long baseDelayMs = 100;
    private long maxDelayMs = 5000;
    private double backoffFactor = 2.0;
    private Set<ErrorKind> retryableKinds = EnumSet.noneOf(ErrorKind.class);

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to 3, i.e. at most 4 attempts in total.
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * <p>Optional. Defaults to 100 ms.
     */
    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 5000 ms.
     */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 2.0.
     */
    public Builder backoffFactor(double backoffFactor) {
      this.backoffFactor = backoffFactor;
      return this;
    }

    /**
     * Restricts retries to failures of the given kinds.
     *
     * <p>Optional. Defaults to empty, meaning every failure is retried.
     */
    public Builder retryableKinds(Set<ErrorKind> retryableKinds) {
      Objects.requireNonNull(retryableKinds, "retryableKinds");
      this.retryableKinds = retryableKinds.isEmpty()
          ? EnumSet.noneOf(ErrorKind.class) : EnumSet.copyOf(retryableKinds);
      return this;
    }

    public Builder retryOn(ErrorKind first, ErrorKind... rest) {
      this.retryableKinds = EnumSet.of(first, rest);
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
