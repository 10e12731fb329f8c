package eventsource.middleware;

/**
 * Per-key invocation counters kept by {@link MetricsMiddleware}. Counters accumulate for
 * the lifetime of the middleware and are never reset by a flush.
 */
public final class EventMetrics {
  private long count;
  private long successCount;
  private long failureCount;
  private long totalNanos;
  private long minNanos = Long.MAX_VALUE;
  private long maxNanos;

  public synchronized void record(long durationNanos, boolean success) {
    count++;
    if (success) {
      successCount++;
    } else {
      failureCount++;
    }
    totalNanos += durationNanos;
    minNanos = Math.min(minNanos, durationNanos);
    maxNanos = Math.max(maxNanos, durationNanos);
  }

  /**
   * Returns a consistent copy of the counters.
   */
  public synchronized Snapshot snapshot() {
    return new Snapshot(count, successCount, failureCount, totalNanos, count == 0 ? 0 : minNanos, maxNanos);
  }

  /**
   * Point-in-time copy of {@link EventMetrics}.
   */
  public record Snapshot(long count, long successCount, long failureCount,
      long totalNanos, long minNanos, long maxNanos) {

    public double averageMs() {
      return count == 0 ? 0.0 : totalNanos / (double) count / 1_000_000.0;
    }

    /**
     * Returns successes as a fraction of all invocations, {@code 0} when there were none.
     */
    public double successRate() {
      return count == 0 ? 0.0 : successCount / (double) count;
    }
  }
}
