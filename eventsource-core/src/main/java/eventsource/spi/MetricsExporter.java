package eventsource.spi;

/**
 * Observability hook for exporting bus, store and snapshot metrics to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. All methods must be
 * safe to call concurrently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records one handler invocation as seen by the metrics middleware.
     *
     * @param eventType      the dispatched event type
     * @param durationNanos  time spent in the rest of the pipeline
     * @param success        whether the invocation produced a success result
     */
    void recordHandlerInvocation(String eventType, long durationNanos, boolean success);

    /**
     * Increments the count of retry attempts scheduled after a retryable failure.
     */
    void incrementRetryAttempt(String eventType);

    /**
     * Increments the count of invocations rejected by an open circuit breaker.
     */
    void incrementCircuitRejected(String key);

    /**
     * Records a circuit breaker state change.
     *
     * @param key   breaker key
     * @param state new state name ({@code CLOSED}, {@code OPEN} or {@code HALF_OPEN})
     */
    default void recordCircuitState(String key, String state) {
    }

    /**
     * Increments the count of events durably appended to the event store.
     */
    void incrementEventsAppended();

    /**
     * Increments the count of appends rejected with a version conflict.
     */
    void incrementConcurrencyConflict();

    /**
     * Increments the count of events the publisher persisted and dispatched.
     */
    default void incrementEventsPublished() {
    }

    /**
     * Increments the count of events the publisher rejected because persistence failed.
     */
    default void incrementPublishRejected() {
    }

    /**
     * Increments the count of aggregate snapshots written.
     */
    default void incrementSnapshotsSaved() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordHandlerInvocation(String eventType, long durationNanos, boolean success) {
        }

        @Override
        public void incrementRetryAttempt(String eventType) {
        }

        @Override
        public void incrementCircuitRejected(String key) {
        }

        @Override
        public void incrementEventsAppended() {
        }

        @Override
        public void incrementConcurrencyConflict() {
        }
    }
}
