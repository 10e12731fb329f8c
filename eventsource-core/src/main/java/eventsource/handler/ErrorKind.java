package eventsource.handler;

/**
 * Classification of a failed handler invocation or publish, independent of the
 * exception hierarchy that produced it.
 *
 * @see ErrorClassifier
 */
public enum ErrorKind {
    /** A subscriber threw; dispatch to remaining subscribers continues. */
    HANDLER_FAILURE,
    /** A transient failure that a retry may fix. */
    RETRYABLE,
    /** A failure that must be surfaced without retrying. */
    NON_RETRYABLE,
    /** Rejected by an open circuit breaker; the handler was not invoked. */
    CIRCUIT_OPEN,
    /** An asynchronous handler did not complete in time. */
    TIMEOUT,
    /** The invocation or a wait was interrupted. */
    CANCELLED,
    /** The event store rejected an out-of-sequence version. */
    CONCURRENCY_CONFLICT,
    /** The event could not be persisted. */
    PERSISTENCE_FAILURE
}
