package eventsource.middleware;

/**
 * States of a {@link CircuitBreakerState}.
 */
public enum CircuitState {
    /** Calls pass through; failures are counted. */
    CLOSED,
    /** Calls are rejected until the recovery timeout elapses. */
    OPEN,
    /** Trial calls pass through; one failure reopens, enough successes close. */
    HALF_OPEN
}
