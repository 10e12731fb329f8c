package eventsource.store;

/**
 * Thrown by {@link EventStore#append} when an event's version is not exactly one past
 * the aggregate's current version.
 *
 * <p>Never retried automatically: the caller must re-read the aggregate and recompute
 * the change against its new version.
 */
public final class ConcurrencyConflictException extends RuntimeException {
    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    /**
     * @param aggregateId     the aggregate whose stream rejected the event
     * @param expectedVersion the version the store would have accepted
     * @param actualVersion   the version the event carried
     */
    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
        super("Version conflict for aggregate " + aggregateId
                + ": expected version " + expectedVersion + " but got " + actualVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        this(aggregateId, expectedVersion, actualVersion);
        initCause(cause);
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
