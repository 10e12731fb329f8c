package eventsource.jdbc.listen;

/**
 * Persists the last global position an {@link EventStreamListener} has delivered.
 */
public interface ListenerCheckpoint {

    /**
     * Returns the last delivered position for {@code listenerName}, or {@code 0} if none.
     */
    long load(String listenerName);

    /**
     * Records {@code position} as delivered for {@code listenerName}.
     */
    void save(String listenerName, long position);
}
