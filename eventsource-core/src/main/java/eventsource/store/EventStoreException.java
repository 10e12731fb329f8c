package eventsource.store;

/**
 * Unchecked exception for event store failures other than version conflicts:
 * I/O and JDBC errors, duplicate event ids, corrupt logs.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
