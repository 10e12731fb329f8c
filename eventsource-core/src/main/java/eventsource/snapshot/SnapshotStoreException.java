package eventsource.snapshot;

/**
 * Unchecked exception for snapshot persistence and restore failures.
 */
public class SnapshotStoreException extends RuntimeException {

    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
