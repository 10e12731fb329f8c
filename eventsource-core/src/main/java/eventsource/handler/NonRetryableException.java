package eventsource.handler;

/**
 * Thrown by a handler to signal a permanent failure that retrying cannot fix.
 * The default {@link ErrorClassifier} maps it to {@link ErrorKind#NON_RETRYABLE}.
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
