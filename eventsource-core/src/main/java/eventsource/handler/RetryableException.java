package eventsource.handler;

/**
 * Thrown by a handler to signal a transient failure. The default
 * {@link ErrorClassifier} maps it to {@link ErrorKind#RETRYABLE}.
 */
public class RetryableException extends RuntimeException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
