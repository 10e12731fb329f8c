package eventsource.handler;

import java.util.Objects;

/**
 * Outcome of one handler invocation as it leaves the middleware pipeline.
 *
 * <p>Pipeline-local failures (open circuit, exhausted retries, handler exceptions) are
 * always reported as a {@link Failure} value, never thrown.
 */
public sealed interface HandlerResult permits HandlerResult.Success, HandlerResult.Failure {

    /**
     * The handler completed.
     *
     * @param value value produced by an asynchronous handler's stage, or {@code null}
     */
    record Success(Object value) implements HandlerResult {
    }

    /**
     * The handler did not complete.
     *
     * @param kind    classification used by retry and breaker middleware
     * @param message human-readable description
     * @param cause   underlying exception, or {@code null} for synthetic failures
     */
    record Failure(ErrorKind kind, String message, Throwable cause) implements HandlerResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            if (message == null) {
                message = cause != null && cause.getMessage() != null ? cause.getMessage() : kind.name();
            }
        }
    }

    static HandlerResult success() {
        return new Success(null);
    }

    static HandlerResult success(Object value) {
        return new Success(value);
    }

    static Failure failure(ErrorKind kind, String message) {
        return new Failure(kind, message, null);
    }

    static Failure failure(ErrorKind kind, String message, Throwable cause) {
        return new Failure(kind, message, cause);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
