package eventsource.handler;

import eventsource.store.ConcurrencyConflictException;
import eventsource.store.EventStoreException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps a {@link Throwable} raised by a handler or store to an {@link ErrorKind}.
 *
 * <p>Retry and breaker decisions are made on the kind, so handlers written against any
 * exception hierarchy can participate by supplying a classifier.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Default classification. {@link CompletionException} and {@link ExecutionException}
     * wrappers are unwrapped first; unknown exceptions are {@link ErrorKind#HANDLER_FAILURE}.
     */
    ErrorClassifier DEFAULT = error -> {
        Throwable t = unwrap(error);
        if (t instanceof RetryableException) {
            return ErrorKind.RETRYABLE;
        }
        if (t instanceof NonRetryableException) {
            return ErrorKind.NON_RETRYABLE;
        }
        if (t instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (t instanceof InterruptedException || t instanceof CancellationException) {
            return ErrorKind.CANCELLED;
        }
        if (t instanceof ConcurrencyConflictException) {
            return ErrorKind.CONCURRENCY_CONFLICT;
        }
        if (t instanceof EventStoreException) {
            return ErrorKind.PERSISTENCE_FAILURE;
        }
        return ErrorKind.HANDLER_FAILURE;
    };

    ErrorKind classify(Throwable error);

    /**
     * Returns a classifier that checks {@code mappings} in insertion order using
     * {@code isInstance}, falling back to {@code fallback} when nothing matches.
     *
     * @param mappings exception type to kind
     * @param fallback classifier for unmatched exceptions
     */
    static ErrorClassifier byType(Map<Class<? extends Throwable>, ErrorKind> mappings, ErrorClassifier fallback) {
        Objects.requireNonNull(fallback, "fallback");
        Map<Class<? extends Throwable>, ErrorKind> copy = new LinkedHashMap<>(mappings);
        return error -> {
            Throwable t = unwrap(error);
            for (Map.Entry<Class<? extends Throwable>, ErrorKind> entry : copy.entrySet()) {
                if (entry.getKey().isInstance(t)) {
                    return entry.getValue();
                }
            }
            return fallback.classify(error);
        };
    }

    /**
     * Wraps a throwable as a {@link HandlerResult.Failure} with this classifier's kind.
     */
    default HandlerResult.Failure toFailure(Throwable error) {
        Throwable t = unwrap(error);
        return HandlerResult.failure(classify(t), t.getMessage(), t);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
