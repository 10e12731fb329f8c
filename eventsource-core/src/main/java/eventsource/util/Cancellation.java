package eventsource.util;

import java.util.concurrent.CancellationException;

/**
 * Cancellation checks for blocking round-trips. A thread's interrupt flag is the
 * cancellation signal; it is left set so callers further up can observe it too.
 */
public final class Cancellation {

    /**
     * Throws if the current thread has been interrupted.
     *
     * @param operation short description used in the exception message
     * @throws CancellationException if the current thread is interrupted
     */
    public static void throwIfCancelled(String operation) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(operation + " cancelled");
        }
    }

    /**
     * Converts an {@link InterruptedException} into a {@link CancellationException},
     * restoring the interrupt flag.
     */
    public static CancellationException cancelled(String operation, InterruptedException cause) {
        Thread.currentThread().interrupt();
        CancellationException ex = new CancellationException(operation + " cancelled");
        ex.initCause(cause);
        return ex;
    }

    private Cancellation() {}
}
