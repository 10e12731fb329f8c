package eventsource.middleware;

import eventsource.handler.HandlerResult;

/**
 * Decides whether a failed invocation is retried and how long to wait first.
 *
 * @see RetryOptions
 * @see RetryMiddleware
 */
public interface RetryPolicy {

    /**
     * Maximum number of retries after the first attempt.
     */
    int maxRetries();

    /**
     * Returns whether {@code failure} is eligible for another attempt.
     */
    boolean shouldRetry(HandlerResult.Failure failure);

    /**
     * Computes the wait before the retry that follows attempt {@code attempt}.
     *
     * @param attempt the attempt that just failed (0-based)
     * @return delay in milliseconds (non-negative)
     */
    long delayMs(int attempt);
}
