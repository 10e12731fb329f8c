package eventsource.middleware;

import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryOptionsTest {

    @Test
    void defaultsDoubleFromBaseAndCapAtMax() {
        RetryOptions options = RetryOptions.defaults();

        long[] expected = {100, 200, 400, 800, 1600, 3200, 5000, 5000};
        for (int attempt = 0; attempt < expected.length; attempt++) {
            assertEquals(expected[attempt], options.delayMs(attempt), "attempt " + attempt);
        }
        assertEquals(3, options.maxRetries());
    }

    @Test
    void hugeAttemptStaysCapped() {
        assertEquals(5000, RetryOptions.defaults().delayMs(10_000));
    }

    @Test
    void negativeAttemptHasNoDelay() {
        assertEquals(0, RetryOptions.defaults().delayMs(-1));
    }

    @Test
    void emptyRetryableKindsRetriesEverything() {
        RetryOptions options = RetryOptions.defaults();

        assertTrue(options.shouldRetry(HandlerResult.failure(ErrorKind.HANDLER_FAILURE, "x")));
        assertTrue(options.shouldRetry(HandlerResult.failure(ErrorKind.TIMEOUT, "x")));
    }

    @Test
    void retryOnRestrictsKinds() {
        RetryOptions options = RetryOptions.builder()
                .retryOn(ErrorKind.RETRYABLE, ErrorKind.TIMEOUT)
                .build();

        assertTrue(options.shouldRetry(HandlerResult.failure(ErrorKind.TIMEOUT, "x")));
        assertFalse(options.shouldRetry(HandlerResult.failure(ErrorKind.NON_RETRYABLE, "x")));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> RetryOptions.builder().maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> RetryOptions.builder().baseDelayMs(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> RetryOptions.builder().baseDelayMs(100).maxDelayMs(50).build());
        assertThrows(IllegalArgumentException.class, () -> RetryOptions.builder().backoffFactor(0.5).build());
    }
}
