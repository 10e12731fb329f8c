package eventsource.middleware;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerStateTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<String> transitions = new ArrayList<>();

    private CircuitBreakerState newState() {
        return new CircuitBreakerState("OrderPlaced", 3, Duration.ofSeconds(10), 2, clock,
                (key, from, to) -> transitions.add(from + "->" + to));
    }

    @Test
    void opensAfterFailureThreshold() {
        CircuitBreakerState state = newState();

        state.recordFailure();
        state.recordFailure();
        assertEquals(CircuitState.CLOSED, state.state());
        assertTrue(state.canExecute());

        state.recordFailure();

        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(clock.instant(), state.openedAt());
        assertFalse(state.canExecute());
        assertEquals(List.of("CLOSED->OPEN"), transitions);
    }

    @Test
    void successInClosedStateResetsFailureCount() {
        CircuitBreakerState state = newState();
        state.recordFailure();
        state.recordFailure();

        state.recordSuccess();
        state.recordFailure();
        state.recordFailure();

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(2, state.failureCount());
    }

    @Test
    void canExecuteMovesToHalfOpenAfterRecoveryTimeout() {
        CircuitBreakerState state = newState();
        for (int i = 0; i < 3; i++) {
            state.recordFailure();
        }

        clock.advance(Duration.ofSeconds(9));
        assertFalse(state.canExecute());
        assertEquals(CircuitState.OPEN, state.state());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(state.canExecute());
        assertEquals(CircuitState.HALF_OPEN, state.state());
    }

    @Test
    void halfOpenClosesAfterSuccessThreshold() {
        CircuitBreakerState state = newState();
        for (int i = 0; i < 3; i++) {
            state.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));
        state.canExecute();

        state.recordSuccess();
        assertEquals(CircuitState.HALF_OPEN, state.state());
        state.recordSuccess();

        assertEquals(CircuitState.CLOSED, state.state());
        assertEquals(0, state.failureCount());
        assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
    }

    @Test
    void failureInHalfOpenReopensImmediately() {
        CircuitBreakerState state = newState();
        for (int i = 0; i < 3; i++) {
            state.recordFailure();
        }
        clock.advance(Duration.ofSeconds(10));
        state.canExecute();
        state.recordSuccess();

        clock.advance(Duration.ofSeconds(1));
        state.recordFailure();

        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(0, state.successCount());
        assertEquals(clock.instant(), state.openedAt());
        assertFalse(state.canExecute());
    }

    @Test
    void neverOpenedHasNoOpenedAt() {
        assertNull(newState().openedAt());
    }

    @Test
    void rejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerState(0, Duration.ZERO, 1));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerState(1, Duration.ZERO, 0));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerState(1, Duration.ofSeconds(-1), 1));
    }
}
