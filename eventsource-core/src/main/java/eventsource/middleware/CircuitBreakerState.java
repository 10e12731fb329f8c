package eventsource.middleware;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Finite-state guard for one breaker key.
 *
 * <p>Transitions:
 * <ul>
 *   <li>CLOSED to OPEN when the failure count reaches {@code failureThreshold}</li>
 *   <li>OPEN to HALF_OPEN on the first {@link #canExecute()} after {@code recoveryTimeout}</li>
 *   <li>HALF_OPEN to CLOSED after {@code successThreshold} successes</li>
 *   <li>HALF_OPEN to OPEN on any failure</li>
 * </ul>
 *
 * <p>{@link #canExecute()} is not a pure query: it performs the OPEN to HALF_OPEN
 * transition. Every method synchronizes on this instance, so the check and the
 * subsequent record call observe a consistent state. Callers must follow each
 * {@code canExecute() == true} with exactly one {@link #recordSuccess()} or
 * {@link #recordFailure()}.
 */
public final class CircuitBreakerState {

  /**
   * Receives state changes. Invoked while the state's monitor is held.
   */
  @FunctionalInterface
  public interface TransitionListener {
    TransitionListener NONE = (key, from, to) -> { };

    void onTransition(String key, CircuitState from, CircuitState to);
  }

  private final String key;
  private final int failureThreshold;
  private final Duration recoveryTimeout;
  private final int successThreshold;
  private final Clock clock;
  private final TransitionListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private int successCount;
  private Instant openedAt;

  /**
   * Creates a state on the system clock with no transition listener.
   */
  public CircuitBreakerState(int failureThreshold, Duration recoveryTimeout, int successThreshold) {
    this("default", failureThreshold, recoveryTimeout, successThreshold, Clock.systemUTC(), TransitionListener.NONE);
  }

  /**
   * @param key              breaker key, reported to the listener
   * @param failureThreshold failures that open a closed breaker (must be &gt; 0)
   * @param recoveryTimeout  time an open breaker waits before allowing a trial call
   * @param successThreshold trial successes that close a half-open breaker (must be &gt; 0)
   * @param clock            time source
   * @param listener         state change listener
   */
  public CircuitBreakerState(String key, int failureThreshold, Duration recoveryTimeout, int successThreshold,
      Clock clock, TransitionListener listener) {
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold must be > 0");
    }
    if (successThreshold <= 0) {
      throw new IllegalArgumentException("successThreshold must be > 0");
    }
    Objects.requireNonNull(recoveryTimeout, "recoveryTimeout");
    if (recoveryTimeout.isNegative()) {
      throw new IllegalArgumentException("recoveryTimeout must not be negative");
    }
    this.key = Objects.requireNonNull(key, "key");
    this.failureThreshold = failureThreshold;
    this.recoveryTimeout = recoveryTimeout;
    this.successThreshold = successThreshold;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Returns whether a call may proceed, moving an OPEN breaker to HALF_OPEN once the
   * recovery timeout has elapsed.
   */
  public synchronized boolean canExecute() {
    switch (state) {
      case CLOSED:
      case HALF_OPEN:
        return true;
      case OPEN:
        if (Duration.between(openedAt, clock.instant()).compareTo(recoveryTimeout) >= 0) {
          successCount = 0;
          transition(CircuitState.HALF_OPEN);
          return true;
        }
        return false;
      default:
        throw new IllegalStateException("Unknown state " + state);
    }
  }

  public synchronized void recordSuccess() {
    if (state == CircuitState.HALF_OPEN) {
      successCount++;
      if (successCount >= successThreshold) {
        failureCount = 0;
        successCount = 0;
        transition(CircuitState.CLOSED);
      }
    } else if (state == CircuitState.CLOSED) {
      failureCount = 0;
    }
  }

  public synchronized void recordFailure() {
    failureCount++;
    if (state == CircuitState.HALF_OPEN) {
      successCount = 0;
      openedAt = clock.instant();
      transition(CircuitState.OPEN);
    } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
      openedAt = clock.instant();
      transition(CircuitState.OPEN);
    }
  }

  private void transition(CircuitState next) {
    CircuitState previous = state;
    state = next;
    listener.onTransition(key, previous, next);
  }

  public String key() {
    return key;
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  public synchronized int successCount() {
    return successCount;
  }

  /**
   * Returns when the breaker last opened, or {@code null} if it never has.
   */
  public synchronized Instant openedAt() {
    return openedAt;
  }

  @Override
  public synchronized String toString() {
    return "CircuitBreakerState{key=" + key + ", state=" + state + ", failureCount=" + failureCount
        + ", successCount=" + successCount + ", openedAt=" + openedAt + '}';
  }
}
