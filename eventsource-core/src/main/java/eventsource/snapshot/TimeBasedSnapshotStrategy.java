package eventsource.snapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshots an aggregate at most once per {@code threshold}.
 *
 * <p>The first check for an aggregate id always answers {@code true}. A {@code true}
 * answer also records the current time as that aggregate's last snapshot time, so the
 * caller is expected to take the snapshot whenever this strategy says so.
 */
public final class TimeBasedSnapshotStrategy implements SnapshotStrategy {
  public static final Duration DEFAULT_THRESHOLD = Duration.ofMinutes(60);

  private final Duration threshold;
  private final Clock clock;
  private final ConcurrentHashMap<String, Instant> lastSnapshot = new ConcurrentHashMap<>();

  public TimeBasedSnapshotStrategy() {
    this(DEFAULT_THRESHOLD, Clock.systemUTC());
  }

  public TimeBasedSnapshotStrategy(Duration threshold, Clock clock) {
    Objects.requireNonNull(threshold, "threshold");
    if (threshold.isNegative()) {
      throw new IllegalArgumentException("threshold must not be negative");
    }
    this.threshold = threshold;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean shouldSnapshot(String aggregateId, long eventCount) {
    Instant now = clock.instant();
    boolean[] due = new boolean[1];
    lastSnapshot.compute(aggregateId, (id, last) -> {
      if (last == null || Duration.between(last, now).compareTo(threshold) >= 0) {
        due[0] = true;
        return now;
      }
      return last;
    });
    return due[0];
  }

  public Duration threshold() {
    return threshold;
  }
}
