package eventsource.snapshot;

/**
 * Snapshots once at least {@code threshold} events have accumulated.
 */
public final class EventCountSnapshotStrategy implements SnapshotStrategy {
  public static final int DEFAULT_THRESHOLD = 10;

  private final long threshold;

  public EventCountSnapshotStrategy() {
    this(DEFAULT_THRESHOLD);
  }

  public EventCountSnapshotStrategy(long threshold) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
    }
    this.threshold = threshold;
  }

  @Override
  public boolean shouldSnapshot(String aggregateId, long eventCount) {
    return eventCount >= threshold;
  }

  public long threshold() {
    return threshold;
  }
}
