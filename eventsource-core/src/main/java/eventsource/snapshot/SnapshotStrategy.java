package eventsource.snapshot;

/**
 * Decides when an aggregate's state should be captured.
 *
 * @see EventCountSnapshotStrategy
 * @see TimeBasedSnapshotStrategy
 * @see CompositeSnapshotStrategy
 */
@FunctionalInterface
public interface SnapshotStrategy {

    /**
     * @param aggregateId the aggregate being saved
     * @param eventCount  events applied since the aggregate's last snapshot
     * @return whether to take a snapshot now
     */
    boolean shouldSnapshot(String aggregateId, long eventCount);
}
