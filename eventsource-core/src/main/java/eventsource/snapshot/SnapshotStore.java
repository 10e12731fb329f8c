package eventsource.snapshot;

import java.util.Optional;

/**
 * Keeps the latest snapshot per aggregate id.
 *
 * @see InMemorySnapshotStore
 * @see FileSystemSnapshotStore
 */
public interface SnapshotStore {

    /**
     * Captures {@code aggregate}'s current state, replacing any earlier snapshot for its id.
     *
     * @throws SnapshotStoreException if the snapshot cannot be written
     */
    void saveSnapshot(SnapshotCapable aggregate);

    /**
     * Restores the aggregate from its snapshot.
     *
     * @return the restored aggregate, or empty if no snapshot exists or the stored
     *         snapshot was recorded under a different type
     * @throws SnapshotStoreException if the snapshot cannot be read or restored
     */
    <A extends SnapshotCapable> Optional<A> getSnapshot(String aggregateId, SnapshotType<A> type);

    /**
     * Returns the raw stored snapshot, whatever its type.
     */
    Optional<Snapshot> loadSnapshot(String aggregateId);

    /**
     * Removes the snapshot for {@code aggregateId}. Deleting a missing snapshot is a no-op.
     */
    void deleteSnapshot(String aggregateId);
}
