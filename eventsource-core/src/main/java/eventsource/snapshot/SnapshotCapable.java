package eventsource.snapshot;

/**
 * An aggregate whose state can be captured by a {@link SnapshotStore}.
 *
 * <p>{@link #snapshotState()} and the {@link SnapshotType.Restorer} registered for the
 * aggregate's type form its canonical serialize/deserialize pair: restoring a snapshot
 * must yield an aggregate equivalent to the one captured.
 */
public interface SnapshotCapable {

    String aggregateId();

    /**
     * Returns the type tag stored with the snapshot.
     *
     * <p>Defaults to the simple class name, matching {@link SnapshotType#of(Class, SnapshotType.Restorer)}.
     */
    default String aggregateType() {
        return getClass().getSimpleName();
    }

    /**
     * Returns the version of the last event applied to this aggregate.
     */
    long version();

    /**
     * Serializes the aggregate's state, typically as JSON.
     */
    String snapshotState();
}
