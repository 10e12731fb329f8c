package eventsource.snapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * Captured aggregate state at a version. A store keeps at most one per aggregate id.
 *
 * @param aggregateId   the aggregate the state belongs to
 * @param aggregateType the recorded type tag, compared on read by {@link SnapshotType#name()}
 * @param version       the aggregate version the state reflects
 * @param timestamp     when the snapshot was taken
 * @param state         serialized state, as produced by {@link SnapshotCapable#snapshotState()}
 */
public record Snapshot(String aggregateId, String aggregateType, long version, Instant timestamp, String state) {

    public Snapshot {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(state, "state");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
    }
}
