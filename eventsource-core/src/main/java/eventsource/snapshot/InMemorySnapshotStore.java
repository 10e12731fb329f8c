package eventsource.snapshot;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store held in process memory for the lifetime of the instance.
 */
public final class InMemorySnapshotStore extends AbstractSnapshotStore {
  private final ConcurrentHashMap<String, Snapshot> snapshots = new ConcurrentHashMap<>();

  public InMemorySnapshotStore() {
  }

  public InMemorySnapshotStore(Clock clock) {
    super(clock);
  }

  @Override
  protected void save(Snapshot snapshot) {
    snapshots.put(snapshot.aggregateId(), snapshot);
  }

  @Override
  public Optional<Snapshot> loadSnapshot(String aggregateId) {
    return Optional.ofNullable(snapshots.get(aggregateId));
  }

  @Override
  public void deleteSnapshot(String aggregateId) {
    snapshots.remove(aggregateId);
  }

  public int size() {
    return snapshots.size();
  }
}
