package eventsource.snapshot;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared capture and typed-restore logic. Subclasses only persist, load and delete
 * {@link Snapshot} values.
 */
public abstract class AbstractSnapshotStore implements SnapshotStore {
  private static final Logger logger = Logger.getLogger(AbstractSnapshotStore.class.getName());

  private final Clock clock;

  protected AbstractSnapshotStore() {
    this(Clock.systemUTC());
  }

  protected AbstractSnapshotStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  protected abstract void save(Snapshot snapshot);

  @Override
  public final void saveSnapshot(SnapshotCapable aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    String state = aggregate.snapshotState();
    if (state == null) {
      throw new SnapshotStoreException("Aggregate " + aggregate.aggregateId() + " produced null snapshot state");
    }
    save(new Snapshot(aggregate.aggregateId(), aggregate.aggregateType(), aggregate.version(),
        clock.instant(), state));
  }

  @Override
  public final <A extends SnapshotCapable> Optional<A> getSnapshot(String aggregateId, SnapshotType<A> type) {
    Objects.requireNonNull(type, "type");
    Optional<Snapshot> stored = loadSnapshot(aggregateId);
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    Snapshot snapshot = stored.get();
    if (!type.name().equals(snapshot.aggregateType())) {
      logger.log(Level.FINE, "Snapshot for {0} has type {1}, requested {2}",
          new Object[]{aggregateId, snapshot.aggregateType(), type.name()});
      return Optional.empty();
    }
    try {
      return Optional.of(type.restore(snapshot));
    } catch (RuntimeException e) {
      throw new SnapshotStoreException("Failed to restore " + type.name() + " snapshot for " + aggregateId, e);
    }
  }
}
