package eventsource.snapshot;

import eventsource.util.Cancellation;

import java.util.List;
import java.util.Objects;

/**
 * Logical OR over child strategies, evaluated in order and stopping at the first
 * {@code true}; later children are not consulted, so their side effects do not run.
 *
 * <p>The calling thread's interrupt flag is checked before each child.
 */
public final class CompositeSnapshotStrategy implements SnapshotStrategy {
  private final List<SnapshotStrategy> strategies;

  public CompositeSnapshotStrategy(SnapshotStrategy... strategies) {
    this(List.of(strategies));
  }

  public CompositeSnapshotStrategy(List<SnapshotStrategy> strategies) {
    Objects.requireNonNull(strategies, "strategies");
    if (strategies.isEmpty()) {
      throw new IllegalArgumentException("strategies must not be empty");
    }
    this.strategies = List.copyOf(strategies);
  }

  /**
   * @throws java.util.concurrent.CancellationException if the calling thread is interrupted
   */
  @Override
  public boolean shouldSnapshot(String aggregateId, long eventCount) {
    for (SnapshotStrategy strategy : strategies) {
      Cancellation.throwIfCancelled("Snapshot decision for " + aggregateId);
      if (strategy.shouldSnapshot(aggregateId, eventCount)) {
        return true;
      }
    }
    return false;
  }

  public List<SnapshotStrategy> strategies() {
    return strategies;
  }
}
