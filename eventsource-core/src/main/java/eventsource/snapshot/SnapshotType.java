package eventsource.snapshot;

import java.util.Objects;

/**
 * Names a snapshot type and knows how to rebuild the aggregate from it.
 *
 * <pre>{@code
 * SnapshotType<Order> ORDER = SnapshotType.of(Order.class, Order::fromSnapshot);
 * Optional<Order> order = snapshotStore.getSnapshot("order-1", ORDER);
 * }</pre>
 *
 * @param <A> the aggregate type
 */
public final class SnapshotType<A extends SnapshotCapable> {

  /**
   * Rebuilds an aggregate from a stored snapshot.
   */
  @FunctionalInterface
  public interface Restorer<A> {
    A restore(Snapshot snapshot);
  }

  private final String name;
  private final Restorer<A> restorer;

  private SnapshotType(String name, Restorer<A> restorer) {
    this.name = Objects.requireNonNull(name, "name");
    this.restorer = Objects.requireNonNull(restorer, "restorer");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
  }

  /**
   * Creates a type named after the class's simple name.
   */
  public static <A extends SnapshotCapable> SnapshotType<A> of(Class<A> type, Restorer<A> restorer) {
    return new SnapshotType<>(type.getSimpleName(), restorer);
  }

  public static <A extends SnapshotCapable> SnapshotType<A> of(String name, Restorer<A> restorer) {
    return new SnapshotType<>(name, restorer);
  }

  public String name() {
    return name;
  }

  public A restore(Snapshot snapshot) {
    return restorer.restore(snapshot);
  }

  @Override
  public String toString() {
    return "SnapshotType{" + name + '}';
  }
}
