package eventsource.aggregate;

import eventsource.DomainEvent;
import eventsource.snapshot.SnapshotCapable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for event-sourced aggregates: state changes only by applying events.
 *
 * <p>Command methods build the next event with {@link #nextEvent(String)} and pass it to
 * {@link #raise}, which applies it and records it as uncommitted until an
 * {@link EventSourcedRepository} saves it. History is rebuilt with {@link #replay}.
 *
 * <pre>{@code
 * public final class Account extends AggregateRoot {
 *   private long balance;
 *
 *   public Account(String id) {
 *     super(id);
 *   }
 *
 *   public void deposit(long amount) {
 *     raise(nextEvent("Deposited").payloadJson("{\"amount\":\"" + amount + "\"}").build());
 *   }
 *
 *   @Override
 *   protected void apply(DomainEvent event) {
 *     if ("Deposited".equals(event.eventType())) {
 *       balance += Long.parseLong(JsonCodec.getDefault().parseObject(event.payloadJson()).get("amount"));
 *     }
 *   }
 *
 *   @Override
 *   public String snapshotState() {
 *     return Long.toString(balance);
 *   }
 * }
 * }</pre>
 */
public abstract class AggregateRoot implements SnapshotCapable {
    private final String aggregateId;
    private final List<DomainEvent> uncommitted = new ArrayList<>();
    private long version;
    private long snapshotVersion;

    /**
     * Creates a new aggregate with no history.
     */
    protected AggregateRoot(String aggregateId) {
        this(aggregateId, 0);
    }

    /**
     * Creates an aggregate restored from a snapshot taken at {@code version}.
     */
    protected AggregateRoot(String aggregateId, long version) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.version = version;
        this.snapshotVersion = version;
    }

    /**
     * Mutates state for one event. Must not fail for events this aggregate raised itself.
     */
    protected abstract void apply(DomainEvent event);

    /**
     * Returns a builder for this aggregate's next event, with id, type and version set.
     */
    protected final DomainEvent.Builder nextEvent(String eventType) {
        return DomainEvent.builder(eventType)
                .aggregateId(aggregateId)
                .aggregateType(aggregateType())
                .version(version + 1);
    }

    /**
     * Applies a new event and records it for the next save.
     *
     * @throws IllegalStateException if the event belongs to another aggregate or is not the next version
     */
    protected final <E extends DomainEvent> E raise(E event) {
        checkNext(event);
        apply(event);
        version = event.version();
        uncommitted.add(event);
        return event;
    }

    /**
     * Applies stored events in version order without recording them as uncommitted.
     *
     * @throws IllegalStateException if the history has a gap or belongs to another aggregate
     */
    public final void replay(List<? extends DomainEvent> history) {
        for (DomainEvent event : history) {
            checkNext(event);
            apply(event);
            version = event.version();
        }
    }

    private void checkNext(DomainEvent event) {
        if (!aggregateId.equals(event.aggregateId())) {
            throw new IllegalStateException("Event " + event.eventId() + " belongs to aggregate "
                    + event.aggregateId() + ", not " + aggregateId);
        }
        if (event.version() != version + 1) {
            throw new IllegalStateException("Event " + event.eventId() + " has version " + event.version()
                    + " but aggregate " + aggregateId + " expects " + (version + 1));
        }
    }

    @Override
    public final String aggregateId() {
        return aggregateId;
    }

    /**
     * Returns the version of the last applied event, including uncommitted ones.
     */
    @Override
    public final long version() {
        return version;
    }

    public final List<DomainEvent> uncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommitted));
    }

    public final void markCommitted() {
        uncommitted.clear();
    }

    /**
     * Returns how many events have been applied since the last snapshot, or since
     * creation if none was taken.
     */
    public final long eventsSinceSnapshot() {
        return version - snapshotVersion;
    }

    final void markSnapshotTaken() {
        snapshotVersion = version;
    }
}
