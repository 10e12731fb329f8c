package eventsource.store;

import eventsource.DomainEvent;

import java.util.List;

/**
 * Append-only, versioned event persistence with optimistic concurrency.
 *
 * <p>Versions are enforced at write time (see {@link VersionGuard}); no lock is held
 * between a caller's read and its append. Implementations must be safe for concurrent
 * use.
 *
 * @see InMemoryEventStore
 * @see FileEventStore
 */
public interface EventStore {

    /**
     * Durably appends one event.
     *
     * @param event event carrying an aggregate id and the next version of that aggregate
     * @throws ConcurrencyConflictException if the version is not the current version plus one
     * @throws EventStoreException          if the event cannot be stored
     * @throws IllegalArgumentException     if the event has no aggregate id
     */
    void append(DomainEvent event);

    /**
     * Returns events matching {@code query} in ascending append order (ascending version
     * within one aggregate), truncated to the query's limit.
     *
     * @throws EventStoreException if the events cannot be read
     */
    List<DomainEvent> getEvents(EventQuery query);

    /**
     * Returns all events of one aggregate in version order.
     */
    default List<DomainEvent> getEvents(String aggregateId) {
        return getEvents(EventQuery.forAggregate(aggregateId));
    }

    /**
     * Returns the highest stored version of an aggregate, or {@code 0} if it has none.
     */
    long currentVersion(String aggregateId);
}
