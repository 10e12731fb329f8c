package eventsource.store;

import eventsource.DomainEvent;

/**
 * Version rule shared by every {@link EventStore}: an aggregate's first event is version 1
 * and each later event is exactly the current version plus one.
 */
public final class VersionGuard {

    /**
     * Verifies that {@code event} may be appended to a stream currently at {@code currentVersion}.
     *
     * @param event          the event to append
     * @param currentVersion the aggregate's current version, {@code 0} if it has no events
     * @throws IllegalArgumentException      if the event has no aggregate id
     * @throws ConcurrencyConflictException if the version is out of sequence
     */
    public static void checkAppendable(DomainEvent event, long currentVersion) {
        requireAggregateId(event);
        long expected = currentVersion + 1;
        if (event.version() != expected) {
            throw new ConcurrencyConflictException(event.aggregateId(), expected, event.version());
        }
    }

    public static String requireAggregateId(DomainEvent event) {
        if (event.aggregateId() == null || event.aggregateId().isEmpty()) {
            throw new IllegalArgumentException("Event " + event.eventId() + " has no aggregateId");
        }
        return event.aggregateId();
    }

    private VersionGuard() {}
}
