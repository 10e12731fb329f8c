package eventsource.jdbc.store;

import eventsource.DomainEvent;

/**
 * An event read back together with its global append position.
 *
 * @param position monotonically increasing position across all aggregates
 * @param event    the stored event
 */
public record StoredEvent(long position, DomainEvent event) {
}
