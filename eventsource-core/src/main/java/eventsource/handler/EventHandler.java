package eventsource.handler;

import eventsource.DomainEvent;

/**
 * Synchronous event subscriber.
 *
 * <p>An exception thrown from {@link #handle} is caught by the bus, classified and
 * reported as a {@link HandlerResult.Failure}; it never stops other subscribers.
 *
 * @param <E> the event type this handler accepts
 * @see AsyncEventHandler
 */
@FunctionalInterface
public interface EventHandler<E extends DomainEvent> {

    /**
     * Handles one event.
     *
     * @param event the event being dispatched
     * @throws Exception on failure
     */
    void handle(E event) throws Exception;

    /**
     * Additional filter evaluated after the subscription's type and topic filters.
     *
     * <p>Defaults to {@code true}; the subscription's event class filter already
     * performs the type match.
     */
    default boolean canHandle(DomainEvent event) {
        return true;
    }
}
