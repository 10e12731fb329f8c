package eventsource.handler;

import eventsource.DomainEvent;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous event subscriber. The bus awaits the returned stage before invoking the
 * next subscriber, so priority ordering still holds.
 *
 * @param <E> the event type this handler accepts
 */
@FunctionalInterface
public interface AsyncEventHandler<E extends DomainEvent> {

    /**
     * Starts handling one event.
     *
     * @param event the event being dispatched
     * @return a stage completing with an optional result value, or exceptionally on failure
     * @throws Exception if the handler fails before producing a stage
     */
    CompletionStage<?> handle(E event) throws Exception;

    default boolean canHandle(DomainEvent event) {
        return true;
    }
}
