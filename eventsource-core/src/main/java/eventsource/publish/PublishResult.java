package eventsource.publish;

import eventsource.DomainEvent;
import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of publishing one event through an {@link EventPublisher}.
 */
public sealed interface PublishResult permits PublishResult.Published, PublishResult.Rejected {

    DomainEvent event();

    /**
     * The event was persisted (when a store is configured) and dispatched.
     *
     * @param event          the published event
     * @param handlerResults one result per matching subscription, in dispatch order
     */
    record Published(DomainEvent event, List<HandlerResult> handlerResults) implements PublishResult {
        public Published {
            Objects.requireNonNull(event, "event");
            handlerResults = List.copyOf(handlerResults);
        }

        /**
         * Returns whether every handler succeeded.
         */
        public boolean allHandlersSucceeded() {
            return handlerResults.stream().allMatch(HandlerResult::isSuccess);
        }
    }

    /**
     * The event could not be persisted and was not dispatched.
     *
     * @param event   the rejected event
     * @param kind    {@link ErrorKind#CONCURRENCY_CONFLICT} or {@link ErrorKind#PERSISTENCE_FAILURE}
     * @param message description of the failure
     * @param cause   the store's exception
     */
    record Rejected(DomainEvent event, ErrorKind kind, String message, Throwable cause) implements PublishResult {
        public Rejected {
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(kind, "kind");
        }
    }

    default boolean isPublished() {
        return this instanceof Published;
    }
}
