package eventsource.store;

import eventsource.DomainEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Materializes stored events as their application subclass so that class-filtered
 * subscriptions still match after an event has been read back from a store.
 *
 * <pre>{@code
 * EventFactory factory = EventFactory.mapping(Map.of(
 *     "OrderPlaced", OrderPlaced::new,
 *     "OrderShipped", OrderShipped::new));
 * }</pre>
 */
@FunctionalInterface
public interface EventFactory {

    /**
     * Builds plain {@link DomainEvent} instances.
     */
    EventFactory DEFAULT = (eventType, builder) -> builder.build();

    /**
     * Creates the event for a stored row.
     *
     * @param eventType the stored event type name
     * @param builder   builder already populated with every stored field
     */
    DomainEvent create(String eventType, DomainEvent.Builder builder);

    /**
     * Returns a factory using a constructor per event type name and plain events for
     * unmapped types.
     */
    static EventFactory mapping(Map<String, Function<DomainEvent.Builder, ? extends DomainEvent>> constructors) {
        Map<String, Function<DomainEvent.Builder, ? extends DomainEvent>> copy = new HashMap<>(constructors);
        return (eventType, builder) -> {
            Function<DomainEvent.Builder, ? extends DomainEvent> constructor = copy.get(eventType);
            return constructor == null ? builder.build() : Objects.requireNonNull(constructor.apply(builder), eventType);
        };
    }
}
