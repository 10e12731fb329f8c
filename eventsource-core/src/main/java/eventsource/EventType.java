package eventsource;

/**
 * Type-safe event type name for {@link DomainEvent.Builder#eventType(EventType)}.
 *
 * <p>Enums satisfy the contract without overriding {@link #name()}:
 * <pre>{@code
 * public enum OrderEvents implements EventType {
 *   ORDER_PLACED,
 *   ORDER_SHIPPED
 * }
 * }</pre>
 */
public interface EventType {

    /**
     * Returns the name stored with the event and used for metrics and breaker keys.
     *
     * @return the event type name, never null
     */
    String name();
}
