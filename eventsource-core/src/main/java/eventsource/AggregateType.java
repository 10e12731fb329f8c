package eventsource;

/**
 * Type-safe aggregate type name, persisted with every event and snapshot.
 *
 * <pre>{@code
 * public enum Aggregates implements AggregateType {
 *   ORDER,
 *   CUSTOMER
 * }
 * }</pre>
 */
public interface AggregateType {

    /**
     * Returns the aggregate type name.
     *
     * @return the aggregate type name, never null
     */
    String name();
}
