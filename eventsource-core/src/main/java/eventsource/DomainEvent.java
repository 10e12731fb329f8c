package eventsource;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain event: something that happened to an aggregate, at a version.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default. Events are never
 * mutated; {@link #withMetadata} derives a copy. Applications may subclass to expose typed
 * accessors over the JSON payload; a subclass overrides {@link #rebuild(Builder)} so that
 * derived copies keep its runtime type:
 *
 * <pre>{@code
 * public final class OrderPlaced extends DomainEvent {
 *   public OrderPlaced(Builder builder) {
 *     super(builder);
 *   }
 *
 *   @Override
 *   protected DomainEvent rebuild(Builder builder) {
 *     return new OrderPlaced(builder);
 *   }
 * }
 *
 * OrderPlaced event = new OrderPlaced(DomainEvent.builder()
 *     .aggregateId("order-1")
 *     .aggregateType("Order")
 *     .version(1)
 *     .topic("orders.placed")
 *     .payloadJson("{\"amount\":42}"));
 * }</pre>
 *
 * <p>When no event type is set, a subclass defaults to its simple class name.
 *
 * @see eventsource.store.EventStore
 * @see eventsource.bus.EventBus
 */
public class DomainEvent {
    private final String eventId;
    private final String eventType;
    private final Instant timestamp;
    private final String aggregateId;
    private final String aggregateType;
    private final long version;
    private final String correlationId;
    private final String causationId;
    private final String topic;
    private final String payloadJson;

    protected DomainEvent(Builder builder) {
        Objects.requireNonNull(builder, "builder");
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        if (builder.eventType != null) {
            this.eventType = builder.eventType;
        } else if (getClass() != DomainEvent.class) {
            this.eventType = getClass().getSimpleName();
        } else {
            throw new NullPointerException("eventType");
        }
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        if (builder.version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.aggregateId = builder.aggregateId;
        this.aggregateType = builder.aggregateType;
        this.version = builder.version;
        this.correlationId = builder.correlationId;
        this.causationId = builder.causationId;
        this.topic = builder.topic;
        this.payloadJson = builder.payloadJson == null ? "{}" : builder.payloadJson;
    }

    /**
     * Creates a builder without an explicit event type. Only valid for subclasses,
     * which default the type to their simple class name.
     */
    public static Builder builder() {
        return new Builder(null);
    }

    /**
     * Creates a builder with a string event type.
     *
     * @param eventType the event type name
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(Objects.requireNonNull(eventType, "eventType"));
    }

    /**
     * Creates a builder with a type-safe event type.
     *
     * @param eventType the event type (enum or other EventType implementation)
     * @return a new builder
     */
    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType.name());
    }

    /**
     * Returns a builder pre-populated with every field of this event, including its id.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(eventType);
        builder.eventId = eventId;
        builder.timestamp = timestamp;
        builder.aggregateId = aggregateId;
        builder.aggregateType = aggregateType;
        builder.version = version;
        builder.correlationId = correlationId;
        builder.causationId = causationId;
        builder.topic = topic;
        builder.payloadJson = payloadJson;
        return builder;
    }

    /**
     * Returns a copy of this event with the given tracing and routing metadata.
     * A {@code null} argument keeps the current value. The copy keeps this event's id,
     * version and payload, and its runtime type (see {@link #rebuild(Builder)}).
     *
     * @param correlationId correlation id, or {@code null} to keep
     * @param causationId   causation id, or {@code null} to keep
     * @param topic         routing topic, or {@code null} to keep
     * @return a new event instance
     */
    public DomainEvent withMetadata(String correlationId, String causationId, String topic) {
        Builder builder = toBuilder();
        if (correlationId != null) {
            builder.correlationId = correlationId;
        }
        if (causationId != null) {
            builder.causationId = causationId;
        }
        if (topic != null) {
            builder.topic = topic;
        }
        return rebuild(builder);
    }

    /**
     * Creates an instance of this event's runtime type from {@code builder}.
     * Subclasses override to return their own type.
     */
    protected DomainEvent rebuild(Builder builder) {
        return new DomainEvent(builder);
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    /**
     * Returns this event's position in its aggregate's stream, starting at 1.
     */
    public long version() {
        return version;
    }

    public String correlationId() {
        return correlationId;
    }

    public String causationId() {
        return causationId;
    }

    /**
     * Returns the routing topic, or {@code null} when the event carries none.
     */
    public String topic() {
        return topic;
    }

    public String payloadJson() {
        return payloadJson;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("{eventId=").append(eventId)
                .append(", eventType=").append(eventType)
                .append(", aggregateId=").append(aggregateId)
                .append(", version=").append(version);
        if (topic != null) {
            sb.append(", topic=").append(topic);
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link DomainEvent} and its subclasses.
     */
    public static final class Builder {
        private String eventType;
        private String eventId;
        private Instant timestamp;
        private String aggregateId;
        private String aggregateType;
        private long version = 1;
        private String correlationId;
        private String causationId;
        private String topic;
        private String payloadJson;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Overrides the event type name.
         *
         * @param eventType the event type name
         * @return this builder
         */
        public Builder eventType(String eventType) {
            this.eventType = Objects.requireNonNull(eventType, "eventType");
            return this;
        }

        /**
         * Overrides the event type with a type-safe {@link EventType}.
         *
         * @param eventType the event type
         * @return this builder
         */
        public Builder eventType(EventType eventType) {
            Objects.requireNonNull(eventType, "eventType");
            this.eventType = eventType.name();
            return this;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the event timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()} at build time.
         *
         * @param timestamp when the event occurred
         * @return this builder
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Sets the identifier of the aggregate the event belongs to.
         *
         * <p>Required for events that are appended to an event store.
         *
         * @param aggregateId the aggregate identifier
         * @return this builder
         */
        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        /**
         * Sets the aggregate type name.
         *
         * <p>Optional. Defaults to {@code null}.
         *
         * @param aggregateType the aggregate type name
         * @return this builder
         */
        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * Sets the aggregate type using a type-safe {@link AggregateType}.
         *
         * @param aggregateType the aggregate type
         * @return this builder
         */
        public Builder aggregateType(AggregateType aggregateType) {
            Objects.requireNonNull(aggregateType, "aggregateType");
            this.aggregateType = aggregateType.name();
            return this;
        }

        /**
         * Sets the event's version within its aggregate stream.
         *
         * <p>Optional. Defaults to {@code 1}. Must be {@code >= 1}.
         *
         * @param version the aggregate version this event produces
         * @return this builder
         */
        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        /**
         * Sets the routing topic matched by topic-pattern subscriptions.
         *
         * <p>Optional. Events without a topic never match a topic pattern.
         *
         * @param topic the routing topic
         * @return this builder
         */
        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        /**
         * Sets the event payload as a JSON string.
         *
         * <p>Optional. Defaults to {@code "{}"}.
         *
         * @param payloadJson the JSON payload
         * @return this builder
         */
        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Builds a plain {@link DomainEvent}. Subclasses are built by passing the builder
         * to their constructor instead.
         *
         * @return a new event
         * @throws NullPointerException     if no event type was set
         * @throws IllegalArgumentException if the event type is empty or the version is below 1
         */
        public DomainEvent build() {
            return new DomainEvent(this);
        }
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
