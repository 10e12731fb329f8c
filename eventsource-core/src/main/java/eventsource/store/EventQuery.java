package eventsource.store;

import eventsource.DomainEvent;

import java.time.Instant;

/**
 * Filter for {@link EventStore#getEvents(EventQuery)}. All supplied criteria are
 * AND-combined; unset criteria match everything.
 *
 * <pre>{@code
 * EventQuery query = EventQuery.builder()
 *     .aggregateId("order-1")
 *     .sinceVersion(5)
 *     .limit(100)
 *     .build();
 * }</pre>
 */
public final class EventQuery {
    private static final EventQuery ALL = builder().build();

    private final String aggregateId;
    private final String aggregateType;
    private final Long sinceVersion;
    private final Instant sinceTimestamp;
    private final Integer limit;

    private EventQuery(Builder builder) {
        if (builder.sinceVersion != null && builder.sinceVersion < 0) {
            throw new IllegalArgumentException("sinceVersion must be >= 0");
        }
        if (builder.limit != null && builder.limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        this.aggregateId = builder.aggregateId;
        this.aggregateType = builder.aggregateType;
        this.sinceVersion = builder.sinceVersion;
        this.sinceTimestamp = builder.sinceTimestamp;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Matches every stored event. */
    public static EventQuery all() {
        return ALL;
    }

    /** Matches every event of one aggregate. */
    public static EventQuery forAggregate(String aggregateId) {
        return builder().aggregateId(aggregateId).build();
    }

    public String aggregateId() {
        return aggregateId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    /** Inclusive lower bound on version, or {@code null}. */
    public Long sinceVersion() {
        return sinceVersion;
    }

    /** Inclusive lower bound on event timestamp, or {@code null}. */
    public Instant sinceTimestamp() {
        return sinceTimestamp;
    }

    public Integer limit() {
        return limit;
    }

    /**
     * Tests every criterion except {@code limit} against one event.
     */
    public boolean matches(DomainEvent event) {
        if (aggregateId != null && !aggregateId.equals(event.aggregateId())) {
            return false;
        }
        if (aggregateType != null && !aggregateType.equals(event.aggregateType())) {
            return false;
        }
        if (sinceVersion != null && event.version() < sinceVersion) {
            return false;
        }
        return sinceTimestamp == null || !event.timestamp().isBefore(sinceTimestamp);
    }

    @Override
    public String toString() {
        return "EventQuery{aggregateId=" + aggregateId + ", aggregateType=" + aggregateType
                + ", sinceVersion=" + sinceVersion + ", sinceTimestamp=" + sinceTimestamp
                + ", limit=" + limit + '}';
    }

    public static final class Builder {
        private String aggregateId;
        private String aggregateType;
        private Long sinceVersion;
        private Instant sinceTimestamp;
        private Integer limit;

        private Builder() {
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateId = aggregateId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        /**
         * Only events with {@code version >= sinceVersion}.
         */
        public Builder sinceVersion(long sinceVersion) {
            this.sinceVersion = sinceVersion;
            return this;
        }

        /**
         * Only events with {@code timestamp >= sinceTimestamp}.
         */
        public Builder sinceTimestamp(Instant sinceTimestamp) {
            this.sinceTimestamp = sinceTimestamp;
            return this;
        }

        /**
         * Maximum number of events returned, applied after ordering.
         */
        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(this);
        }
    }
}
