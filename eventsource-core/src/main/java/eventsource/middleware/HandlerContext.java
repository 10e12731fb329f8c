package eventsource.middleware;

import eventsource.DomainEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a middleware stage sees of one handler invocation: the event, caller-supplied
 * metadata from {@code publish}, and the name of the handler being invoked.
 */
public final class HandlerContext {
    private final DomainEvent event;
    private final Map<String, Object> metadata;
    private final String handlerName;

    public HandlerContext(DomainEvent event, Map<String, ?> metadata, String handlerName) {
        this.event = Objects.requireNonNull(event, "event");
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.handlerName = Objects.requireNonNull(handlerName, "handlerName");
    }

    public DomainEvent event() {
        return event;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public String handlerName() {
        return handlerName;
    }

    @Override
    public String toString() {
        return "HandlerContext{event=" + event + ", handler=" + handlerName + '}';
    }
}
