package eventsource.jdbc.listen;

import java.util.Map;
import java.util.Objects;

/**
 * A commit notification received from the database.
 *
 * @param channel  channel the notification arrived on
 * @param envelope decoded envelope fields ({@code event_id}, {@code aggregate_id}, ...);
 *                 empty when the payload could not be decoded
 */
public record EventNotification(String channel, Map<String, String> envelope) {

    public EventNotification {
        Objects.requireNonNull(channel, "channel");
        envelope = envelope == null ? Map.of() : Map.copyOf(envelope);
    }

    public String eventId() {
        return envelope.get("event_id");
    }

    public String aggregateId() {
        return envelope.get("aggregate_id");
    }
}
