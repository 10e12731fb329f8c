package eventsource.store;

import eventsource.DomainEvent;
import eventsource.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hash stored alongside each persisted event for tamper and corruption checks.
 *
 * <p>The hash is SHA-256 over the key-sorted JSON of the event's fields, with the
 * timestamp at millisecond precision so it survives database round-trips.
 */
public final class EventHashes {

    /**
     * Returns the lower-case hex SHA-256 of the event's canonical form.
     */
    public static String sha256(DomainEvent event) {
        Map<String, String> canonical = new TreeMap<>();
        canonical.put("aggregateId", event.aggregateId());
        canonical.put("aggregateType", event.aggregateType());
        canonical.put("causationId", event.causationId());
        canonical.put("correlationId", event.correlationId());
        canonical.put("eventId", event.eventId());
        canonical.put("eventType", event.eventType());
        canonical.put("payload", event.payloadJson());
        canonical.put("timestamp", Long.toString(event.timestamp().toEpochMilli()));
        canonical.put("topic", event.topic());
        canonical.put("version", Long.toString(event.version()));
        String json = JsonCodec.getDefault().toJson(canonical);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private EventHashes() {}
}
