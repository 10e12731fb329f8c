package eventsource.store;

import eventsource.DomainEvent;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat-record form of an event for the JSON-lines log.
 */
final class EventRecords {
  static final String HASH = "eventHash";

  static Map<String, String> toRecord(DomainEvent event) {
    Map<String, String> record = new LinkedHashMap<>();
    record.put("eventId", event.eventId());
    record.put("eventType", event.eventType());
    record.put("timestamp", event.timestamp().toString());
    record.put("aggregateId", event.aggregateId());
    record.put("aggregateType", event.aggregateType());
    record.put("version", Long.toString(event.version()));
    record.put("correlationId", event.correlationId());
    record.put("causationId", event.causationId());
    record.put("topic", event.topic());
    record.put("payload", event.payloadJson());
    record.put(HASH, EventHashes.sha256(event));
    return record;
  }

  static DomainEvent fromRecord(Map<String, String> record, EventFactory factory) {
    String eventType = require(record, "eventType");
    DomainEvent.Builder builder = DomainEvent.builder(eventType)
        .eventId(require(record, "eventId"))
        .aggregateId(record.get("aggregateId"))
        .aggregateType(record.get("aggregateType"))
        .correlationId(record.get("correlationId"))
        .causationId(record.get("causationId"))
        .topic(record.get("topic"))
        .payloadJson(record.get("payload"));
    try {
      builder.timestamp(Instant.parse(require(record, "timestamp")));
      builder.version(Long.parseLong(require(record, "version")));
    } catch (DateTimeParseException | NumberFormatException e) {
      throw new EventStoreException("Malformed event record " + record.get("eventId"), e);
    }
    return factory.create(eventType, builder);
  }

  private static String require(Map<String, String> record, String key) {
    String value = record.get(key);
    if (value == null) {
      throw new EventStoreException("Event record is missing " + key);
    }
    return value;
  }

  private EventRecords() {}
}
