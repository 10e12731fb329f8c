package eventsource.jdbc.store;

import eventsource.DomainEvent;
import eventsource.jdbc.JdbcTemplate;
import eventsource.jdbc.TableNames;
import eventsource.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * PostgreSQL event store.
 *
 * <p>Every append also issues {@code pg_notify(channel, envelope)} inside the append
 * transaction, so listeners are notified only once the event is committed. The envelope is
 * a flat JSON object with {@code event_id}, {@code event_type}, {@code aggregate_id},
 * {@code aggregate_type}, {@code timestamp} and {@code version}.
 */
public final class PostgresEventStore extends AbstractJdbcEventStore {
  public static final String DEFAULT_CHANNEL = "domain_events";

  private final String channel;
  private final JsonCodec jsonCodec;

  public PostgresEventStore() {
    this(TableNames.EVENTS_TABLE, DEFAULT_CHANNEL, JsonCodec.getDefault());
  }

  public PostgresEventStore(String tableName) {
    this(tableName, DEFAULT_CHANNEL, JsonCodec.getDefault());
  }

  public PostgresEventStore(String tableName, String channel, JsonCodec jsonCodec) {
    super(tableName);
    this.channel = TableNames.validateChannel(channel);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresEventStore withTableName(String tableName) {
    return new PostgresEventStore(tableName, channel, jsonCodec);
  }

  public PostgresEventStore withChannel(String channel) {
    return new PostgresEventStore(tableName(), channel, jsonCodec);
  }

  public String channel() {
    return channel;
  }

  @Override
  protected void afterInsert(Connection conn, int timeoutSeconds, DomainEvent event) throws SQLException {
    JdbcTemplate.query(conn, timeoutSeconds, "SELECT pg_notify(?, ?)", rs -> null,
        channel, jsonCodec.toJson(envelope(event)));
  }

  static Map<String, String> envelope(DomainEvent event) {
    Map<String, String> envelope = new LinkedHashMap<>();
    envelope.put("event_id", event.eventId());
    envelope.put("event_type", event.eventType());
    envelope.put("aggregate_id", event.aggregateId());
    envelope.put("aggregate_type", event.aggregateType());
    envelope.put("timestamp", event.timestamp().toString());
    envelope.put("version", Long.toString(event.version()));
    return envelope;
  }
}
