package eventsource.jdbc;

import java.util.Objects;

/**
 * Shared identifier validation for JDBC stores. Table and channel names are concatenated
 * into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String EVENTS_TABLE = "domain_events";
  public static final String SNAPSHOTS_TABLE = "snapshots";
  public static final String CHECKPOINTS_TABLE = "event_listener_checkpoints";
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public static String validateChannel(String channel) {
    Objects.requireNonNull(channel, "channel");
    if (!channel.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid channel name: " + channel);
    }
    return channel;
  }
}
