package eventsource.bus;

/**
 * Dispatch order of subscriptions for one event: all HIGH subscribers run before
 * NORMAL, and NORMAL before LOW. Within a priority, registration order applies.
 */
public enum EventPriority {
  HIGH,
  NORMAL,
  LOW
}
