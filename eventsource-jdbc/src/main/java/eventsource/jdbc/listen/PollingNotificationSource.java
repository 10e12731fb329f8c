package eventsource.jdbc.listen;

import java.time.Duration;
import java.util.List;

/**
 * Notification source for databases without LISTEN support. Each wait simply sleeps for
 * the timeout, turning the listener into a fixed-interval poller.
 */
public final class PollingNotificationSource implements NotificationSource {

  @Override
  public List<EventNotification> await(Duration timeout) throws InterruptedException {
    Thread.sleep(timeout.toMillis());
    return List.of();
  }
}
