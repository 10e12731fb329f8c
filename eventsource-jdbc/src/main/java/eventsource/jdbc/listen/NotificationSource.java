package eventsource.jdbc.listen;

import java.time.Duration;
import java.util.List;

/**
 * Wakes the {@link EventStreamListener} when new events may have been committed.
 *
 * <p>Notifications are hints only: the listener always re-reads the event table from its
 * checkpoint, so a lost or duplicated notification delays delivery but never skips an event.
 */
public interface NotificationSource extends AutoCloseable {

    /**
     * Blocks for up to {@code timeout} waiting for notifications.
     *
     * @return notifications received, empty if the timeout elapsed first
     * @throws InterruptedException if the waiting thread is interrupted
     */
    List<EventNotification> await(Duration timeout) throws InterruptedException;

    @Override
    default void close() {
    }
}
