package eventsource.spi;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link StructuredLogger} that appends fields to the message as {@code key=value} pairs
 * and logs through {@link Logger#getLogger(String)}. A {@link Throwable} under the
 * {@code "error"} key is attached to the record as its thrown value.
 */
public final class JulStructuredLogger implements StructuredLogger {
  static final JulStructuredLogger INSTANCE = new JulStructuredLogger();

  JulStructuredLogger() {
  }

  @Override
  public void log(Level level, String message, String name, Map<String, ?> fields) {
    Logger logger = Logger.getLogger(name);
    if (!logger.isLoggable(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(message);
    Throwable thrown = null;
    for (Map.Entry<String, ?> field : fields.entrySet()) {
      Object value = field.getValue();
      if (value instanceof Throwable t) {
        thrown = t;
        value = t.toString();
      }
      sb.append(' ').append(field.getKey()).append('=').append(value);
    }
    if (thrown != null) {
      logger.log(level, sb.toString(), thrown);
    } else {
      logger.log(level, sb.toString());
    }
  }

  @Override
  public boolean isLoggable(Level level, String name) {
    return Logger.getLogger(name).isLoggable(level);
  }
}
