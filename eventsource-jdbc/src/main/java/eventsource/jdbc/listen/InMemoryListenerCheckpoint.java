package eventsource.jdbc.listen;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkpoint kept in process memory; a restarted listener replays from the beginning.
 */
public final class InMemoryListenerCheckpoint implements ListenerCheckpoint {
  private final ConcurrentHashMap<String, Long> positions = new ConcurrentHashMap<>();

  @Override
  public long load(String listenerName) {
    return positions.getOrDefault(listenerName, 0L);
  }

  @Override
  public void save(String listenerName, long position) {
    positions.put(listenerName, position);
  }
}
