package eventsource.store;

import eventsource.DomainEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Event store held in process memory. Contents live as long as the instance.
 *
 * <p>The version check and the append happen under one write lock, so concurrent writers
 * to the same aggregate see exactly one winner per version. Reads share a read lock.
 */
public final class InMemoryEventStore implements EventStore {
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final List<DomainEvent> log = new ArrayList<>();
  private final Map<String, List<DomainEvent>> streams = new HashMap<>();
  private final Set<String> eventIds = new HashSet<>();

  @Override
  public void append(DomainEvent event) {
    String aggregateId = VersionGuard.requireAggregateId(event);
    lock.writeLock().lock();
    try {
      List<DomainEvent> stream = streams.get(aggregateId);
      VersionGuard.checkAppendable(event, stream == null ? 0 : stream.size());
      if (!eventIds.add(event.eventId())) {
        throw new EventStoreException("Duplicate event id " + event.eventId());
      }
      streams.computeIfAbsent(aggregateId, k -> new ArrayList<>()).add(event);
      log.add(event);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<DomainEvent> getEvents(EventQuery query) {
    lock.readLock().lock();
    try {
      List<DomainEvent> source;
      if (query.aggregateId() != null) {
        source = streams.getOrDefault(query.aggregateId(), Collections.emptyList());
      } else {
        source = log;
      }
      int limit = query.limit() == null ? Integer.MAX_VALUE : query.limit();
      List<DomainEvent> result = new ArrayList<>();
      for (DomainEvent event : source) {
        if (result.size() >= limit) {
          break;
        }
        if (query.matches(event)) {
          result.add(event);
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public long currentVersion(String aggregateId) {
    lock.readLock().lock();
    try {
      List<DomainEvent> stream = streams.get(aggregateId);
      return stream == null ? 0 : stream.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  boolean containsEventId(String eventId) {
    lock.readLock().lock();
    try {
      return eventIds.contains(eventId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the total number of stored events.
   */
  public int size() {
    lock.readLock().lock();
    try {
      return log.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}
