package eventsource.store;

import eventsource.DomainEvent;
import eventsource.util.JsonCodec;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Event store backed by an append-only JSON-lines file, one flat JSON object per event.
 *
 * <p>On open the whole log is read into an in-memory index; each line's stored hash is
 * verified and the version sequence re-checked, so a corrupt or hand-edited log fails
 * fast with an {@link EventStoreException}. Appends write and {@code fsync} the line
 * before the event becomes visible to readers.
 *
 * <p>A log file must be owned by a single {@code FileEventStore} at a time.
 */
public final class FileEventStore implements EventStore, AutoCloseable {
  private static final Logger logger = Logger.getLogger(FileEventStore.class.getName());

  private final Path file;
  private final JsonCodec jsonCodec;
  private final InMemoryEventStore index = new InMemoryEventStore();
  private final Object writeLock = new Object();
  private FileChannel channel;

  /** Opens the log for appending. */
  @FunctionalInterface
  interface ChannelOpener {
    FileChannel open(Path file) throws IOException;
  }

  public FileEventStore(Path file) {
    this(file, JsonCodec.getDefault(), EventFactory.DEFAULT);
  }

  /**
   * @param file         log file; created (with parent directories) if missing
   * @param jsonCodec    codec for log lines
   * @param eventFactory materializes loaded events as application subclasses
   * @throws EventStoreException if the log cannot be opened or fails verification
   */
  public FileEventStore(Path file, JsonCodec jsonCodec, EventFactory eventFactory) {
    this(file, jsonCodec, eventFactory, f -> FileChannel.open(f, StandardOpenOption.CREATE,
        StandardOpenOption.WRITE, StandardOpenOption.APPEND));
  }

  FileEventStore(Path file, JsonCodec jsonCodec, EventFactory eventFactory, ChannelOpener opener) {
    this.file = Objects.requireNonNull(file, "file");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    Objects.requireNonNull(eventFactory, "eventFactory");
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      int loaded = load(eventFactory);
      this.channel = opener.open(file);
      logger.log(Level.FINE, "Opened event log {0} with {1} events", new Object[]{file, loaded});
    } catch (IOException e) {
      throw new EventStoreException("Failed to open event log " + file, e);
    }
  }

  private int load(EventFactory eventFactory) throws IOException {
    if (!Files.exists(file)) {
      return 0;
    }
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Map<String, String> record;
        try {
          record = jsonCodec.parseObject(line);
        } catch (IllegalArgumentException e) {
          throw new EventStoreException("Malformed line " + lineNumber + " in " + file, e);
        }
        DomainEvent event = EventRecords.fromRecord(record, eventFactory);
        String expectedHash = EventHashes.sha256(event);
        if (!expectedHash.equals(record.get(EventRecords.HASH))) {
          throw new EventStoreException("Hash mismatch for event " + event.eventId()
              + " at line " + lineNumber + " in " + file);
        }
        try {
          index.append(event);
        } catch (ConcurrencyConflictException e) {
          throw new EventStoreException("Out-of-sequence event at line " + lineNumber + " in " + file, e);
        }
      }
    }
    return index.size();
  }

  @Override
  public void append(DomainEvent event) {
    VersionGuard.requireAggregateId(event);
    synchronized (writeLock) {
      if (channel == null) {
        throw new IllegalStateException("FileEventStore is closed");
      }
      VersionGuard.checkAppendable(event, index.currentVersion(event.aggregateId()));
      if (index.containsEventId(event.eventId())) {
        throw new EventStoreException("Duplicate event id " + event.eventId());
      }
      byte[] line = (jsonCodec.toJson(EventRecords.toRecord(event)) + "\n").getBytes(StandardCharsets.UTF_8);
      long previousSize = -1;
      try {
        previousSize = channel.size();
        ByteBuffer buffer = ByteBuffer.wrap(line);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(false);
      } catch (IOException e) {
        EventStoreException failure =
            new EventStoreException("Failed to append event " + event.eventId() + " to " + file, e);
        if (previousSize >= 0) {
          // drop a partial line so the log still loads and the event can be retried
          try {
            channel.truncate(previousSize);
          } catch (IOException te) {
            failure.addSuppressed(te);
          }
        }
        throw failure;
      }
      index.append(event);
    }
  }

  @Override
  public List<DomainEvent> getEvents(EventQuery query) {
    return index.getEvents(query);
  }

  @Override
  public long currentVersion(String aggregateId) {
    return index.currentVersion(aggregateId);
  }

  public Path file() {
    return file;
  }

  @Override
  public void close() {
    synchronized (writeLock) {
      if (channel == null) {
        return;
      }
      try {
        channel.close();
      } catch (IOException e) {
        throw new EventStoreException("Failed to close event log " + file, e);
      } finally {
        channel = null;
      }
    }
  }
}
