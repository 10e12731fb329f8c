package eventsource.snapshot;

import eventsource.util.Cancellation;
import eventsource.util.JsonCodec;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each snapshot as {@code <directory>/<url-encoded aggregate id>.json}, a flat
 * JSON object whose {@code _type} field records the aggregate type.
 *
 * <p>Writes go to a temporary file that is then moved over the target, so readers never
 * see a partially written snapshot.
 */
public final class FileSystemSnapshotStore extends AbstractSnapshotStore {
  static final String TYPE_FIELD = "_type";

  private final Path directory;
  private final JsonCodec jsonCodec;

  public FileSystemSnapshotStore(Path directory) {
    this(directory, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public FileSystemSnapshotStore(Path directory, JsonCodec jsonCodec, Clock clock) {
    super(clock);
    this.directory = Objects.requireNonNull(directory, "directory");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new SnapshotStoreException("Failed to create snapshot directory " + directory, e);
    }
  }

  @Override
  protected void save(Snapshot snapshot) {
    Cancellation.throwIfCancelled("Snapshot save for " + snapshot.aggregateId());
    Map<String, String> record = new LinkedHashMap<>();
    record.put("aggregateId", snapshot.aggregateId());
    record.put(TYPE_FIELD, snapshot.aggregateType());
    record.put("version", Long.toString(snapshot.version()));
    record.put("timestamp", snapshot.timestamp().toString());
    record.put("state", snapshot.state());
    Path target = fileFor(snapshot.aggregateId());
    Path temp = null;
    try {
      temp = Files.createTempFile(directory, ".snapshot-", ".tmp");
      Files.writeString(temp, jsonCodec.toJson(record), StandardCharsets.UTF_8);
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(temp, e);
      throw new SnapshotStoreException("Failed to write snapshot for " + snapshot.aggregateId(), e);
    }
  }

  @Override
  public Optional<Snapshot> loadSnapshot(String aggregateId) {
    Cancellation.throwIfCancelled("Snapshot load for " + aggregateId);
    Path file = fileFor(aggregateId);
    String json;
    try {
      json = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new SnapshotStoreException("Failed to read snapshot for " + aggregateId, e);
    }
    try {
      Map<String, String> record = jsonCodec.parseObject(json);
      return Optional.of(new Snapshot(
          require(record, "aggregateId", file),
          require(record, TYPE_FIELD, file),
          Long.parseLong(require(record, "version", file)),
          Instant.parse(require(record, "timestamp", file)),
          require(record, "state", file)));
    } catch (IllegalArgumentException | DateTimeParseException e) {
      throw new SnapshotStoreException("Malformed snapshot file " + file, e);
    }
  }

  @Override
  public void deleteSnapshot(String aggregateId) {
    try {
      Files.deleteIfExists(fileFor(aggregateId));
    } catch (IOException e) {
      throw new SnapshotStoreException("Failed to delete snapshot for " + aggregateId, e);
    }
  }

  public Path directory() {
    return directory;
  }

  Path fileFor(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    return directory.resolve(URLEncoder.encode(aggregateId, StandardCharsets.UTF_8) + ".json");
  }

  private static String require(Map<String, String> record, String key, Path file) {
    String value = record.get(key);
    if (value == null) {
      throw new SnapshotStoreException("Snapshot file " + file + " is missing " + key);
    }
    return value;
  }

  private static void deleteQuietly(Path temp, IOException original) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      original.addSuppressed(e);
    }
  }
}
