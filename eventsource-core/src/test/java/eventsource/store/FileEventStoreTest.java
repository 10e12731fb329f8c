package eventsource.store;

import eventsource.DomainEvent;
import eventsource.util.JsonCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileEventStoreTest {

    @TempDir
    Path dir;

    static final class OrderPlaced extends DomainEvent {
        OrderPlaced(Builder builder) {
            super(builder);
        }
    }

    private static DomainEvent event(String aggregateId, long version) {
        return DomainEvent.builder("OrderPlaced")
                .aggregateId(aggregateId)
                .aggregateType("Order")
                .version(version)
                .correlationId("corr-" + version)
                .topic("orders.placed")
                .payloadJson("{\"line\":\"" + version + "\"}")
                .build();
    }

    @Test
    void eventsSurviveReopen() {
        Path file = dir.resolve("log/events.jsonl");
        DomainEvent first = event("order-1", 1);
        try (FileEventStore store = new FileEventStore(file)) {
            store.append(first);
            store.append(event("order-1", 2));
            store.append(event("order-2", 1));
        }

        try (FileEventStore reopened = new FileEventStore(file)) {
            assertEquals(2, reopened.currentVersion("order-1"));
            DomainEvent loaded = reopened.getEvents("order-1").get(0);
            assertEquals(first.eventId(), loaded.eventId());
            assertEquals(first.timestamp(), loaded.timestamp());
            assertEquals("corr-1", loaded.correlationId());
            assertEquals("orders.placed", loaded.topic());
            assertEquals("{\"line\":\"1\"}", loaded.payloadJson());
            assertEquals(3, reopened.getEvents(EventQuery.all()).size());

            reopened.append(event("order-1", 3));
        }
    }

    @Test
    void versionConflictLeavesFileUntouched() throws IOException {
        Path file = dir.resolve("events.jsonl");
        try (FileEventStore store = new FileEventStore(file)) {
            store.append(event("order-1", 1));
            long size = Files.size(file);

            assertThrows(ConcurrencyConflictException.class, () -> store.append(event("order-1", 3)));
            assertEquals(size, Files.size(file));
        }
    }

    @Test
    void duplicateEventIdIsRejectedBeforeWriting() throws IOException {
        Path file = dir.resolve("events.jsonl");
        try (FileEventStore store = new FileEventStore(file)) {
            DomainEvent first = event("order-1", 1);
            store.append(first);
            long size = Files.size(file);

            assertThrows(EventStoreException.class,
                    () -> store.append(first.toBuilder().aggregateId("order-2").build()));
            assertEquals(size, Files.size(file));
        }
    }

    @Test
    void tamperedLineFailsVerification() throws IOException {
        Path file = dir.resolve("events.jsonl");
        try (FileEventStore store = new FileEventStore(file)) {
            store.append(event("order-1", 1));
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Files.writeString(file, content.replace("orders.placed", "orders.cancelled"), StandardCharsets.UTF_8);

        EventStoreException ex = assertThrows(EventStoreException.class, () -> new FileEventStore(file));
        assertTrue(ex.getMessage().startsWith("Hash mismatch"));
    }

    @Test
    void outOfSequenceLogFailsToLoad() throws IOException {
        Path file = dir.resolve("events.jsonl");
        JsonCodec codec = JsonCodec.getDefault();
        Map<String, String> record = EventRecords.toRecord(event("order-1", 2));
        Files.writeString(file, codec.toJson(record) + "\n", StandardCharsets.UTF_8);

        assertThrows(EventStoreException.class, () -> new FileEventStore(file));
    }

    @Test
    void malformedLineFailsToLoad() throws IOException {
        Path file = dir.resolve("events.jsonl");
        Files.writeString(file, "not json\n", StandardCharsets.UTF_8);

        assertThrows(EventStoreException.class, () -> new FileEventStore(file));
    }

    @Test
    void eventFactoryRestoresSubclasses() {
        Path file = dir.resolve("events.jsonl");
        try (FileEventStore store = new FileEventStore(file)) {
            store.append(event("order-1", 1));
        }

        EventFactory factory = EventFactory.mapping(Map.of("OrderPlaced", OrderPlaced::new));
        try (FileEventStore reopened = new FileEventStore(file, JsonCodec.getDefault(), factory)) {
            List<DomainEvent> events = reopened.getEvents("order-1");
            assertInstanceOf(OrderPlaced.class, events.get(0));
        }
    }

    @Test
    void appendAfterCloseFails() {
        FileEventStore store = new FileEventStore(dir.resolve("events.jsonl"));
        store.close();
        store.close();

        assertThrows(IllegalStateException.class, () -> store.append(event("order-1", 1)));
    }

    @Test
    void failedWriteIsRolledBackSoTheLogStillLoads() throws IOException {
        Path file = dir.resolve("events.jsonl");
        FailingChannel[] channel = new FailingChannel[1];
        DomainEvent second = event("order-1", 2);
        try (FileEventStore store = new FileEventStore(file, JsonCodec.getDefault(), EventFactory.DEFAULT,
                f -> channel[0] = new FailingChannel(FileChannel.open(f, StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND)))) {
            store.append(event("order-1", 1));
            long sizeBefore = Files.size(file);

            channel[0].failWrites = true;
            assertThrows(EventStoreException.class, () -> store.append(second));
            assertEquals(sizeBefore, Files.size(file));
            assertEquals(1, store.currentVersion("order-1"));

            channel[0].failWrites = false;
            store.append(second);
        }

        try (FileEventStore reopened = new FileEventStore(file)) {
            assertEquals(2, reopened.currentVersion("order-1"));
            assertEquals(second.eventId(), reopened.getEvents("order-1").get(1).eventId());
        }
    }

    /**
     * Writes half of the first buffer it is given, then fails, while {@code failWrites} is set.
     */
    static final class FailingChannel extends FileChannel {
        private final FileChannel delegate;
        volatile boolean failWrites;
        private boolean partialWritten;

        FailingChannel(FileChannel delegate) {
            this.delegate = delegate;
        }

        @Override
        public int write(ByteBuffer src) throws IOException {
            if (!failWrites) {
                partialWritten = false;
                return delegate.write(src);
            }
            if (partialWritten) {
                throw new IOException("disk full");
            }
            partialWritten = true;
            ByteBuffer half = src.duplicate();
            half.limit(src.position() + src.remaining() / 2);
            int written = delegate.write(half);
            src.position(src.position() + written);
            return written;
        }

        @Override
        public int read(ByteBuffer dst) throws IOException {
            return delegate.read(dst);
        }

        @Override
        public long read(ByteBuffer[] dsts, int offset, int length) throws IOException {
            return delegate.read(dsts, offset, length);
        }

        @Override
        public long write(ByteBuffer[] srcs, int offset, int length) throws IOException {
            return delegate.write(srcs, offset, length);
        }

        @Override
        public long position() throws IOException {
            return delegate.position();
        }

        @Override
        public FileChannel position(long newPosition) throws IOException {
            delegate.position(newPosition);
            return this;
        }

        @Override
        public long size() throws IOException {
            return delegate.size();
        }

        @Override
        public FileChannel truncate(long size) throws IOException {
            delegate.truncate(size);
            return this;
        }

        @Override
        public void force(boolean metaData) throws IOException {
            delegate.force(metaData);
        }

        @Override
        public long transferTo(long position, long count, WritableByteChannel target) throws IOException {
            return delegate.transferTo(position, count, target);
        }

        @Override
        public long transferFrom(ReadableByteChannel src, long position, long count) throws IOException {
            return delegate.transferFrom(src, position, count);
        }

        @Override
        public int read(ByteBuffer dst, long position) throws IOException {
            return delegate.read(dst, position);
        }

        @Override
        public int write(ByteBuffer src, long position) throws IOException {
            return delegate.write(src, position);
        }

        @Override
        public MappedByteBuffer map(MapMode mode, long position, long size) throws IOException {
            return delegate.map(mode, position, size);
        }

        @Override
        public FileLock lock(long position, long size, boolean shared) throws IOException {
            return delegate.lock(position, size, shared);
        }

        @Override
        public FileLock tryLock(long position, long size, boolean shared) throws IOException {
            return delegate.tryLock(position, size, shared);
        }

        @Override
        protected void implCloseChannel() throws IOException {
            delegate.close();
        }
    }
}
