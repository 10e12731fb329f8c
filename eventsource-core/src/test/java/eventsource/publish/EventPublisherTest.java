package eventsource.publish;

import eventsource.DomainEvent;
import eventsource.bus.EventBus;
import eventsource.handler.ErrorKind;
import eventsource.spi.RecordingMetricsExporter;
import eventsource.spi.RecordingStructuredLogger;
import eventsource.store.ConcurrencyConflictException;
import eventsource.store.EventQuery;
import eventsource.store.EventStore;
import eventsource.store.EventStoreException;
import eventsource.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventPublisherTest {
    private final InMemoryEventStore store = new InMemoryEventStore();
    private final EventBus bus = EventBus.builder().structuredLogger(new RecordingStructuredLogger()).build();
    private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    private final List<String> dispatched = new CopyOnWriteArrayList<>();

    private EventPublisher newPublisher(EventStore eventStore) {
        bus.subscribe(DomainEvent.class, e -> {
            // handlers only ever see persisted events
            assertTrue(eventStore == null || eventStore.currentVersion(e.aggregateId()) >= e.version());
            dispatched.add(e.eventId());
        });
        return EventPublisher.builder()
                .eventBus(bus)
                .eventStore(eventStore)
                .structuredLogger(new RecordingStructuredLogger())
                .metricsExporter(metrics)
                .build();
    }

    private static DomainEvent event(String aggregateId, long version) {
        return DomainEvent.builder("OrderEvent").aggregateId(aggregateId).version(version).build();
    }

    @Test
    void publishPendingPersistsThenDispatchesInOrder() {
        EventPublisher publisher = newPublisher(store);
        DomainEvent e1 = event("order-1", 1);
        DomainEvent e2 = event("order-1", 2);
        publisher.add(e1);
        publisher.add(e2);
        assertEquals(2, publisher.pendingCount());
        assertTrue(dispatched.isEmpty());

        List<PublishResult> results = publisher.publishPending();

        assertEquals(2, results.size());
        assertTrue(results.stream().allMatch(PublishResult::isPublished));
        assertEquals(List.of(e1.eventId(), e2.eventId()), dispatched);
        assertEquals(List.of(e1.eventId(), e2.eventId()),
                store.getEvents("order-1").stream().map(DomainEvent::eventId).collect(Collectors.toList()));
        assertEquals(0, publisher.pendingCount());
        assertEquals(2, metrics.count("eventsAppended"));
        assertEquals(2, metrics.count("eventsPublished"));
    }

    @Test
    void secondDrainIsNoOp() {
        EventPublisher publisher = newPublisher(store);
        publisher.add(event("order-1", 1));
        publisher.publishPending();

        assertTrue(publisher.publishPending().isEmpty());
        assertEquals(1, dispatched.size());
    }

    @Test
    void conflictingEventIsRejectedAndNotDispatched() {
        EventPublisher publisher = newPublisher(store);
        store.append(event("order-1", 1));
        DomainEvent stale = event("order-1", 1);

        PublishResult result = publisher.publish(stale);

        PublishResult.Rejected rejected = assertInstanceOf(PublishResult.Rejected.class, result);
        assertEquals(ErrorKind.CONCURRENCY_CONFLICT, rejected.kind());
        assertInstanceOf(ConcurrencyConflictException.class, rejected.cause());
        assertTrue(dispatched.isEmpty());
        assertEquals(1, metrics.count("concurrencyConflict"));
        assertEquals(1, metrics.count("publishRejected"));
    }

    @Test
    void batchIsBestEffort() {
        EventPublisher publisher = newPublisher(store);
        DomainEvent ok1 = event("order-1", 1);
        DomainEvent bad = event("order-2", 3);
        DomainEvent ok2 = event("order-3", 1);

        List<PublishResult> results = publisher.publishMany(List.of(ok1, bad, ok2));

        assertTrue(results.get(0).isPublished());
        assertInstanceOf(PublishResult.Rejected.class, results.get(1));
        assertTrue(results.get(2).isPublished());
        assertEquals(List.of(ok1.eventId(), ok2.eventId()), dispatched);
    }

    @Test
    void storeFailureIsPersistenceFailure() {
        EventStore failing = new EventStore() {
            @Override
            public void append(DomainEvent event) {
                throw new EventStoreException("disk full");
            }

            @Override
            public List<DomainEvent> getEvents(EventQuery query) {
                return List.of();
            }

            @Override
            public long currentVersion(String aggregateId) {
                return 0;
            }
        };
        EventPublisher publisher = EventPublisher.builder()
                .eventBus(bus)
                .eventStore(failing)
                .structuredLogger(new RecordingStructuredLogger())
                .build();

        PublishResult.Rejected rejected = (PublishResult.Rejected) publisher.publish(event("order-1", 1));

        assertEquals(ErrorKind.PERSISTENCE_FAILURE, rejected.kind());
        assertEquals("disk full", rejected.message());
    }

    @Test
    void withoutStoreOnlyDispatches() {
        EventPublisher publisher = newPublisher(null);

        PublishResult result = publisher.publish(event("order-1", 7));

        PublishResult.Published published = assertInstanceOf(PublishResult.Published.class, result);
        assertTrue(published.allHandlersSucceeded());
        assertEquals(1, dispatched.size());
    }

    @Test
    void handlerResultsAreReported() {
        EventPublisher publisher = newPublisher(store);
        bus.subscribe(DomainEvent.class, e -> {
            throw new IllegalStateException("projection down");
        });
        DomainEvent e1 = event("order-1", 1);

        PublishResult.Published published = (PublishResult.Published) publisher.publish(e1);

        assertSame(e1, published.event());
        assertEquals(2, published.handlerResults().size());
        assertFalse(published.allHandlersSucceeded());
        assertEquals(1, store.currentVersion("order-1"));
    }

    @Test
    void builderRequiresBus() {
        assertThrows(NullPointerException.class, () -> EventPublisher.builder().build());
    }

    // ── Concurrency ───────────────────────────────────────────────

    @Test
    void concurrentAddsAndDrainsPublishEveryEventExactlyOnce() throws Exception {
        EventPublisher publisher = newPublisher(store);
        int producers = 4;
        int perProducer = 250;
        ExecutorService executor = Executors.newFixedThreadPool(producers + 2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean producing = new AtomicBoolean(true);
        AtomicInteger results = new AtomicInteger();
        try {
            List<Future<?>> adders = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                int producer = p;
                adders.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        publisher.add(event("order-" + producer + "-" + i, 1));
                    }
                    return null;
                }));
            }
            List<Future<?>> drainers = new ArrayList<>();
            for (int d = 0; d < 2; d++) {
                drainers.add(executor.submit(() -> {
                    start.await();
                    while (producing.get()) {
                        results.addAndGet(publisher.publishPending().size());
                    }
                    return null;
                }));
            }

            start.countDown();
            for (Future<?> adder : adders) {
                adder.get(10, TimeUnit.SECONDS);
            }
            producing.set(false);
            for (Future<?> drainer : drainers) {
                drainer.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        results.addAndGet(publisher.publishPending().size());

        int total = producers * perProducer;
        assertEquals(total, results.get());
        assertEquals(total, dispatched.size());
        assertEquals(total, new HashSet<>(dispatched).size());
        assertEquals(total, store.getEvents(EventQuery.all()).size());
        assertEquals(0, publisher.pendingCount());
    }
}
