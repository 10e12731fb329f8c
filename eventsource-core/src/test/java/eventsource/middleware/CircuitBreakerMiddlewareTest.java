package eventsource.middleware;

import eventsource.DomainEvent;
import eventsource.handler.ErrorKind;
import eventsource.handler.HandlerResult;
import eventsource.spi.RecordingMetricsExporter;
import eventsource.spi.RecordingStructuredLogger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircuitBreakerMiddlewareTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final RecordingMetricsExporter metrics = new RecordingMetricsExporter();
    private final AtomicInteger calls = new AtomicInteger();
    private final EventMiddleware.Next failing = ctx -> {
        calls.incrementAndGet();
        return HandlerResult.failure(ErrorKind.HANDLER_FAILURE, "down");
    };
    private final EventMiddleware.Next succeeding = ctx -> {
        calls.incrementAndGet();
        return HandlerResult.success();
    };

    private CircuitBreakerMiddleware.Builder breaker() {
        return CircuitBreakerMiddleware.builder()
                .failureThreshold(2)
                .recoveryTimeout(Duration.ofSeconds(30))
                .successThreshold(1)
                .clock(clock)
                .structuredLogger(new RecordingStructuredLogger())
                .metricsExporter(metrics);
    }

    private static HandlerContext context(String eventType) {
        return new HandlerContext(DomainEvent.builder(eventType).aggregateId("a-1").build(), Map.of(), "handler");
    }

    @Test
    void openBreakerRejectsWithoutInvokingHandler() {
        CircuitBreakerMiddleware middleware = breaker().build();
        middleware.process(context("OrderPlaced"), failing);
        middleware.process(context("OrderPlaced"), failing);

        HandlerResult result = middleware.process(context("OrderPlaced"), failing);

        HandlerResult.Failure failure = assertInstanceOf(HandlerResult.Failure.class, result);
        assertEquals(ErrorKind.CIRCUIT_OPEN, failure.kind());
        assertEquals("Circuit breaker open for event type OrderPlaced", failure.message());
        assertEquals(2, calls.get());
        assertEquals(1, metrics.count("circuitRejected"));
        assertEquals(List.of("OrderPlaced=OPEN"), metrics.circuitStates);
    }

    @Test
    void breakersAreIndependentPerEventType() {
        CircuitBreakerMiddleware middleware = breaker().build();
        middleware.process(context("OrderPlaced"), failing);
        middleware.process(context("OrderPlaced"), failing);

        HandlerResult result = middleware.process(context("OrderShipped"), succeeding);

        assertTrue(result.isSuccess());
        assertEquals(CircuitState.OPEN, middleware.state("OrderPlaced").orElseThrow().state());
        assertEquals(CircuitState.CLOSED, middleware.state("OrderShipped").orElseThrow().state());
    }

    @Test
    void recoversThroughHalfOpenAfterTimeout() {
        CircuitBreakerMiddleware middleware = breaker().build();
        middleware.process(context("OrderPlaced"), failing);
        middleware.process(context("OrderPlaced"), failing);

        clock.advance(Duration.ofSeconds(30));
        HandlerResult result = middleware.process(context("OrderPlaced"), succeeding);

        assertTrue(result.isSuccess());
        assertEquals(CircuitState.CLOSED, middleware.state("OrderPlaced").orElseThrow().state());
        assertEquals(List.of("OrderPlaced=OPEN", "OrderPlaced=HALF_OPEN", "OrderPlaced=CLOSED"),
                metrics.circuitStates);
    }

    @Test
    void eventsOutsideAllowListBypassBreaker() {
        CircuitBreakerMiddleware middleware = breaker().eventTypes(Set.of("PaymentCaptured")).build();
        for (int i = 0; i < 5; i++) {
            middleware.process(context("OrderPlaced"), failing);
        }

        assertEquals(5, calls.get());
        assertTrue(middleware.state("OrderPlaced").isEmpty());
    }

    @Test
    void thrownExceptionCountsAsFailureAndPropagates() {
        CircuitBreakerMiddleware middleware = breaker().build();
        EventMiddleware.Next throwing = ctx -> {
            throw new IllegalStateException("boom");
        };

        assertThrows(IllegalStateException.class, () -> middleware.process(context("OrderPlaced"), throwing));
        assertThrows(IllegalStateException.class, () -> middleware.process(context("OrderPlaced"), throwing));

        assertEquals(CircuitState.OPEN, middleware.state("OrderPlaced").orElseThrow().state());
    }

    @Test
    void customKeyExtractorGuardsPerHandler() {
        CircuitBreakerMiddleware middleware = breaker().keyExtractor(HandlerContext::handlerName).build();
        middleware.process(context("OrderPlaced"), failing);
        middleware.process(context("OrderShipped"), failing);

        assertEquals(CircuitState.OPEN, middleware.state("handler").orElseThrow().state());
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerMiddleware.builder().failureThreshold(0).build());
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerMiddleware.builder().successThreshold(0).build());
    }

    @Test
    void parallelFailuresOpenTheBreakerExactlyOnce() throws Exception {
        CircuitBreakerMiddleware middleware = breaker().failureThreshold(50).build();
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                workers.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        middleware.process(context("OrderPlaced"), failing);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        CircuitBreakerState state = middleware.state("OrderPlaced").orElseThrow();
        assertEquals(CircuitState.OPEN, state.state());
        assertEquals(List.of("OrderPlaced=OPEN"), metrics.circuitStates);
        assertTrue(state.failureCount() >= 50);
        assertEquals(calls.get(), state.failureCount());
        assertEquals(threads * perThread, calls.get() + metrics.count("circuitRejected"));
    }
}
