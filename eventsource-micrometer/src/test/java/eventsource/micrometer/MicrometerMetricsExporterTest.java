package eventsource.micrometer;

import eventsource.DomainEvent;
import eventsource.EventSourcing;
import eventsource.middleware.MetricsMiddleware;
import eventsource.store.InMemoryEventStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void storeCounters() {
    exporter.incrementEventsAppended();
    exporter.incrementEventsAppended();
    exporter.incrementConcurrencyConflict();

    assertEquals(2.0, counter("eventsource.store.appended").count());
    assertEquals(1.0, counter("eventsource.store.conflicts").count());
  }

  @Test
  void publisherAndSnapshotCounters() {
    exporter.incrementEventsPublished();
    exporter.incrementPublishRejected();
    exporter.incrementPublishRejected();
    exporter.incrementSnapshotsSaved();

    assertEquals(1.0, counter("eventsource.publish.published").count());
    assertEquals(2.0, counter("eventsource.publish.rejected").count());
    assertEquals(1.0, counter("eventsource.snapshot.saved").count());
  }

  @Test
  void handlerInvocationsAreTimedByTypeAndOutcome() {
    exporter.recordHandlerInvocation("OrderPlaced", TimeUnit.MILLISECONDS.toNanos(5), true);
    exporter.recordHandlerInvocation("OrderPlaced", TimeUnit.MILLISECONDS.toNanos(7), true);
    exporter.recordHandlerInvocation("OrderPlaced", TimeUnit.MILLISECONDS.toNanos(1), false);

    Timer success = registry.get("eventsource.handler.duration")
        .tag("event_type", "OrderPlaced").tag("outcome", "success").timer();
    assertEquals(2, success.count());
    assertEquals(12.0, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
    assertEquals(1, registry.get("eventsource.handler.duration")
        .tag("outcome", "failure").timer().count());
  }

  @Test
  void retriesAndRejectionsAreTagged() {
    exporter.incrementRetryAttempt("OrderPlaced");
    exporter.incrementRetryAttempt("OrderPlaced");
    exporter.incrementCircuitRejected("OrderPlaced:projector");

    assertEquals(2.0, registry.get("eventsource.handler.retries").tag("event_type", "OrderPlaced").counter().count());
    assertEquals(1.0, registry.get("eventsource.circuit.rejected").tag("key", "OrderPlaced:projector").counter().count());
  }

  @Test
  void circuitStateGaugeFollowsTransitions() {
    exporter.recordCircuitState("k", "OPEN");
    assertEquals(1.0, circuitGauge("k").value());

    exporter.recordCircuitState("k", "HALF_OPEN");
    assertEquals(2.0, circuitGauge("k").value());

    exporter.recordCircuitState("k", "CLOSED");
    assertEquals(0.0, circuitGauge("k").value());
    assertEquals(1, registry.find("eventsource.circuit.state").gauges().size());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "orders.es");
    custom.incrementEventsAppended();

    assertEquals(1.0, counter("orders.es.store.appended").count());
    assertEquals(0.0, counter("eventsource.store.appended").count());
  }

  @Test
  void invalidPrefixes() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "es."));
  }

  @Test
  void closeRemovesEveryMeterAndIgnoresLaterCalls() {
    exporter.recordHandlerInvocation("A", 1, true);
    exporter.recordCircuitState("k", "OPEN");
    assertFalse(exporter.registeredMeters().isEmpty());

    exporter.close();

    assertTrue(registry.getMeters().isEmpty());
    exporter.incrementEventsAppended();
    exporter.recordCircuitState("k", "OPEN");
    assertTrue(registry.getMeters().isEmpty());
  }

  @Test
  void wiredThroughEventSourcing() {
    EventSourcing es = EventSourcing.builder()
        .eventStore(new InMemoryEventStore())
        .metricsExporter(exporter)
        .middleware(MetricsMiddleware.builder().metricsExporter(exporter).build())
        .build();
    es.eventBus().subscribe(DomainEvent.class, event -> { });

    es.publisher().publish(DomainEvent.builder("Ping").aggregateId("p-1").version(1).build());

    assertEquals(1.0, counter("eventsource.publish.published").count());
    assertEquals(1, registry.get("eventsource.handler.duration").tag("event_type", "Ping").timer().count());

    es.close();
    assertTrue(registry.getMeters().isEmpty());
  }

  private Counter counter(String name) {
    return registry.get(name).counter();
  }

  private Gauge circuitGauge(String key) {
    return registry.get("eventsource.circuit.state").tag("key", key).gauge();
  }
}
