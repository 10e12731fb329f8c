package eventsource.micrometer;

import eventsource.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, timers and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code eventsource.handler.duration} (tags {@code event_type}, {@code outcome}): handler invocations</li>
 * </ul>
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventsource.handler.retries} (tag {@code event_type}): retry attempts scheduled</li>
 *   <li>{@code eventsource.circuit.rejected} (tag {@code key}): calls rejected by an open breaker</li>
 *   <li>{@code eventsource.store.appended}: events appended</li>
 *   <li>{@code eventsource.store.conflicts}: appends rejected with a version conflict</li>
 *   <li>{@code eventsource.publish.published}: events persisted and dispatched by the publisher</li>
 *   <li>{@code eventsource.publish.rejected}: events the publisher could not persist</li>
 *   <li>{@code eventsource.snapshot.saved}: snapshots written</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventsource.circuit.state} (tag {@code key}): 0 closed, 1 open, 2 half-open</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter eventsAppended;
  private final Counter concurrencyConflicts;
  private final Counter eventsPublished;
  private final Counter publishRejected;
  private final Counter snapshotsSaved;

  private final ConcurrentHashMap<String, AtomicInteger> circuitStates = new ConcurrentHashMap<>();
  private final Set<Meter> meters = ConcurrentHashMap.newKeySet();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventsource"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventsource");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.es"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.eventsAppended = track(Counter.builder(namePrefix + ".store.appended")
        .description("Events appended to the event store")
        .register(registry));
    this.concurrencyConflicts = track(Counter.builder(namePrefix + ".store.conflicts")
        .description("Appends rejected with a version conflict")
        .register(registry));
    this.eventsPublished = track(Counter.builder(namePrefix + ".publish.published")
        .description("Events persisted and dispatched by the publisher")
        .register(registry));
    this.publishRejected = track(Counter.builder(namePrefix + ".publish.rejected")
        .description("Events the publisher could not persist")
        .register(registry));
    this.snapshotsSaved = track(Counter.builder(namePrefix + ".snapshot.saved")
        .description("Aggregate snapshots written")
        .register(registry));
  }

  private <M extends Meter> M track(M meter) {
    meters.add(meter);
    return meter;
  }

  @Override
  public void recordHandlerInvocation(String eventType, long durationNanos, boolean success) {
    if (closed) return;
    track(Timer.builder(namePrefix + ".handler.duration")
        .description("Event handler invocations")
        .tag("event_type", String.valueOf(eventType))
        .tag("outcome", success ? "success" : "failure")
        .register(registry))
        .record(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void incrementRetryAttempt(String eventType) {
    if (closed) return;
    track(Counter.builder(namePrefix + ".handler.retries")
        .description("Retry attempts scheduled after a retryable failure")
        .tag("event_type", String.valueOf(eventType))
        .register(registry))
        .increment();
  }

  @Override
  public void incrementCircuitRejected(String key) {
    if (closed) return;
    track(Counter.builder(namePrefix + ".circuit.rejected")
        .description("Invocations rejected by an open circuit breaker")
        .tag("key", String.valueOf(key))
        .register(registry))
        .increment();
  }

  @Override
  public void recordCircuitState(String key, String state) {
    if (closed) return;
    String tag = String.valueOf(key);
    AtomicInteger value = circuitStates.computeIfAbsent(tag, k -> {
      AtomicInteger holder = new AtomicInteger();
      track(Gauge.builder(namePrefix + ".circuit.state", holder, AtomicInteger::get)
          .description("Circuit breaker state: 0 closed, 1 open, 2 half-open")
          .tag("key", k)
          .register(registry));
      return holder;
    });
    value.set(stateCode(state));
  }

  static int stateCode(String state) {
    if ("OPEN".equals(state)) {
      return 1;
    }
    if ("HALF_OPEN".equals(state)) {
      return 2;
    }
    return 0;
  }

  @Override
  public void incrementEventsAppended() {
    if (closed) return;
    eventsAppended.increment();
  }

  @Override
  public void incrementConcurrencyConflict() {
    if (closed) return;
    concurrencyConflicts.increment();
  }

  @Override
  public void incrementEventsPublished() {
    if (closed) return;
    eventsPublished.increment();
  }

  @Override
  public void incrementPublishRejected() {
    if (closed) return;
    publishRejected.increment();
  }

  @Override
  public void incrementSnapshotsSaved() {
    if (closed) return;
    snapshotsSaved.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link eventsource.EventSourcing#close()} when this exporter is configured,
   * so stale gauges do not outlive the event sourcing instance.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : new ArrayList<>(meters)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    meters.clear();
    circuitStates.clear();
    if (first != null) throw first;
  }

  List<Meter> registeredMeters() {
    return List.copyOf(meters);
  }
}
