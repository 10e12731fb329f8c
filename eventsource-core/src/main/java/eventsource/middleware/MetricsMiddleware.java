package eventsource.middleware;

import eventsource.handler.HandlerResult;
import eventsource.spi.MetricsExporter;
import eventsource.spi.StructuredLogger;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;

/**
 * Records duration and outcome of every invocation per event type.
 *
 * <p>Calls {@code next} exactly once and returns its result unchanged. Each invocation is
 * forwarded to the {@link MetricsExporter}; aggregated counters are additionally written
 * to the structured log once per report interval, checked on the invocation path.
 */
public final class MetricsMiddleware implements EventMiddleware {
  private static final String LOGGER_NAME = MetricsMiddleware.class.getName();

  private final Duration reportInterval;
  private final Clock clock;
  private final StructuredLogger log;
  private final MetricsExporter exporter;
  private final ConcurrentHashMap<String, EventMetrics> metrics = new ConcurrentHashMap<>();
  private final AtomicLong lastReportMillis;

  private MetricsMiddleware(Builder builder) {
    this.reportInterval = builder.reportInterval;
    this.clock = builder.clock;
    this.log = builder.log;
    this.exporter = builder.exporter;
    this.lastReportMillis = new AtomicLong(clock.millis());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public HandlerResult process(HandlerContext context, Next next) {
    String eventType = context.event().eventType();
    long start = System.nanoTime();
    HandlerResult result = null;
    try {
      result = next.proceed(context);
      return result;
    } finally {
      long duration = System.nanoTime() - start;
      boolean success = result != null && result.isSuccess();
      metrics.computeIfAbsent(eventType, k -> new EventMetrics()).record(duration, success);
      exporter.recordHandlerInvocation(eventType, duration, success);
      maybeReport();
    }
  }

  private void maybeReport() {
    long now = clock.millis();
    long last = lastReportMillis.get();
    if (now - last >= reportInterval.toMillis() && lastReportMillis.compareAndSet(last, now)) {
      flush();
    }
  }

  /**
   * Writes one structured record per event type with the current counters.
   */
  public void flush() {
    for (Map.Entry<String, EventMetrics.Snapshot> entry : snapshot().entrySet()) {
      EventMetrics.Snapshot s = entry.getValue();
      Map<String, Object> fields = new LinkedHashMap<>();
      fields.put("eventType", entry.getKey());
      fields.put("count", s.count());
      fields.put("successCount", s.successCount());
      fields.put("failureCount", s.failureCount());
      fields.put("successRate", String.format("%.3f", s.successRate()));
      fields.put("avgMs", String.format("%.3f", s.averageMs()));
      fields.put("minMs", s.minNanos() / 1_000_000.0);
      fields.put("maxMs", s.maxNanos() / 1_000_000.0);
      log.log(Level.INFO, "Event handler metrics", LOGGER_NAME, fields);
    }
  }

  /**
   * Returns a sorted copy of the counters for every event type seen so far.
   */
  public Map<String, EventMetrics.Snapshot> snapshot() {
    Map<String, EventMetrics.Snapshot> copy = new TreeMap<>();
    metrics.forEach((type, m) -> copy.put(type, m.snapshot()));
    return Collections.unmodifiableMap(copy);
  }

  public static final class Builder {
    private Duration reportInterval = Duration.ofSeconds(60);
    private Clock clock = Clock.systemUTC();
    private StructuredLogger log = StructuredLogger.jul();
    private MetricsExporter exporter = MetricsExporter.NOOP;

    private Builder() {
    }

    /**
     * <p>Optional. Defaults to 60 seconds.
     */
    public Builder reportInterval(Duration reportInterval) {
      Objects.requireNonNull(reportInterval, "reportInterval");
      if (reportInterval.isZero() || reportInterval.isNegative()) {
        throw new IllegalArgumentException("reportInterval must be positive");
      }
      this.reportInterval = reportInterval;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder structuredLogger(StructuredLogger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metricsExporter(MetricsExporter exporter) {
      this.exporter = Objects.requireNonNull(exporter, "exporter");
      return this;
    }

    public MetricsMiddleware build() {
      return new MetricsMiddleware(this);
    }
  }
}
