package ca.gc.cra.fluxbatch.infrastructure.metrics;

import ca.gc.cra.fluxbatch.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards batch counters and latency histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily on first use and cached per key. Closing the adapter flushes and shuts down the
 * meter provider so the last unit outcomes are exported before the JVM exits.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("fluxbatch.metric.key");
  private static final String FALLBACK_NAME = "fluxbatch.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by system properties or {@code OTEL_*} variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String name = Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(name, this::createCounter).add(1, Attributes.of(METRIC_KEY, name));
  }

  @Override
  public void observe(String key, long value) {
    String name = Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(name, this::createHistogram).record(value, Attributes.of(METRIC_KEY, name));
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter createCounter(String key) {
    return meter.counterBuilder(sanitize(key))
        .setUnit("1")
        .setDescription("Batch counter for " + key)
        .build();
  }

  private LongHistogram createHistogram(String key) {
    return meter.histogramBuilder(sanitize(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("Batch observation for " + key)
        .build();
  }

  static String sanitize(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }
}
