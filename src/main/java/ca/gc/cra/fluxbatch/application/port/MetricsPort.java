package ca.gc.cra.fluxbatch.application.port;

/**
 * <strong>What:</strong> Port abstracting batch metrics emission.
 * <p><strong>Why:</strong> Lets the runner and dispatcher count unit outcomes and time manifests without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * {@code metricsExporter=none}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from site worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code batch.unit.failed},
 * {@code batch.site.completed}, {@code batch.unit.latencyMillis}, ...).</p>
 *
 * @implNote Callers never pass {@code null} keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name such as {@code batch.unit.succeeded}
   */
  void increment(String key);

  /**
   * Records one observation for a histogram metric.
   *
   * @param key dotted metric name such as {@code batch.unit.latencyMillis}
   * @param value observed value; unit is implied by the name
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
