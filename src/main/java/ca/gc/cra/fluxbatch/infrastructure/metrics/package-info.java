/**
 * Metrics adapter bridging {@link ca.gc.cra.fluxbatch.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code batch.unit.*}, {@code batch.site.*} and
 * {@code batch.level.*} namespaces.</p>
 */
package ca.gc.cra.fluxbatch.infrastructure.metrics;
