/**
 * <strong>Purpose:</strong> Ports the batch orchestrator depends on: level handlers, manifest loading, compliance,
 * visualization, result sinks, metrics, and time.
 * <p><strong>Pipeline role:</strong> Application layer boundary; adapters live under
 * {@code ca.gc.cra.fluxbatch.infrastructure}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fluxbatch.application.port;
