/**
 * <strong>Purpose:</strong> Level identifiers and the per-level policies the orchestrator consults.
 * <p><strong>Pipeline role:</strong> Domain layer; the registry and runners key every decision off
 * {@link ca.gc.cra.fluxbatch.domain.level.LevelId}.
 * <p><strong>Concurrency:</strong> Enum-only package; all values are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fluxbatch.domain.level;
