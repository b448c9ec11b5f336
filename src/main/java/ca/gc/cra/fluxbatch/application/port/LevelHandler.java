package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;

/**
 * <strong>What:</strong> Port for the processing step behind one level.
 * <p><strong>Why:</strong> Keeps the orchestrator independent of the scientific algorithms and data formats each level
 * uses.</p>
 * <p><strong>Role:</strong> Registered per level in the {@code LevelRegistry}; invoked by the sequential runner once
 * per manifest.</p>
 * <p><strong>Thread-safety:</strong> May be invoked concurrently from several site workers; implementations must not
 * share mutable state across calls.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LevelHandler {
  /**
   * Processes one manifest.
   *
   * @param manifest manifest with batch options already injected
   * @param context level, session mode, and site of the call
   * @return outcome whose status code is zero on success
   * @throws Exception on any processing failure; the runner records the unit as failed and continues
   */
  LevelOutcome handle(Manifest manifest, LevelContext context) throws Exception;
}
