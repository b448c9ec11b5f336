package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;

/**
 * <strong>What:</strong> Port that brings a manifest up to the structure a level expects.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Fill defaults for missing optional keys.</li>
 *   <li>Report manifests that cannot be used, logging the reason itself.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface ComplianceUpdater {
  /**
   * Normalizes the manifest in place.
   *
   * @param level level about to run
   * @param manifest manifest to update
   * @return {@code false} when the manifest is unusable for {@code level}
   */
  boolean update(LevelId level, Manifest manifest);

  /** Updater that accepts every manifest unchanged. */
  ComplianceUpdater ACCEPT_ALL = (level, manifest) -> true;
}
