package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;

/**
 * <strong>What:</strong> Port for the post-success visualization steps some levels trigger.
 * <p><strong>Role:</strong> Called by the sequential runner inside the same error boundary as the handler, so a
 * failing plot marks that manifest as failed and nothing more.</p>
 *
 * @since 0.1.0
 */
public interface VisualizationPort {
  /**
   * Produces fingerprint plots for the dataset a manifest wrote.
   *
   * @param manifest manifest that just succeeded
   * @throws Exception on failure
   */
  void fingerprint(Manifest manifest) throws Exception;

  /**
   * Produces the plots listed in the manifest's {@code Plots} section.
   *
   * @param manifest manifest that just succeeded
   * @param outcome handler outcome
   * @throws Exception on failure
   */
  void manifestPlots(Manifest manifest, LevelOutcome outcome) throws Exception;

  /** Port that skips every visualization step. */
  VisualizationPort NONE = new VisualizationPort() {
    @Override public void fingerprint(Manifest manifest) {}

    @Override public void manifestPlots(Manifest manifest, LevelOutcome outcome) {}
  };
}
