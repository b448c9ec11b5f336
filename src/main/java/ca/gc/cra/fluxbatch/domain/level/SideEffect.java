package ca.gc.cra.fluxbatch.domain.level;

/**
 * Best-effort step a level runs after its handler succeeded.
 *
 * @since 0.1.0
 */
public enum SideEffect {
  /** Nothing runs after the handler. */
  NONE,
  /** Fingerprint plots of the level's output file. */
  FINGERPRINT,
  /** Plots listed in the manifest's {@code Plots} section. */
  MANIFEST_PLOTS
}
