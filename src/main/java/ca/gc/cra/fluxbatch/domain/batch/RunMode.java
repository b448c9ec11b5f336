package ca.gc.cra.fluxbatch.domain.batch;

/**
 * Shape of a batch run.
 *
 * @since 0.1.0
 */
public enum RunMode {
  /** One pass over the declared level sequence. */
  LEVELS,
  /** Per-site fan-out on the worker pool. */
  SITES
}
