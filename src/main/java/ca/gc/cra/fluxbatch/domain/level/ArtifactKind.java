package ca.gc.cra.fluxbatch.domain.level;

/**
 * Kind of artifact a level expects its predecessor to have produced.
 *
 * <p>Purely descriptive: the orchestrator does not infer level order from these values, it only
 * reports them in plans and diagnostics.</p>
 *
 * @since 0.1.0
 */
public enum ArtifactKind {
  /** Raw logger output (spreadsheets, CSV, TOA5) read by L1. */
  RAW_DATA("raw data"),
  /** L1 dataset. */
  L1_DATASET("L1 dataset"),
  /** L2 dataset. */
  L2_DATASET("L2 dataset"),
  /** L3 dataset. */
  L3_DATASET("L3 dataset"),
  /** L4 dataset. */
  L4_DATASET("L4 dataset"),
  /** L5 dataset. */
  L5_DATASET("L5 dataset"),
  /** Any processed dataset named by the manifest. */
  ANY_DATASET("any dataset");

  private final String description;

  ArtifactKind(String description) {
    this.description = description;
  }

  /**
   * Returns a short human-readable description used in dry-run plans.
   *
   * @return description text
   */
  public String description() {
    return description;
  }
}
