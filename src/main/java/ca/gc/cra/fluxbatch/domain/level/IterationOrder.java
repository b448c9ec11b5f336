package ca.gc.cra.fluxbatch.domain.level;

/**
 * Order in which a level walks the manifests listed in its control file set.
 *
 * @since 0.1.0
 */
public enum IterationOrder {
  /** Ordinal keys sorted as integers ({@code "1", "2", "10"}); used where outputs chain across files. */
  NUMERIC_ASCENDING,
  /** Keys visited in the order the operator declared them. */
  DECLARATION
}
