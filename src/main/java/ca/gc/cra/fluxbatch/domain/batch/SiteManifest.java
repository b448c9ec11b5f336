package ca.gc.cra.fluxbatch.domain.batch;

import ca.gc.cra.fluxbatch.domain.level.IterationOrder;
import java.util.List;
import java.util.Objects;

/**
 * Per-site list of manifests; each manifest declares its own level.
 *
 * <p>Entries always run in ascending ordinal order, whatever level each one declares.</p>
 *
 * @param site site name as declared in the batch control file
 * @param controlFiles ordinal key to manifest path
 * @since 0.1.0
 */
public record SiteManifest(String site, ControlFileSet controlFiles) {

  public SiteManifest {
    Objects.requireNonNull(site, "site");
    Objects.requireNonNull(controlFiles, "controlFiles");
    if (site.isBlank()) {
      throw new IllegalArgumentException("site must not be blank");
    }
  }

  /**
   * Returns the site's entries sorted numerically by ordinal key.
   *
   * @return ordered entries
   */
  public List<ControlFileEntry> inOrder() {
    return controlFiles.inOrder(IterationOrder.NUMERIC_ASCENDING);
  }
}
