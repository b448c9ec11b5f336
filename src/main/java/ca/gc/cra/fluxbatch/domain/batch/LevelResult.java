package ca.gc.cra.fluxbatch.domain.batch;

import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing one manifest for one level.
 *
 * <p>Results are pushed to a {@code LevelResultSink}; the runner never returns them to its caller.</p>
 *
 * @param level level that was running
 * @param site site being processed, when running under the site dispatcher
 * @param manifest manifest file name
 * @param status processing status
 * @param message human-readable detail; empty for plain successes
 * @param elapsedMillis wall-clock time spent on the manifest
 * @since 0.1.0
 */
public record LevelResult(
    LevelId level,
    Optional<String> site,
    String manifest,
    Status status,
    String message,
    long elapsedMillis) {

  /** Per-manifest status. */
  public enum Status {
    SUCCEEDED,
    FAILED,
    SKIPPED_MISSING,
    SKIPPED_INVALID
  }

  public LevelResult {
    Objects.requireNonNull(level, "level");
    site = Objects.requireNonNullElse(site, Optional.empty());
    Objects.requireNonNull(manifest, "manifest");
    Objects.requireNonNull(status, "status");
    message = message == null ? "" : message;
    if (elapsedMillis < 0) {
      elapsedMillis = 0;
    }
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }

  public boolean isSkipped() {
    return status == Status.SKIPPED_MISSING || status == Status.SKIPPED_INVALID;
  }
}
