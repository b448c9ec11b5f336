package ca.gc.cra.fluxbatch.domain.batch;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Status returned by a level handler.
 *
 * @param statusCode zero on success; any other value marks the unit as failed
 * @param artifact file produced by the handler, when known
 * @since 0.1.0
 */
public record LevelOutcome(int statusCode, Optional<Path> artifact) {

  public LevelOutcome {
    artifact = Objects.requireNonNullElse(artifact, Optional.empty());
  }

  public static LevelOutcome success() {
    return new LevelOutcome(0, Optional.empty());
  }

  public static LevelOutcome success(Path artifact) {
    return new LevelOutcome(0, Optional.ofNullable(artifact));
  }

  public static LevelOutcome failed(int statusCode) {
    if (statusCode == 0) {
      throw new IllegalArgumentException("failed outcome requires a non-zero status code");
    }
    return new LevelOutcome(statusCode, Optional.empty());
  }

  public boolean isSuccess() {
    return statusCode == 0;
  }
}
