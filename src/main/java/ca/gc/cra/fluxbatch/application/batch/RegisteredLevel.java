package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.application.port.LevelHandler;
import ca.gc.cra.fluxbatch.domain.level.ArtifactKind;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.Objects;

/**
 * Registry entry binding a level to its handler.
 *
 * @param id level identifier
 * @param handler processing step invoked per manifest
 * @since 0.1.0
 */
public record RegisteredLevel(LevelId id, LevelHandler handler) {

  public RegisteredLevel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(handler, "handler");
  }

  /**
   * Returns the artifact kind the level reads; informational only.
   *
   * @return expected predecessor artifact
   */
  public ArtifactKind predecessor() {
    return id.predecessor();
  }
}
