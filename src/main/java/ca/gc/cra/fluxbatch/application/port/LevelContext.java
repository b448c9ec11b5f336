package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.Objects;
import java.util.Optional;

/**
 * Call context handed to a {@link LevelHandler}.
 *
 * @param level level being run
 * @param mode session mode of the enclosing batch
 * @param site site name when running under the site dispatcher
 * @since 0.1.0
 */
public record LevelContext(LevelId level, SessionMode mode, Optional<String> site) {

  public LevelContext {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(mode, "mode");
    site = Objects.requireNonNullElse(site, Optional.empty());
  }
}
