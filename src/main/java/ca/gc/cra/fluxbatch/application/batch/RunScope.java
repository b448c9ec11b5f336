package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call settings for one {@link SequentialLevelRunner#run} invocation.
 *
 * @param mode session mode forwarded to handlers
 * @param site site name when called from the site dispatcher
 * @param token cancellation token polled before each manifest
 * @since 0.1.0
 */
public record RunScope(SessionMode mode, Optional<String> site, CancellationToken token) {

  public RunScope {
    Objects.requireNonNull(mode, "mode");
    site = Objects.requireNonNullElse(site, Optional.empty());
    Objects.requireNonNull(token, "token");
  }

  /**
   * Scope for a levels-mode run.
   *
   * @param mode session mode
   * @param token session token
   * @return scope without a site
   */
  public static RunScope levels(SessionMode mode, CancellationToken token) {
    return new RunScope(mode, Optional.empty(), token);
  }

  /**
   * Scope for a site pipeline that has already started.
   *
   * @param mode session mode
   * @param site site name
   * @return scope with a non-cancellable token
   */
  public static RunScope site(SessionMode mode, String site) {
    return new RunScope(mode, Optional.of(site), CancellationToken.none());
  }
}
