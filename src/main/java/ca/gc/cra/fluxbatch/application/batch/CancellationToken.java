package ca.gc.cra.fluxbatch.application.batch;

/**
 * Cooperative stop flag shared between a batch session and the code it drives.
 *
 * <p>Writers call {@link #requestStop()} from any thread; the sequential runner reads the flag once per manifest
 * boundary. A token never resets.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(false);

  private final boolean cancellable;
  private volatile boolean stopRequested;

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Creates a fresh, unset token.
   *
   * @return new token
   */
  public static CancellationToken create() {
    return new CancellationToken(true);
  }

  /**
   * Returns a token that ignores stop requests; used for site pipelines once they have started.
   *
   * @return shared non-cancellable token
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * Sets the stop flag. Idempotent; ignored by {@link #none()}.
   *
   * @return {@code true} if this call changed the flag
   */
  public boolean requestStop() {
    if (!cancellable || stopRequested) {
      return false;
    }
    stopRequested = true;
    return true;
  }

  public boolean isStopRequested() {
    return stopRequested;
  }

  public boolean isCancellable() {
    return cancellable;
  }

  @Override
  public String toString() {
    if (!cancellable) {
      return "CancellationToken[none]";
    }
    return "CancellationToken[stopRequested=" + stopRequested + "]";
  }
}
