package ca.gc.cra.fluxbatch.domain.batch;

/**
 * Lifecycle of a batch session.
 *
 * <p>{@code IDLE -> RUNNING -> (STOP_REQUESTED -> STOPPED | COMPLETED)}. A stop may also be requested before the run
 * starts, in which case the run ends {@code STOPPED} without processing anything.</p>
 *
 * @since 0.1.0
 */
public enum SessionState {
  IDLE,
  RUNNING,
  STOP_REQUESTED,
  STOPPED,
  COMPLETED;

  public boolean isTerminal() {
    return this == STOPPED || this == COMPLETED;
  }
}
