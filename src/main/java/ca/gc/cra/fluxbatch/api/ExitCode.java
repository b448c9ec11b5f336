package ca.gc.cra.fluxbatch.api;

/**
 * <strong>What:</strong> Process exit codes returned by the fluxbatch commands.
 * <p><strong>Why:</strong> Schedulers wrapping a batch run need to tell a bad invocation apart from a run that
 * started. Per-manifest failures never change the exit code; they are logged and tallied instead.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The batch ran to completion or was stopped cleanly. */
  SUCCESS(0),
  /** Arguments could not be parsed. */
  INVALID_ARGS(2),
  /** The configuration or batch control file could not be read. */
  IO_ERROR(3),
  /** The configuration or batch control file was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected failure outside any single manifest. */
  RUNTIME_FAILURE(5),
  /** The command thread was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
