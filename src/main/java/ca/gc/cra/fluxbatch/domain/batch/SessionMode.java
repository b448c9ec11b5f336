package ca.gc.cra.fluxbatch.domain.batch;

import java.util.Locale;

/**
 * How the batch session was launched.
 *
 * @since 0.1.0
 */
public enum SessionMode {
  /** Started by an operator who may stop the run between manifests. */
  INTERACTIVE,
  /** Started unattended (command line, scheduler). */
  BATCH;

  /**
   * Parses a mode token case-insensitively.
   *
   * @param raw {@code "interactive"} or {@code "batch"}
   * @return parsed mode
   * @throws IllegalArgumentException if the token is blank or names no mode
   */
  public static SessionMode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("session mode must not be blank");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "interactive" -> INTERACTIVE;
      case "batch" -> BATCH;
      default -> throw new IllegalArgumentException(
          "Unrecognised session mode '" + raw + "' (expected interactive or batch)");
    };
  }
}
