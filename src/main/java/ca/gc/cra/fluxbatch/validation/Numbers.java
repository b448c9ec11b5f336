package ca.gc.cra.fluxbatch.validation;

/**
 * Numeric validation helpers used by configuration parsing.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer setting and checks its range.
   *
   * @param name setting name for diagnostics
   * @param raw text to parse; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies outside the range
   */
  public static int parseIntInRange(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return (int) requireRange(name, defaultValue, min, max);
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
