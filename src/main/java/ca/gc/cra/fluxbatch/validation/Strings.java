package ca.gc.cra.fluxbatch.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from the command line and control files.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Validate site names before they reach MDC and log files.</li>
 *   <li>Check printable ASCII for telemetry resource attributes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern SITE_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9 ._()-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a site name declared under {@code Sites}.
   *
   * @param site candidate site name
   * @return trimmed site name
   * @throws IllegalArgumentException if the name is blank or uses characters outside letters, digits, space,
   *         dot, underscore, hyphen, and parentheses
   */
  public static String requireSiteName(String site) {
    String sanitized = requireNonBlank("site", site);
    if (!SITE_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message("site", "'" + sanitized + "' contains unsupported characters"));
    }
    return sanitized;
  }

  /**
   * Ensures a value contains only printable ASCII characters and fits within a length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string
   * @param maxLength maximum permitted length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
