package ca.gc.cra.fluxbatch.api;

import ca.gc.cra.fluxbatch.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a mutable, insertion-ordered map.
 * <p>Keys may contain dots so nested settings such as {@code handler.l1=...} can be given on the command line.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}.
   *
   * @param args arguments left after flag extraction; {@code null} yields an empty map
   * @return mutable map of trimmed keys to trimmed values
   * @throws IllegalArgumentException if an argument is not {@code key=value} or contains control characters
   */
  static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int split = arg.indexOf('=');
      if (split <= 0 || split == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, split).trim();
      String value = arg.substring(split + 1).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (hasControlCharacter(value)) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
      map.put(key, Strings.requireNonBlank(key, value));
    }
    return map;
  }

  private static boolean hasControlCharacter(String value) {
    return value.chars().anyMatch(Character::isISOControl);
  }
}
