package ca.gc.cra.fluxbatch.api;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers shared by the batch commands for reading CLI-only settings out of the argument map.
 */
final class ConfigCliUtils {
  private static final String[] CONFIG_KEYS = {"config", "--config"};

  private ConfigCliUtils() {}

  /**
   * Removes the YAML configuration path from the arguments so it is not merged as a setting.
   *
   * @param args mutable argument map
   * @return configured path, if any
   */
  static Optional<String> extractConfigPath(Map<String, String> args) {
    Optional<String> found = Optional.empty();
    for (String key : CONFIG_KEYS) {
      String value = args.remove(key);
      if (found.isEmpty() && value != null && !value.isBlank()) {
        found = Optional.of(value.trim());
      }
    }
    return found;
  }

  /**
   * Reads a boolean setting; accepts {@code true/false}, {@code yes/no}, and {@code 1/0}.
   *
   * @param map effective settings
   * @param key setting name
   * @return parsed value, {@code false} when absent
   * @throws IllegalArgumentException if the value is not a recognised boolean
   */
  static boolean parseBoolean(Map<String, String> map, String key) {
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
