package ca.gc.cra.fluxbatch.config;

import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final String HANDLER_PREFIX = "handler.";

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active run mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    String sessionMode = effective.get("sessionMode");
    if (sessionMode != null && !sessionMode.isBlank()) {
      SessionMode.parse(sessionMode);
    }
    for (String key : effective.keySet()) {
      if (key.startsWith(HANDLER_PREFIX)) {
        String token = key.substring(HANDLER_PREFIX.length());
        if (LevelId.fromToken(token).isEmpty()) {
          throw new IllegalArgumentException("Unknown level in handler setting: " + key);
        }
      }
    }
  }
}
