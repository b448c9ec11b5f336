package ca.gc.cra.fluxbatch.config;

import ca.gc.cra.fluxbatch.application.batch.ParallelSiteDispatcher;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each run mode.
 *
 * <p>The defaults are the single source of truth for optional keys; {@code handler.<level>} entries have no default
 * and must come from YAML or the command line.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested mode merged with common defaults.
   *
   * @param mode run mode ({@code levels} or {@code sites})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "levels" -> { }
      case "sites" -> defaults.put("poolSize", Integer.toString(ParallelSiteDispatcher.DEFAULT_POOL_SIZE));
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("control", "");
    map.put("sessionMode", "batch");
    map.put("fingerprintCommand", "");
    map.put("plotCommand", "");
    map.put("commandLogDir", "");
    map.put("workDir", "");
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }
}
