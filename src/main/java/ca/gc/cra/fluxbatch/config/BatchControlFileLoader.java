package ca.gc.cra.fluxbatch.config;

import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Parses the batch control file into a {@link BatchPlan}.
 * <p><strong>Format:</strong>
 * <pre>
 * Options:
 *   levels: l1, l2, concatenate
 * Levels:
 *   l1:
 *     1: site_a/L1.yml
 *     2: site_b/L1.yml
 * Sites:
 *   SiteA:
 *     1: site_a/L1.yml
 *     2: site_a/L2.yml
 * </pre>
 * <p>{@code Options.levels} may also be a YAML list. Relative manifest paths resolve against the control file's
 * directory. Levels mode requires {@code Options.levels}; sites mode requires {@code Sites}.</p>
 * <p><strong>Errors:</strong> Structural problems (missing sections, non-integer ordinal keys, bad paths) raise
 * {@link IllegalArgumentException} before any level runs.</p>
 *
 * @since 0.1.0
 */
public final class BatchControlFileLoader {
  private static final Logger log = LoggerFactory.getLogger(BatchControlFileLoader.class);

  static final String OPTIONS = "Options";
  static final String LEVELS_KEY = "levels";
  static final String LEVELS = "Levels";
  static final String SITES = "Sites";

  /**
   * Reads and validates a batch control file.
   *
   * @param control batch control file
   * @param mode run mode deciding which sections are required
   * @return parsed plan
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the document is malformed or misses a required section
   */
  public BatchPlan load(Path control, RunMode mode) throws IOException {
    Objects.requireNonNull(control, "control");
    Objects.requireNonNull(mode, "mode");
    Object document;
    try (Reader reader = Files.newBufferedReader(control, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse batch control file " + control, ex);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Batch control file " + control + " must contain a mapping");
    }
    Path base = control.toAbsolutePath().getParent();

    List<String> levelTokens = List.of();
    if (mode == RunMode.LEVELS) {
      Map<?, ?> options = section(root, OPTIONS)
          .orElseThrow(() -> new IllegalArgumentException("No Options section in " + control));
      levelTokens = parseLevelTokens(options.get(LEVELS_KEY), control);
    }

    Map<String, ControlFileSet> levels = new LinkedHashMap<>();
    Map<?, ?> levelSection = section(root, LEVELS).orElse(Map.of());
    for (Map.Entry<?, ?> entry : levelSection.entrySet()) {
      String level = String.valueOf(entry.getKey()).trim();
      levels.put(level, controlFileSet(entry.getValue(), base, LEVELS + "." + level));
    }

    List<SiteManifest> sites = new ArrayList<>();
    Map<?, ?> siteSection = section(root, SITES).orElse(null);
    if (siteSection == null && mode == RunMode.SITES) {
      throw new IllegalArgumentException("No Sites section in " + control);
    }
    if (siteSection != null) {
      for (Map.Entry<?, ?> entry : siteSection.entrySet()) {
        String site = Strings.requireSiteName(String.valueOf(entry.getKey()));
        sites.add(new SiteManifest(site, controlFileSet(entry.getValue(), base, SITES + "." + site)));
      }
    }

    BatchPlan plan = new BatchPlan(levelTokens, levels, sites);
    log.debug("Loaded batch control file {}: {}", control, plan);
    return plan;
  }

  static List<String> parseLevelTokens(Object raw, Path control) {
    if (raw == null || raw.toString().isBlank()) {
      throw new IllegalArgumentException("No levels entry in the Options section of " + control);
    }
    List<String> tokens = new ArrayList<>();
    if (raw instanceof List<?> list) {
      for (Object item : list) {
        addToken(tokens, item == null ? "" : item.toString());
      }
    } else {
      for (String part : raw.toString().split(",")) {
        addToken(tokens, part);
      }
    }
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("No levels entry in the Options section of " + control);
    }
    return tokens;
  }

  private static void addToken(List<String> tokens, String candidate) {
    String trimmed = candidate.trim();
    if (!trimmed.isEmpty()) {
      tokens.add(trimmed);
    }
  }

  private static ControlFileSet controlFileSet(Object node, Path base, String context) {
    if (node == null) {
      return ControlFileSet.empty();
    }
    if (!(node instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException(context + " must map ordinal keys to control files");
    }
    Map<String, Path> declared = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value == null || value.toString().isBlank()) {
        throw new IllegalArgumentException(context + "." + key + " names no control file");
      }
      declared.put(key, resolve(base, value.toString().trim(), context + "." + key));
    }
    try {
      return ControlFileSet.of(declared);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
  }

  private static Path resolve(Path base, String raw, String context) {
    try {
      Path path = Path.of(raw);
      if (path.isAbsolute() || base == null) {
        return path;
      }
      return base.resolve(path).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(context + " is not a valid path: " + raw, ex);
    }
  }

  private static Optional<Map<?, ?>> section(Map<?, ?> root, String name) {
    Object node = root.get(name);
    if (node == null) {
      return Optional.empty();
    }
    if (!(node instanceof Map<?, ?> map)) {
      throw new IllegalArgumentException(name + " must be a section");
    }
    return Optional.of(map);
  }
}
