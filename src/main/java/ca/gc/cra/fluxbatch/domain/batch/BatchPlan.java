package ca.gc.cra.fluxbatch.domain.batch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Parsed batch control file.
 * <p><strong>Role:</strong> Input of a {@code BatchSession}: the level tokens in the operator's order, the control
 * file sets declared per level, and the per-site manifest lists.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class BatchPlan {
  private final List<String> levelTokens;
  private final Map<String, ControlFileSet> levels;
  private final List<SiteManifest> sites;

  /**
   * Creates a plan.
   *
   * @param levelTokens declared level tokens, kept verbatim (unknown tokens are reported at run time)
   * @param levels control file sets keyed by the level name used in the control file
   * @param sites per-site manifest lists in declaration order
   */
  public BatchPlan(List<String> levelTokens, Map<String, ControlFileSet> levels, List<SiteManifest> sites) {
    this.levelTokens = List.copyOf(Objects.requireNonNull(levelTokens, "levelTokens"));
    this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(levels, "levels")));
    this.sites = List.copyOf(Objects.requireNonNull(sites, "sites"));
  }

  public List<String> levelTokens() {
    return levelTokens;
  }

  public Map<String, ControlFileSet> levels() {
    return levels;
  }

  public List<SiteManifest> sites() {
    return sites;
  }

  /**
   * Finds the control files declared for a level token.
   *
   * <p>An exact (trimmed) match wins; otherwise the first case-insensitive match is used so {@code "L4"} in
   * {@code Options.levels} finds a {@code Levels.l4} section.</p>
   *
   * @param token level token as declared in {@code Options.levels}
   * @return matching set, or empty when the control file has no section for the level
   */
  public Optional<ControlFileSet> controlFilesFor(String token) {
    if (token == null) {
      return Optional.empty();
    }
    String trimmed = token.trim();
    ControlFileSet exact = levels.get(trimmed);
    if (exact != null) {
      return Optional.of(exact);
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, ControlFileSet> entry : levels.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(lower)) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "BatchPlan{levels=" + levelTokens + ", sections=" + levels.keySet() + ", sites=" + sites.size() + '}';
  }
}
