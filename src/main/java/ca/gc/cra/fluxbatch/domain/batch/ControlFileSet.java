package ca.gc.cra.fluxbatch.domain.batch;

import ca.gc.cra.fluxbatch.domain.level.IterationOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered, read-only collection of manifests queued for one level.
 * <p><strong>Why:</strong> Some levels chain outputs across files and must run in ascending ordinal order while the
 * rest follow the operator's declaration order; the set supports both views over the same entries.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class ControlFileSet {
  private static final ControlFileSet EMPTY = new ControlFileSet(List.of());
  private static final Comparator<ControlFileEntry> NUMERIC =
      Comparator.comparingLong(entry -> Long.parseLong(entry.key()));

  private final List<ControlFileEntry> entries;

  private ControlFileSet(List<ControlFileEntry> entries) {
    this.entries = entries;
  }

  /**
   * Builds a set from declared ordinal keys, preserving the map's iteration order as declaration order.
   *
   * @param declared ordinal key to manifest path; keys are trimmed and must encode integers
   * @return control file set
   * @throws IllegalArgumentException if a key is blank, not an integer, or duplicated after trimming
   */
  public static ControlFileSet of(Map<String, Path> declared) {
    Objects.requireNonNull(declared, "declared");
    if (declared.isEmpty()) {
      return EMPTY;
    }
    Map<String, ControlFileEntry> byKey = new LinkedHashMap<>();
    for (Map.Entry<String, Path> entry : declared.entrySet()) {
      String key = requireOrdinal(entry.getKey());
      Path locator = Objects.requireNonNull(entry.getValue(), "locator for key " + key);
      if (byKey.putIfAbsent(key, new ControlFileEntry(key, locator)) != null) {
        throw new IllegalArgumentException("duplicate control file key: " + key);
      }
    }
    return new ControlFileSet(List.copyOf(byKey.values()));
  }

  /**
   * Builds a set holding exactly one manifest.
   *
   * @param key ordinal key
   * @param locator manifest path
   * @return single-entry set
   */
  public static ControlFileSet single(String key, Path locator) {
    return of(Map.of(key, locator));
  }

  /**
   * Returns the shared empty set.
   *
   * @return empty set
   */
  public static ControlFileSet empty() {
    return EMPTY;
  }

  /**
   * Returns the entries in the requested order.
   *
   * @param order iteration policy of the consuming level
   * @return unmodifiable ordered view
   */
  public List<ControlFileEntry> inOrder(IterationOrder order) {
    Objects.requireNonNull(order, "order");
    if (order == IterationOrder.DECLARATION || entries.size() < 2) {
      return entries;
    }
    List<ControlFileEntry> sorted = new ArrayList<>(entries);
    sorted.sort(NUMERIC);
    return Collections.unmodifiableList(sorted);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return "ControlFileSet" + entries;
  }

  private static String requireOrdinal(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("control file key must not be blank");
    }
    String key = raw.trim();
    try {
      Long.parseLong(key);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("control file key must be an integer (was '" + raw + "')", ex);
    }
    return key;
  }
}
