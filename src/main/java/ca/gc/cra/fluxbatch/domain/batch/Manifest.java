package ca.gc.cra.fluxbatch.domain.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> In-memory form of one level control file (a unit of work).
 * <p><strong>Role:</strong> Produced by a {@code ManifestLoader}, normalized by the compliance updater, then handed to
 * the level handler.</p>
 * <p><strong>Structure:</strong> Top-level keys are either scalar settings (such as {@code level}) or named sections
 * ({@code Files}, {@code Options}, {@code Plots}) holding nested maps. Keys are always strings; loaders that produce
 * numeric keys are normalized on construction.</p>
 * <p><strong>Thread-safety:</strong> Mutable and not thread-safe; each manifest belongs to exactly one runner
 * iteration.</p>
 *
 * @since 0.1.0
 */
public final class Manifest {
  public static final String FILES = "Files";
  public static final String OPTIONS = "Options";
  public static final String PLOTS = "Plots";
  public static final String LEVEL = "level";

  private final Path source;
  private final Map<String, Object> content = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> sections = new LinkedHashMap<>();

  /**
   * Creates a manifest from parsed content.
   *
   * @param source path the manifest was read from
   * @param content parsed document; deep-copied so later mutation does not leak back to the caller
   */
  public Manifest(Path source, Map<?, ?> content) {
    this.source = Objects.requireNonNull(source, "source");
    for (Map.Entry<?, ?> entry : Objects.requireNonNull(content, "content").entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("manifest keys must not be null");
      }
      String key = entry.getKey().toString();
      if (entry.getValue() instanceof Map<?, ?> nested) {
        addSection(key, copyOf(nested));
      } else {
        this.content.put(key, copyValue(entry.getValue()));
      }
    }
  }

  public Path source() {
    return source;
  }

  /**
   * Returns the manifest's file name for log lines.
   *
   * @return file name of {@link #source()}
   */
  public String name() {
    Path name = source.getFileName();
    return name == null ? source.toString() : name.toString();
  }

  /**
   * Returns the level declared by the manifest itself (used by per-site lists).
   *
   * @return trimmed level token, or empty when absent or blank
   */
  public Optional<String> declaredLevel() {
    Object value = content.get(LEVEL);
    if (value == null || value.toString().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.toString().trim());
  }

  public boolean hasSection(String name) {
    return sections.containsKey(name);
  }

  /**
   * Returns a read-only view of a section.
   *
   * @param name section name such as {@link #FILES}
   * @return section contents, or empty when the section is absent or not a mapping
   */
  public Optional<Map<String, Object>> section(String name) {
    if (!hasSection(name)) {
      return Optional.empty();
    }
    return Optional.of(Collections.unmodifiableMap(sections.get(name)));
  }

  /**
   * Returns a mutable section, creating an empty one when absent.
   *
   * @param name section name
   * @return live section map
   * @throws IllegalArgumentException if {@code name} is already bound to a scalar value
   */
  public Map<String, Object> getOrCreateSection(String name) {
    Objects.requireNonNull(name, "name");
    Map<String, Object> existing = sections.get(name);
    if (existing != null) {
      return existing;
    }
    if (content.get(name) != null) {
      throw new IllegalArgumentException(name + " in " + name() + " is not a section");
    }
    return addSection(name, new LinkedHashMap<>());
  }

  /**
   * Looks up a scalar value inside a section.
   *
   * @param section section name
   * @param key key within the section
   * @return trimmed string value, or empty when missing or blank
   */
  public Optional<String> value(String section, String key) {
    return section(section)
        .map(map -> map.get(key))
        .filter(value -> !(value instanceof Map<?, ?>))
        .map(Object::toString)
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Sets a scalar value inside a section, creating the section when needed.
   *
   * @param section section name
   * @param key key within the section
   * @param value value to store
   */
  public void put(String section, String key, Object value) {
    getOrCreateSection(section).put(Objects.requireNonNull(key, "key"), value);
  }

  /**
   * Resolves the output file named by {@code Files.out_filename}, relative to {@code Files.file_path}.
   *
   * @return output path, or empty when the manifest names none
   */
  public Optional<Path> outputFile() {
    return resolveFile("out_filename");
  }

  /**
   * Resolves the input file named by {@code Files.in_filename}, relative to {@code Files.file_path}.
   *
   * @return input path, or empty when the manifest names none
   */
  public Optional<Path> inputFile() {
    return resolveFile("in_filename");
  }

  /**
   * Returns a deep copy of the manifest content suitable for serialization.
   *
   * @return detached copy
   */
  public Map<String, Object> toMap() {
    return copyOf(content);
  }

  @Override
  public String toString() {
    return "Manifest[" + source + "]";
  }

  private Optional<Path> resolveFile(String key) {
    Optional<String> fileName = value(FILES, key);
    if (fileName.isEmpty()) {
      return Optional.empty();
    }
    Path file = Path.of(fileName.get());
    Optional<String> directory = value(FILES, "file_path");
    return Optional.of(directory.map(dir -> Path.of(dir).resolve(file)).orElse(file));
  }

  private Map<String, Object> addSection(String name, Map<String, Object> section) {
    sections.put(name, section);
    content.put(name, section);
    return section;
  }

  private static Map<String, Object> copyOf(Map<?, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("manifest keys must not be null");
      }
      copy.put(entry.getKey().toString(), copyValue(entry.getValue()));
    }
    return copy;
  }

  private static Object copyValue(Object value) {
    if (value instanceof Map<?, ?> nested) {
      return copyOf(nested);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object item : list) {
        copy.add(copyValue(item));
      }
      return copy;
    }
    return value;
  }
}
