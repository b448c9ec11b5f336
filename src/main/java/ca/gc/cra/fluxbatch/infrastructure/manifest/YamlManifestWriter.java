package ca.gc.cra.fluxbatch.infrastructure.manifest;

import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Serializes manifests back to YAML so external commands can read the effective (batch-adjusted) settings.
 */
public final class YamlManifestWriter {
  private final Yaml yaml;

  public YamlManifestWriter() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    this.yaml = new Yaml(options);
  }

  /**
   * Writes a manifest to {@code target}, replacing any existing file.
   *
   * @param manifest manifest to write
   * @param target destination file
   * @throws IOException if the file cannot be written
   */
  public void write(Manifest manifest, Path target) throws IOException {
    write(Objects.requireNonNull(manifest, "manifest").toMap(), target);
  }

  /**
   * Writes a raw document to {@code target}.
   *
   * @param document sections and values
   * @param target destination file
   * @throws IOException if the file cannot be written
   */
  public void write(Map<String, Object> document, Path target) throws IOException {
    Objects.requireNonNull(document, "document");
    Objects.requireNonNull(target, "target");
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      yaml.dump(document, writer);
    }
  }

  /**
   * Writes a manifest to a fresh temporary file.
   *
   * @param manifest manifest to write
   * @param directory directory for the file, or {@code null} for the system temporary directory
   * @return path of the written file; the caller deletes it
   * @throws IOException if the file cannot be created or written
   */
  public Path writeTemporary(Manifest manifest, Path directory) throws IOException {
    Path file = directory == null
        ? Files.createTempFile("fluxbatch-", ".yml")
        : Files.createTempFile(Files.createDirectories(directory), "fluxbatch-", ".yml");
    write(manifest, file);
    return file;
  }
}
