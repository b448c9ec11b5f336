package ca.gc.cra.fluxbatch.infrastructure.manifest;

import ca.gc.cra.fluxbatch.application.port.ManifestLoader;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads level manifests written as YAML documents.
 *
 * <p>An empty document yields an empty manifest (the compliance updater rejects it); any other non-mapping root is
 * invalid.</p>
 */
public final class YamlManifestLoader implements ManifestLoader {

  @Override
  public Manifest load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return new Manifest(path, Map.of());
      }
      if (!(document instanceof Map<?, ?> root)) {
        throw new IllegalArgumentException("Control file " + path + " must contain a mapping at its root");
      }
      return new Manifest(path, root);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse control file " + path, ex);
    }
  }
}
