package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Port that reads a manifest from storage.
 *
 * @since 0.1.0
 */
public interface ManifestLoader {
  /**
   * Loads and parses a manifest.
   *
   * @param path manifest location
   * @return parsed manifest
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the content is not a valid manifest document
   */
  Manifest load(Path path) throws IOException;
}
