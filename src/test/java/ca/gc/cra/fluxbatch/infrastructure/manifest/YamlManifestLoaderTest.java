package ca.gc.cra.fluxbatch.infrastructure.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlManifestLoaderTest {
  @TempDir Path dir;

  private final YamlManifestLoader loader = new YamlManifestLoader();

  @Test
  void loadsSectionsAndLevel() throws IOException {
    Path file = write("L2.yml", """
        level: L2
        Files:
          file_path: ../Data/Processed/
          in_filename: Site_L1.nc
          out_filename: Site_L2.nc
        Plots:
          1:
            type: xy
        """);

    Manifest manifest = loader.load(file);

    assertEquals(Optional.of("L2"), manifest.declaredLevel());
    assertEquals(Optional.of("Site_L1.nc"), manifest.value("Files", "in_filename"));
    assertTrue(manifest.section("Plots").orElseThrow().containsKey("1"));
    assertEquals(file, manifest.source());
  }

  @Test
  void emptyDocumentYieldsEmptyManifest() throws IOException {
    Manifest manifest = loader.load(write("empty.yml", ""));

    assertTrue(manifest.toMap().isEmpty());
  }

  @Test
  void nonMappingRootIsRejected() throws IOException {
    Path file = write("list.yml", "- a\n- b\n");

    assertThrows(IllegalArgumentException.class, () -> loader.load(file));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path file = write("bad.yml", "Files: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> loader.load(file));
  }

  @Test
  void missingFileRaisesIoException() {
    assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("absent.yml")));
  }

  @Test
  void writerOutputLoadsBack() throws IOException {
    Manifest original = loader.load(write("L1.yml", "level: l1\nFiles:\n  out_filename: a.nc\n"));
    original.put("Options", "call_mode", "batch");
    Path copy = dir.resolve("nested").resolve("copy.yml");

    new YamlManifestWriter().write(original, copy);

    Manifest reloaded = loader.load(copy);
    assertEquals(original.toMap(), reloaded.toMap());
  }

  private Path write(String name, String yaml) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }
}
