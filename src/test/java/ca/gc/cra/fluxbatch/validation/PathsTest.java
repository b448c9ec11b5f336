package ca.gc.cra.fluxbatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path dir;

  @Test
  void parseRejectsBlank() {
    assertEquals(Path.of("batch.yml"), Paths.parse("control", " batch.yml "));
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("control", ""));
  }

  @Test
  void readableFileMustExist() throws IOException {
    Path file = Files.writeString(dir.resolve("batch.yml"), "Options: {}\n");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile("control", file));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("control", dir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("control", dir.resolve("absent.yml")));
  }

  @Test
  void ensureWritableDirCreatesMissingDirectories() {
    Path logs = dir.resolve("logs/nested");

    Path result = Paths.ensureWritableDir("commandLogDir", logs);

    assertTrue(Files.isDirectory(result));
  }

  @Test
  void ensureWritableDirRejectsFiles() throws IOException {
    Path file = Files.writeString(dir.resolve("not-a-dir"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.ensureWritableDir("commandLogDir", file));
  }

  @Test
  void requireDirectoryDoesNotCreate() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireDirectory("workDir", dir.resolve("absent")));
    assertEquals(dir.toAbsolutePath().normalize(), Paths.requireDirectory("workDir", dir));
  }
}
