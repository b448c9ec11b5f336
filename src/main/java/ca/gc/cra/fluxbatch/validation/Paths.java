package ca.gc.cra.fluxbatch.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for configuration bootstrap.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse operator-supplied path text, rejecting control characters.</li>
 *   <li>Check that the batch control file is a readable regular file.</li>
 *   <li>Prepare writable directories for command logs.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses a path setting.
   *
   * @param name setting name for diagnostics
   * @param raw path text
   * @return parsed path
   * @throws IllegalArgumentException if the text is blank, contains control characters, or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Validates that a file exists and can be read.
   *
   * @param name setting name for diagnostics
   * @param path candidate file
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " does not exist or is not a file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable directory, creating it (and parents) when missing.
   *
   * @param name setting name for diagnostics
   * @param path candidate directory
   * @return real path of the directory
   * @throws IllegalArgumentException if the path is not a directory, not writable, or cannot be created
   */
  public static Path ensureWritableDir(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException(name + " is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException(name + " is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare " + name + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that an existing directory can be used as a working directory.
   *
   * @param name setting name for diagnostics
   * @param path candidate directory
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is not an existing directory
   */
  public static Path requireDirectory(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not an existing directory: " + normalized);
    }
    return normalized;
  }
}
