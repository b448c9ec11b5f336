package ca.gc.cra.fluxbatch.domain.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One ordinal key and the manifest it points to.
 *
 * @param key ordinal key as declared (string-encoded integer)
 * @param locator manifest path; need not exist
 * @since 0.1.0
 */
public record ControlFileEntry(String key, Path locator) {

  public ControlFileEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(locator, "locator");
  }

  /**
   * Returns the manifest file name for log lines.
   *
   * @return last path element, or the full locator when it has none
   */
  public String fileName() {
    Path name = locator.getFileName();
    return name == null ? locator.toString() : name.toString();
  }
}
