package ca.gc.cra.fluxbatch.infrastructure.manifest;

import ca.gc.cra.fluxbatch.application.port.ComplianceUpdater;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Brings manifests up to the structure each level needs before its handler runs.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create missing {@code Files} and {@code Options} sections.</li>
 *   <li>Default {@code Files.file_path} to {@code ""} and {@code Files.plot_path} to {@code plots/}.</li>
 *   <li>Reject manifests missing the file keys the level reads or writes, logging the reason at ERROR.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DefaultComplianceUpdater implements ComplianceUpdater {
  private static final Logger log = LoggerFactory.getLogger(DefaultComplianceUpdater.class);

  static final String FILE_PATH = "file_path";
  static final String PLOT_PATH = "plot_path";
  static final String IN_FILENAME = "in_filename";
  static final String OUT_FILENAME = "out_filename";
  static final String IN_SECTION = "In";
  static final String DEFAULT_PLOT_PATH = "plots/";

  @Override
  public boolean update(LevelId level, Manifest manifest) {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(manifest, "manifest");
    Map<String, Object> files;
    try {
      files = manifest.getOrCreateSection(Manifest.FILES);
      manifest.getOrCreateSection(Manifest.OPTIONS);
    } catch (IllegalArgumentException ex) {
      log.error("Control file {} is malformed: {}", manifest.name(), ex.getMessage());
      return false;
    }
    files.putIfAbsent(FILE_PATH, "");
    files.putIfAbsent(PLOT_PATH, DEFAULT_PLOT_PATH);

    return switch (requirementFor(level)) {
      case OUTPUT_FILE -> require(manifest, level, OUT_FILENAME);
      case INPUT_FILE -> require(manifest, level, IN_FILENAME);
      case INPUT_FILE_OR_SECTION -> requireInputs(manifest, level, files);
    };
  }

  private static boolean require(Manifest manifest, LevelId level, String key) {
    if (manifest.value(Manifest.FILES, key).isPresent()) {
      return true;
    }
    log.error("Control file {} has no Files.{} entry required for {}", manifest.name(), key, level.label());
    return false;
  }

  private static boolean requireInputs(Manifest manifest, LevelId level, Map<String, Object> files) {
    if (manifest.value(Manifest.FILES, IN_FILENAME).isPresent()) {
      return true;
    }
    Object inputs = files.get(IN_SECTION);
    if (inputs instanceof Map<?, ?> map && !map.isEmpty()) {
      return true;
    }
    log.error(
        "Control file {} names no input files (Files.{} or Files.{}) for {}",
        manifest.name(), IN_FILENAME, IN_SECTION, level.label());
    return false;
  }

  static Requirement requirementFor(LevelId level) {
    return switch (level) {
      case L1, L2, L3, L4, L5, L6 -> Requirement.OUTPUT_FILE;
      case CLIMATOLOGY, CPD_BARR, CPD_MCHUGH, CPD_MCNEW, MPT -> Requirement.INPUT_FILE;
      case CONCATENATE, ECOSTRESS, FLUXNET, REDDYPROC -> Requirement.INPUT_FILE_OR_SECTION;
    };
  }

  enum Requirement {
    OUTPUT_FILE,
    INPUT_FILE,
    INPUT_FILE_OR_SECTION
  }
}
