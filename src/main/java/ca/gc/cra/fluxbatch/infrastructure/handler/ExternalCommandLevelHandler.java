package ca.gc.cra.fluxbatch.infrastructure.handler;

import ca.gc.cra.fluxbatch.application.port.LevelContext;
import ca.gc.cra.fluxbatch.application.port.LevelHandler;
import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link LevelHandler} that runs a level's processing step as an external command.
 * <p><strong>Placeholders:</strong> {@code {manifest}} is a temporary YAML copy of the manifest with the batch options
 * already applied; {@code {source}} is the original manifest path; {@code {level}} is the level token;
 * {@code {site}} is the site name, or empty outside site runs.</p>
 * <p><strong>Outcome:</strong> The exit code becomes the status; the manifest's output file, when it names one, is
 * reported as the artifact.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared runner; safe for concurrent site workers.</p>
 *
 * @since 0.1.0
 */
public final class ExternalCommandLevelHandler implements LevelHandler {
  private static final Logger log = LoggerFactory.getLogger(ExternalCommandLevelHandler.class);

  private final CommandTemplate command;
  private final ProcessCommandRunner runner;
  private final YamlManifestWriter writer;
  private final Optional<Path> commandLogDir;

  /**
   * Creates a handler.
   *
   * @param command command template for the level
   * @param runner process launcher
   * @param writer writes the effective manifest for the child process
   * @param commandLogDir directory for {@code <level>.log} output files; empty to inherit streams
   */
  public ExternalCommandLevelHandler(
      CommandTemplate command,
      ProcessCommandRunner runner,
      YamlManifestWriter writer,
      Optional<Path> commandLogDir) {
    this.command = Objects.requireNonNull(command, "command");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.commandLogDir = Objects.requireNonNullElse(commandLogDir, Optional.empty());
  }

  @Override
  public LevelOutcome handle(Manifest manifest, LevelContext context) throws IOException, InterruptedException {
    Objects.requireNonNull(manifest, "manifest");
    Objects.requireNonNull(context, "context");
    Path effective = writer.writeTemporary(manifest, null);
    try {
      Map<String, String> values = new LinkedHashMap<>();
      values.put("manifest", effective.toString());
      values.put("source", manifest.source().toString());
      values.put("level", context.level().token());
      values.put("site", context.site().orElse(""));
      List<String> args = command.render(values);
      Optional<Path> logFile = commandLogDir.map(dir -> dir.resolve(context.level().token() + ".log"));
      int exit = runner.run(args, logFile);
      if (exit != 0) {
        return LevelOutcome.failed(exit);
      }
      return manifest.outputFile().map(LevelOutcome::success).orElseGet(LevelOutcome::success);
    } finally {
      try {
        Files.deleteIfExists(effective);
      } catch (IOException ex) {
        log.warn("Unable to delete temporary control file {}", effective, ex);
      }
    }
  }

  @Override
  public String toString() {
    return "ExternalCommandLevelHandler[" + command + "]";
  }
}
