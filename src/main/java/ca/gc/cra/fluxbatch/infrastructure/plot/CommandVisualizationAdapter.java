package ca.gc.cra.fluxbatch.infrastructure.plot;

import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.infrastructure.handler.CommandTemplate;
import ca.gc.cra.fluxbatch.infrastructure.handler.ProcessCommandRunner;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link VisualizationPort} that renders plots through configured external commands.
 * <p><strong>Fingerprints:</strong> Builds a fingerprint manifest pointing at the dataset the unit wrote
 * ({@code Files.file_path}, {@code Files.in_filename}, {@code Files.plot_path}) with batch options set, then runs the
 * fingerprint command with {@code {manifest}}, {@code {source}} and {@code {dataset}}.</p>
 * <p><strong>Manifest plots:</strong> Runs the plot command once per {@code Plots} entry, skipping entries whose name
 * contains {@code (disabled)}; {@code {plot}} is the entry name and {@code {type}} is {@code xy} or
 * {@code timeseries}.</p>
 * <p>A missing command disables its step; a non-zero exit code raises an exception so the runner records the unit as
 * failed.</p>
 *
 * @since 0.1.0
 */
public final class CommandVisualizationAdapter implements VisualizationPort {
  private static final Logger log = LoggerFactory.getLogger(CommandVisualizationAdapter.class);
  private static final String DISABLED_MARKER = "(disabled)";

  private final Optional<CommandTemplate> fingerprintCommand;
  private final Optional<CommandTemplate> plotCommand;
  private final ProcessCommandRunner runner;
  private final YamlManifestWriter writer;
  private final Optional<Path> commandLogDir;

  /**
   * Creates the adapter.
   *
   * @param fingerprintCommand command producing fingerprint plots; empty to skip fingerprints
   * @param plotCommand command producing one manifest plot; empty to skip manifest plots
   * @param runner process launcher
   * @param writer writes manifests for the plot commands
   * @param commandLogDir directory for {@code fingerprint.log}/{@code plots.log}; empty to inherit streams
   */
  public CommandVisualizationAdapter(
      Optional<CommandTemplate> fingerprintCommand,
      Optional<CommandTemplate> plotCommand,
      ProcessCommandRunner runner,
      YamlManifestWriter writer,
      Optional<Path> commandLogDir) {
    this.fingerprintCommand = Objects.requireNonNullElse(fingerprintCommand, Optional.empty());
    this.plotCommand = Objects.requireNonNullElse(plotCommand, Optional.empty());
    this.runner = Objects.requireNonNull(runner, "runner");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.commandLogDir = Objects.requireNonNullElse(commandLogDir, Optional.empty());
  }

  @Override
  public void fingerprint(Manifest manifest) throws IOException, InterruptedException {
    if (fingerprintCommand.isEmpty()) {
      log.debug("No fingerprint command configured; skipping fingerprints for {}", manifest.name());
      return;
    }
    Optional<Path> dataset = manifest.outputFile();
    if (dataset.isEmpty()) {
      log.warn("Control file {} names no output file; skipping fingerprints", manifest.name());
      return;
    }
    Manifest fingerprint = new Manifest(manifest.source(), fingerprintDocument(manifest, dataset.get()));
    Path effective = writer.writeTemporary(fingerprint, null);
    try {
      Map<String, String> values = new LinkedHashMap<>();
      values.put("manifest", effective.toString());
      values.put("source", manifest.source().toString());
      values.put("dataset", dataset.get().toString());
      execute("fingerprint", fingerprintCommand.get(), values);
    } finally {
      deleteQuietly(effective);
    }
  }

  @Override
  public void manifestPlots(Manifest manifest, LevelOutcome outcome) throws IOException, InterruptedException {
    Optional<Map<String, Object>> plots = manifest.section(Manifest.PLOTS);
    if (plots.isEmpty() || plots.get().isEmpty()) {
      return;
    }
    if (plotCommand.isEmpty()) {
      log.debug("No plot command configured; skipping {} plots for {}", plots.get().size(), manifest.name());
      return;
    }
    String dataset = outcome.artifact()
        .or(manifest::outputFile)
        .map(Path::toString)
        .orElse("");
    Path effective = writer.writeTemporary(manifest, null);
    try {
      for (Map.Entry<String, Object> entry : plots.get().entrySet()) {
        String plot = entry.getKey();
        if (plot.contains(DISABLED_MARKER)) {
          log.debug("Skipping disabled plot {}", plot);
          continue;
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put("manifest", effective.toString());
        values.put("source", manifest.source().toString());
        values.put("dataset", dataset);
        values.put("plot", plot);
        values.put("type", plotType(entry.getValue()));
        execute("plots", plotCommand.get(), values);
      }
    } finally {
      deleteQuietly(effective);
    }
  }

  static String plotType(Object entry) {
    if (entry instanceof Map<?, ?> settings) {
      Object type = settings.get("type");
      if (type != null && type.toString().trim().toLowerCase(Locale.ROOT).equals("xy")) {
        return "xy";
      }
    }
    return "timeseries";
  }

  static Map<String, Object> fingerprintDocument(Manifest manifest, Path dataset) {
    Map<String, Object> files = new LinkedHashMap<>();
    Path directory = dataset.getParent();
    files.put("file_path", directory == null ? "" : directory.toString());
    files.put("in_filename", String.valueOf(dataset.getFileName()));
    files.put("plot_path", manifest.value(Manifest.FILES, "plot_path").orElse("plots/"));
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("call_mode", "batch");
    options.put("show_plots", "No");
    Map<String, Object> document = new LinkedHashMap<>();
    document.put(Manifest.FILES, files);
    document.put(Manifest.OPTIONS, options);
    return document;
  }

  private void execute(String step, CommandTemplate command, Map<String, String> values)
      throws IOException, InterruptedException {
    Optional<Path> logFile = commandLogDir.map(dir -> dir.resolve(step + ".log"));
    int exit = runner.run(command.render(values), logFile);
    if (exit != 0) {
      throw new IllegalStateException(step + " command exited with status " + exit);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Unable to delete temporary control file {}", file, ex);
    }
  }
}
