package ca.gc.cra.fluxbatch.api;

import ca.gc.cra.fluxbatch.application.batch.BatchSession;
import ca.gc.cra.fluxbatch.application.port.ClockPort;
import ca.gc.cra.fluxbatch.config.BatchConfig;
import ca.gc.cra.fluxbatch.config.BatchControlFileLoader;
import ca.gc.cra.fluxbatch.config.CompositionRoot;
import ca.gc.cra.fluxbatch.config.ConfigMerger;
import ca.gc.cra.fluxbatch.config.DefaultsForMode;
import ca.gc.cra.fluxbatch.config.YamlConfigLoader;
import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.infrastructure.events.LoggingLevelResultSink;
import ca.gc.cra.fluxbatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.fluxbatch.logging.LoggingConfigurator;
import ca.gc.cra.fluxbatch.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point shared by the {@code levels} and {@code sites} commands.
 *
 * <p>Builds the effective configuration (CLI &gt; YAML &gt; defaults), parses the batch control file, then either
 * prints the plan ({@code --dry-run}) or runs a {@link BatchSession}. A JVM shutdown hook requests a cooperative
 * stop and waits for the session, so Ctrl-C lets running handlers finish.</p>
 *
 * @since 0.1.0
 */
final class BatchCli {
  private static final Logger log = LoggerFactory.getLogger(BatchCli.class);
  private static final Duration SHUTDOWN_WAIT_SLICE = Duration.ofSeconds(30);

  private static final String SUMMARY_USAGE =
      "usage: fluxbatch <levels|sites> control=PATH [config=PATH] [sessionMode=batch|interactive] "
          + "[poolSize=N] [handler.<level>=COMMAND] [fingerprintCommand=COMMAND] [plotCommand=COMMAND] "
          + "[commandLogDir=PATH] [workDir=PATH] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      fluxbatch %1$s

      Usage:
        fluxbatch %1$s control=./batch.yml handler.l1="l1-proc {manifest}" [options]

      Required:
        control=PATH                Batch control file (Options.levels, Levels, Sites)

      Optional:
        config=PATH                 YAML settings with 'common' and '%1$s' sections
        sessionMode=batch|interactive  Session mode forwarded to handlers (default batch)
        poolSize=N                  Site workers, 1..64 (sites mode, default 5)
        handler.<level>=COMMAND     Command run for a level; {manifest} {source} {level} {site}
        fingerprintCommand=COMMAND  Run after concatenate/l4/l5; {manifest} {source} {dataset}
        plotCommand=COMMAND         Run per enabled Plots entry after l2/l3; {plot} {type} {dataset}
        commandLogDir=PATH          Append command output to <level>.log files here
        workDir=PATH                Working directory for commands
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate and print the plan without running handlers
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Notes:
        Failed manifests are logged and skipped; the exit code stays 0 unless the batch cannot start.
      """;

  private BatchCli() {}

  /**
   * Runs one batch command.
   *
   * @param args arguments following the command name
   * @param runMode levels or sites
   * @return exit code
   */
  static ExitCode run(String[] args, RunMode runMode) {
    String mode = runMode.name().toLowerCase(Locale.ROOT);
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.formatted(mode).stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    Optional<String> configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath.isPresent()) {
      Path yamlPath = Path.of(configPath.get());
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    BatchConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      dryRun = input.hasFlag(CliInput.DRY_RUN) || ConfigCliUtils.parseBoolean(effective, "dryRun");
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      effective.remove("dryRun");
      effective.remove("verbose");
      TelemetryConfigurator.configureMetrics(effective);
      config = BatchConfig.fromMap(runMode, effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    BatchPlan plan;
    try {
      Path control = Paths.requireReadableFile("control", config.control());
      plan = new BatchControlFileLoader().load(control, runMode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid batch control file {}: {}", config.control(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read batch control file {}", config.control(), ex);
      return ExitCode.IO_ERROR;
    }

    try {
      config.workDir().ifPresent(dir -> Paths.requireDirectory("workDir", dir));
      if (!dryRun) {
        config.commandLogDir().ifPresent(dir -> Paths.ensureWritableDir("commandLogDir", dir));
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid command directories: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      CliPrinter.printLines(dryRunPlan(config, plan));
      return ExitCode.SUCCESS;
    }
    return execute(config, plan);
  }

  private static ExitCode execute(BatchConfig config, BatchPlan plan) {
    LoggingLevelResultSink sink = new LoggingLevelResultSink();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      BatchSession session;
      try {
        session = new CompositionRoot(config, metrics, sink, ClockPort.SYSTEM).batchSession(plan);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid handler configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      log.info("Configured {} run: control={}, sessionMode={}, handlers={}",
          config.runMode().name().toLowerCase(Locale.ROOT),
          config.control(),
          config.sessionMode().name().toLowerCase(Locale.ROOT),
          config.handlerCommands().keySet());

      Thread hook = new Thread(() -> stopAndWait(session), "fluxbatch-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        session.run();
      } finally {
        removeHook(hook);
      }
      sink.logSummary();
      if (Thread.currentThread().isInterrupted()) {
        return ExitCode.INTERRUPTED;
      }
      return ExitCode.SUCCESS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure during batch processing", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void stopAndWait(BatchSession session) {
    session.requestStop();
    try {
      while (!session.awaitCompletion(SHUTDOWN_WAIT_SLICE)) {
        log.info("Waiting for running control files to finish before shutdown");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for batch processing to stop");
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; leaving stop hook in place");
    }
  }

  static List<String> dryRunPlan(BatchConfig config, BatchPlan plan) {
    List<String> lines = new ArrayList<>();
    String mode = config.runMode().name().toLowerCase(Locale.ROOT);
    lines.add("fluxbatch " + mode + " dry-run: no handlers will be run.");
    lines.add(" Control file      : " + config.control());
    lines.add(" Session mode      : " + config.sessionMode().name().toLowerCase(Locale.ROOT));
    if (config.runMode() == RunMode.LEVELS) {
      for (String token : plan.levelTokens()) {
        lines.add(" Level " + pad(token) + ": " + describeLevel(config, plan, token));
      }
    } else {
      lines.add(" Pool size         : " + config.poolSize());
      for (SiteManifest site : plan.sites()) {
        lines.add(" Site  " + pad(site.site()) + ": " + site.controlFiles().size() + " control file(s)");
      }
    }
    lines.add(" Fingerprint cmd   : " + config.fingerprintCommand().orElse("<none>"));
    lines.add(" Plot cmd          : " + config.plotCommand().orElse("<none>"));
    lines.add(" Command log dir   : " + config.commandLogDir().map(Path::toString).orElse("<inherit>"));
    lines.add(" Re-run without --dry-run to process the batch.");
    return lines;
  }

  private static String describeLevel(BatchConfig config, BatchPlan plan, String token) {
    Optional<LevelId> level = LevelId.fromToken(token);
    if (level.isEmpty()) {
      return "unrecognised, will be skipped";
    }
    int count = plan.controlFilesFor(token).map(ControlFileSet::size).orElse(0);
    String handler = config.handlerCommands().containsKey(level.get()) ? "" : ", no handler configured";
    return count + " control file(s), " + level.get().iterationOrder().name().toLowerCase(Locale.ROOT)
        + " order" + handler;
  }

  private static String pad(String value) {
    StringBuilder padded = new StringBuilder(value);
    while (padded.length() < 12) {
      padded.append(' ');
    }
    return padded.toString();
  }
}
