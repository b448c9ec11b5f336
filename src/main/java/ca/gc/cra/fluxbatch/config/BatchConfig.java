package ca.gc.cra.fluxbatch.config;

import ca.gc.cra.fluxbatch.application.batch.ParallelSiteDispatcher;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.validation.Numbers;
import ca.gc.cra.fluxbatch.validation.Paths;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Effective settings for one batch invocation.
 *
 * @param control batch control file listing levels, control files, and sites
 * @param runMode levels or sites
 * @param sessionMode interactive or batch
 * @param poolSize site worker count (sites mode)
 * @param handlerCommands command line per level; levels without one are reported as unrecognised
 * @param fingerprintCommand command producing fingerprint plots, when configured
 * @param plotCommand command producing one manifest plot, when configured
 * @param commandLogDir directory receiving external command output, when configured
 * @param workDir working directory for external commands, when configured
 * @since 0.1.0
 */
public record BatchConfig(
    Path control,
    RunMode runMode,
    SessionMode sessionMode,
    int poolSize,
    Map<LevelId, String> handlerCommands,
    Optional<String> fingerprintCommand,
    Optional<String> plotCommand,
    Optional<Path> commandLogDir,
    Optional<Path> workDir) {

  static final int MAX_POOL_SIZE = 64;
  private static final String HANDLER_PREFIX = "handler.";

  public BatchConfig {
    Objects.requireNonNull(control, "control");
    Objects.requireNonNull(runMode, "runMode");
    Objects.requireNonNull(sessionMode, "sessionMode");
    Numbers.requireRange("poolSize", poolSize, 1, MAX_POOL_SIZE);
    handlerCommands = handlerCommands.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(handlerCommands));
    fingerprintCommand = Objects.requireNonNullElse(fingerprintCommand, Optional.empty());
    plotCommand = Objects.requireNonNullElse(plotCommand, Optional.empty());
    commandLogDir = Objects.requireNonNullElse(commandLogDir, Optional.empty());
    workDir = Objects.requireNonNullElse(workDir, Optional.empty());
  }

  /**
   * Builds the configuration from merged, flattened settings.
   *
   * @param runMode run mode selected by the command
   * @param options effective settings (CLI &gt; YAML &gt; defaults)
   * @return validated configuration
   * @throws IllegalArgumentException if a required key is missing or a value is invalid
   */
  public static BatchConfig fromMap(RunMode runMode, Map<String, String> options) {
    Objects.requireNonNull(runMode, "runMode");
    Objects.requireNonNull(options, "options");

    String controlRaw = options.get("control");
    if (controlRaw == null || controlRaw.isBlank()) {
      throw new IllegalArgumentException("control is required (path to the batch control file)");
    }
    Path control = Paths.parse("control", controlRaw);
    SessionMode sessionMode = SessionMode.parse(options.getOrDefault("sessionMode", "batch"));
    int poolSize = Numbers.parseIntInRange(
        "poolSize", options.get("poolSize"), ParallelSiteDispatcher.DEFAULT_POOL_SIZE, 1, MAX_POOL_SIZE);

    Map<LevelId, String> handlers = new EnumMap<>(LevelId.class);
    for (Map.Entry<String, String> entry : options.entrySet()) {
      if (!entry.getKey().startsWith(HANDLER_PREFIX)) {
        continue;
      }
      String token = entry.getKey().substring(HANDLER_PREFIX.length());
      LevelId level = LevelId.fromToken(token)
          .orElseThrow(() -> new IllegalArgumentException("Unknown level in handler setting: " + entry.getKey()));
      optional(entry.getValue()).ifPresent(command -> handlers.put(level, command));
    }

    return new BatchConfig(
        control,
        runMode,
        sessionMode,
        poolSize,
        handlers,
        optional(options.get("fingerprintCommand")),
        optional(options.get("plotCommand")),
        optional(options.get("commandLogDir")).map(raw -> Paths.parse("commandLogDir", raw)),
        optional(options.get("workDir")).map(raw -> Paths.parse("workDir", raw)));
  }

  private static Optional<String> optional(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }
}
