package ca.gc.cra.fluxbatch.config;

import ca.gc.cra.fluxbatch.application.batch.BatchSession;
import ca.gc.cra.fluxbatch.application.batch.LevelRegistry;
import ca.gc.cra.fluxbatch.application.batch.ParallelSiteDispatcher;
import ca.gc.cra.fluxbatch.application.batch.SequentialLevelRunner;
import ca.gc.cra.fluxbatch.application.port.ClockPort;
import ca.gc.cra.fluxbatch.application.port.LevelResultSink;
import ca.gc.cra.fluxbatch.application.port.ManifestLoader;
import ca.gc.cra.fluxbatch.application.port.MetricsPort;
import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.infrastructure.handler.CommandTemplate;
import ca.gc.cra.fluxbatch.infrastructure.handler.ExternalCommandLevelHandler;
import ca.gc.cra.fluxbatch.infrastructure.handler.ProcessCommandRunner;
import ca.gc.cra.fluxbatch.infrastructure.manifest.DefaultComplianceUpdater;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestLoader;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestWriter;
import ca.gc.cra.fluxbatch.infrastructure.plot.CommandVisualizationAdapter;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the batch use cases to concrete adapters from a {@link BatchConfig}.
 * <p><strong>Role:</strong> Composition root for the {@code levels} and {@code sites} commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bind every configured {@code handler.<level>} command into the {@link LevelRegistry}.</li>
 *   <li>Build the shared {@link SequentialLevelRunner} and the {@link ParallelSiteDispatcher}.</li>
 *   <li>Create a {@link BatchSession} for a parsed plan.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Build once on the CLI thread; the components it returns are shared by site
 * workers.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BatchConfig config;
  private final MetricsPort metrics;
  private final LevelResultSink sink;
  private final ClockPort clock;
  private final ManifestLoader loader = new YamlManifestLoader();
  private final YamlManifestWriter writer = new YamlManifestWriter();
  private final ProcessCommandRunner commandRunner;

  /**
   * Creates the root.
   *
   * @param config effective batch settings
   * @param metrics metrics sink shared by all components
   * @param sink receives per-manifest results
   * @param clock time source
   */
  public CompositionRoot(BatchConfig config, MetricsPort metrics, LevelResultSink sink, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.commandRunner = new ProcessCommandRunner(config.workDir());
  }

  /**
   * Builds the level dispatch table from the configured handler commands.
   *
   * @return registry holding one external-command handler per configured level
   * @throws IllegalArgumentException if a handler command cannot be parsed
   */
  public LevelRegistry levelRegistry() {
    LevelRegistry.Builder builder = LevelRegistry.builder();
    for (Map.Entry<LevelId, String> entry : config.handlerCommands().entrySet()) {
      CommandTemplate template;
      try {
        template = CommandTemplate.parse(entry.getValue());
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            "Invalid handler." + entry.getKey().token() + " command: " + ex.getMessage(), ex);
      }
      builder.register(entry.getKey(),
          new ExternalCommandLevelHandler(template, commandRunner, writer, config.commandLogDir()));
    }
    return builder.build();
  }

  public SequentialLevelRunner levelRunner() {
    return new SequentialLevelRunner(loader, new DefaultComplianceUpdater(), visualization(), sink, metrics, clock);
  }

  /**
   * Builds the full object graph for one batch invocation.
   *
   * @param plan parsed batch control file
   * @return session ready to {@link BatchSession#run()}
   */
  public BatchSession batchSession(BatchPlan plan) {
    Objects.requireNonNull(plan, "plan");
    LevelRegistry registry = levelRegistry();
    SequentialLevelRunner runner = levelRunner();
    ParallelSiteDispatcher dispatcher =
        new ParallelSiteDispatcher(registry, runner, loader, metrics, config.poolSize());
    return new BatchSession(
        plan, config.runMode(), config.sessionMode(), registry, runner, dispatcher, metrics, clock);
  }

  VisualizationPort visualization() {
    if (config.fingerprintCommand().isEmpty() && config.plotCommand().isEmpty()) {
      return VisualizationPort.NONE;
    }
    return new CommandVisualizationAdapter(
        config.fingerprintCommand().map(CommandTemplate::parse),
        config.plotCommand().map(CommandTemplate::parse),
        commandRunner,
        writer,
        config.commandLogDir());
  }
}
