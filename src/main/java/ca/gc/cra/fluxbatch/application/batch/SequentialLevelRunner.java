package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.application.port.ClockPort;
import ca.gc.cra.fluxbatch.application.port.ComplianceUpdater;
import ca.gc.cra.fluxbatch.application.port.LevelContext;
import ca.gc.cra.fluxbatch.application.port.LevelResultSink;
import ca.gc.cra.fluxbatch.application.port.ManifestLoader;
import ca.gc.cra.fluxbatch.application.port.MetricsPort;
import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileEntry;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.LevelResult;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one level's handler over every manifest of a control file set.
 * <p><strong>Why:</strong> A batch must survive bad units: a missing file, an invalid manifest, or a handler failure
 * is logged and recorded for that manifest while the loop moves on to the next one.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Order manifests by the level's iteration policy.</li>
 *   <li>Poll the cancellation token (and the thread's interrupt flag) before each manifest.</li>
 *   <li>Inject the batch options, call the handler, then run the level's post-success side effect.</li>
 *   <li>Publish one {@link LevelResult} per visited manifest to the sink and metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; the site dispatcher shares one instance across workers.
 * Each call blocks its thread until the last manifest finishes.</p>
 * <p><strong>Observability:</strong> MDC keys {@code level}, {@code manifest} and {@code site}; counters
 * {@code batch.unit.*} and histogram {@code batch.unit.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class SequentialLevelRunner {
  private static final Logger log = LoggerFactory.getLogger(SequentialLevelRunner.class);

  static final String CALL_MODE = "call_mode";
  static final String SHOW_PLOTS = "show_plots";

  private final ManifestLoader loader;
  private final ComplianceUpdater compliance;
  private final VisualizationPort visualization;
  private final LevelResultSink sink;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a runner.
   *
   * @param loader reads manifests
   * @param compliance normalizes manifests and rejects unusable ones
   * @param visualization post-success plotting steps
   * @param sink receives per-manifest results
   * @param metrics unit counters and latency
   * @param clock time source for latency
   */
  public SequentialLevelRunner(
      ManifestLoader loader,
      ComplianceUpdater compliance,
      VisualizationPort visualization,
      LevelResultSink sink,
      MetricsPort metrics,
      ClockPort clock) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.compliance = Objects.requireNonNull(compliance, "compliance");
    this.visualization = Objects.requireNonNull(visualization, "visualization");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Processes the control files for one level. Never throws for per-manifest failures, including assertion and
   * linkage errors raised by a handler or side effect; other {@link Error}s such as {@link VirtualMachineError}
   * propagate.
   *
   * @param level registered level to run
   * @param controlFiles manifests queued for the level
   * @param scope session mode, site, and cancellation token
   */
  public void run(RegisteredLevel level, ControlFileSet controlFiles, RunScope scope) {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(controlFiles, "controlFiles");
    Objects.requireNonNull(scope, "scope");
    LevelId id = level.id();
    for (ControlFileEntry entry : controlFiles.inOrder(id.iterationOrder())) {
      if (stopRequested(scope)) {
        log.info("Stop requested; {} halted before {}", id.label(), entry.fileName());
        return;
      }
      Map<String, String> previous = pushContext(id, entry, scope);
      try {
        runOne(level, entry, scope);
      } finally {
        restoreContext(previous);
      }
    }
  }

  private void runOne(RegisteredLevel level, ControlFileEntry entry, RunScope scope) {
    LevelId id = level.id();
    String file = entry.fileName();
    long start = clock.nowMillis();
    if (!Files.isRegularFile(entry.locator())) {
      log.error("Control file {} not found", entry.locator());
      publish(id, scope, file, LevelResult.Status.SKIPPED_MISSING, "control file not found", start);
      return;
    }
    log.info("Starting {} with {}", id.label(), file);
    try {
      Manifest manifest = loader.load(entry.locator());
      if (!compliance.update(id, manifest)) {
        log.warn("Skipping {} with {}: control file failed compliance checks", id.label(), file);
        publish(id, scope, file, LevelResult.Status.SKIPPED_INVALID, "compliance check failed", start);
        return;
      }
      injectBatchOptions(manifest);
      LevelOutcome outcome = level.handler().handle(manifest, new LevelContext(id, scope.mode(), scope.site()));
      if (!outcome.isSuccess()) {
        log.error("Error occurred during {} with {} (status {})", id.label(), file, outcome.statusCode());
        publish(id, scope, file, LevelResult.Status.FAILED, "status " + outcome.statusCode(), start);
        return;
      }
      runSideEffect(id, manifest, outcome);
      log.info("Finished {} with {}", id.label(), file);
      publish(id, scope, file, LevelResult.Status.SUCCEEDED, "", start);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Error occurred during {} with {}", id.label(), file, ex);
      publish(id, scope, file, LevelResult.Status.FAILED, "interrupted", start);
    } catch (Exception | AssertionError | LinkageError ex) {
      log.error("Error occurred during {} with {}", id.label(), file, ex);
      publish(id, scope, file, LevelResult.Status.FAILED, String.valueOf(ex.getMessage()), start);
    }
  }

  private void runSideEffect(LevelId id, Manifest manifest, LevelOutcome outcome) throws Exception {
    switch (id.sideEffect()) {
      case FINGERPRINT -> visualization.fingerprint(manifest);
      case MANIFEST_PLOTS -> visualization.manifestPlots(manifest, outcome);
      case NONE -> { }
      default -> throw new IllegalStateException("Unhandled side effect " + id.sideEffect());
    }
  }

  private void publish(
      LevelId id, RunScope scope, String file, LevelResult.Status status, String message, long start) {
    long elapsed = Math.max(0L, clock.nowMillis() - start);
    metrics.increment(counterFor(status));
    metrics.observe("batch.unit.latencyMillis", elapsed);
    try {
      sink.accept(new LevelResult(id, scope.site(), file, status, message, elapsed));
    } catch (RuntimeException ex) {
      log.warn("Result sink rejected {} result for {}", status, file, ex);
    }
  }

  static void injectBatchOptions(Manifest manifest) {
    manifest.put(Manifest.OPTIONS, CALL_MODE, "batch");
    manifest.put(Manifest.OPTIONS, SHOW_PLOTS, "No");
  }

  private static boolean stopRequested(RunScope scope) {
    return scope.token().isStopRequested() || Thread.currentThread().isInterrupted();
  }

  private static String counterFor(LevelResult.Status status) {
    return switch (status) {
      case SUCCEEDED -> "batch.unit.succeeded";
      case FAILED -> "batch.unit.failed";
      case SKIPPED_MISSING -> "batch.unit.skipped.missing";
      case SKIPPED_INVALID -> "batch.unit.skipped.invalid";
    };
  }

  private static Map<String, String> pushContext(LevelId id, ControlFileEntry entry, RunScope scope) {
    Map<String, String> previous = new HashMap<>();
    previous.put("level", MDC.get("level"));
    previous.put("manifest", MDC.get("manifest"));
    previous.put("site", MDC.get("site"));
    MDC.put("level", id.token());
    MDC.put("manifest", entry.fileName());
    scope.site().ifPresent(site -> MDC.put("site", site));
    return previous;
  }

  private static void restoreContext(Map<String, String> previous) {
    for (Map.Entry<String, String> entry : previous.entrySet()) {
      if (entry.getValue() == null) {
        MDC.remove(entry.getKey());
      } else {
        MDC.put(entry.getKey(), entry.getValue());
      }
    }
  }
}
