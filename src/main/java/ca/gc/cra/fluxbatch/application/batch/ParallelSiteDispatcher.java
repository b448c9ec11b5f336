package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.application.port.ManifestLoader;
import ca.gc.cra.fluxbatch.application.port.MetricsPort;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileEntry;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.Manifest;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fans per-site pipelines out across a fixed-size worker pool.
 * <p><strong>Why:</strong> Sites are independent, so they run concurrently while the number of simultaneous handler
 * processes stays bounded regardless of how many sites the control file lists.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Submit one task per site; extra sites queue until a worker frees up.</li>
 *   <li>Skip sites that have not started when a stop is requested; let started sites finish.</li>
 *   <li>Resolve each site entry's declared level and run it through the {@link SequentialLevelRunner}.</li>
 *   <li>Contain every site failure at the worker boundary and wait for all sites before returning.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #dispatch} creates a fresh pool per call; concurrent calls do not share
 * workers.</p>
 * <p><strong>Observability:</strong> Worker threads are named {@code site-worker-N} and tag logs with MDC
 * {@code site}; counters {@code batch.site.completed}, {@code batch.site.skipped}, {@code batch.level.unrecognized}.</p>
 *
 * @since 0.1.0
 */
public final class ParallelSiteDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ParallelSiteDispatcher.class);

  /** Worker count used when none is configured. */
  public static final int DEFAULT_POOL_SIZE = 5;

  private static final String THREAD_PREFIX = "site-worker";
  private static final long AWAIT_SLICE_SECONDS = 30L;

  private final LevelRegistry registry;
  private final SequentialLevelRunner runner;
  private final ManifestLoader loader;
  private final MetricsPort metrics;
  private final int poolSize;

  /**
   * Creates a dispatcher.
   *
   * @param registry level dispatch table
   * @param runner runner shared by all workers
   * @param loader reads site entries to find their declared level
   * @param metrics site counters
   * @param poolSize worker count; must be positive
   */
  public ParallelSiteDispatcher(
      LevelRegistry registry,
      SequentialLevelRunner runner,
      ManifestLoader loader,
      MetricsPort metrics,
      int poolSize) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (poolSize <= 0) {
      throw new IllegalArgumentException("poolSize must be positive");
    }
    this.poolSize = poolSize;
  }

  public int poolSize() {
    return poolSize;
  }

  /**
   * Runs every site and blocks until all of them have finished or been skipped.
   *
   * <p>Site failures are logged and never rethrown. If the calling thread is interrupted while waiting, the interrupt
   * flag is restored and the method returns; workers already running keep going.</p>
   *
   * @param sites per-site manifest lists
   * @param mode session mode forwarded to handlers
   * @param token session token checked when each site starts
   */
  public void dispatch(List<SiteManifest> sites, SessionMode mode, CancellationToken token) {
    Objects.requireNonNull(sites, "sites");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(token, "token");
    if (sites.isEmpty()) {
      log.warn("No sites to process");
      return;
    }
    log.info("Dispatching {} sites on {} workers", sites.size(), poolSize);
    ExecutorService executor = ExecutorFactories.newSitePool(poolSize, THREAD_PREFIX, this::handleWorkerCrash);
    try {
      for (SiteManifest site : sites) {
        executor.execute(() -> runSite(site, mode, token));
      }
    } finally {
      executor.shutdown();
    }
    awaitSites(executor);
  }

  private void awaitSites(ExecutorService executor) {
    try {
      while (!executor.awaitTermination(AWAIT_SLICE_SECONDS, TimeUnit.SECONDS)) {
        log.debug("Waiting for site workers to finish");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for site workers; running sites will finish in the background");
    }
  }

  private void runSite(SiteManifest site, SessionMode mode, CancellationToken token) {
    if (token.isStopRequested()) {
      log.info("Stop requested; skipping site {}", site.site());
      metrics.increment("batch.site.skipped");
      return;
    }
    String previousSite = MDC.get("site");
    MDC.put("site", site.site());
    try {
      log.info("Starting site {}", site.site());
      RunScope scope = RunScope.site(mode, site.site());
      for (ControlFileEntry entry : site.inOrder()) {
        resolve(site, entry).ifPresent(level ->
            runner.run(level, ControlFileSet.single(entry.key(), entry.locator()), scope));
      }
      log.info("Finished site {}", site.site());
    } catch (RuntimeException | AssertionError | LinkageError ex) {
      log.error("Error occurred while processing site {}", site.site(), ex);
    } finally {
      metrics.increment("batch.site.completed");
      if (previousSite == null) {
        MDC.remove("site");
      } else {
        MDC.put("site", previousSite);
      }
    }
  }

  private Optional<RegisteredLevel> resolve(SiteManifest site, ControlFileEntry entry) {
    if (!Files.isRegularFile(entry.locator())) {
      log.error("Control file {} not found", entry.locator());
      return Optional.empty();
    }
    Manifest manifest;
    try {
      manifest = loader.load(entry.locator());
    } catch (IOException | RuntimeException ex) {
      log.error("Unable to read control file {} for site {}", entry.locator(), site.site(), ex);
      return Optional.empty();
    }
    Optional<String> token = manifest.declaredLevel();
    if (token.isEmpty()) {
      log.error("Control file {} for site {} does not declare a level", entry.fileName(), site.site());
      return Optional.empty();
    }
    Optional<RegisteredLevel> level = LevelId.fromToken(token.get())
        .filter(LevelId::siteDispatchable)
        .flatMap(registry::lookup);
    if (level.isEmpty()) {
      log.error("Unrecognised batch processing level {} in {}", token.get(), entry.fileName());
      metrics.increment("batch.level.unrecognized");
    }
    return level;
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    log.error("Site worker {} terminated unexpectedly", thread.getName(), throwable);
  }
}
