package ca.gc.cra.fluxbatch.application.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.application.port.ComplianceUpdater;
import ca.gc.cra.fluxbatch.application.port.LevelHandler;
import ca.gc.cra.fluxbatch.application.port.LevelResultSink;
import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestLoader;
import ca.gc.cra.fluxbatch.testutil.ManifestFixtures;
import ca.gc.cra.fluxbatch.testutil.RecordingMetrics;
import ca.gc.cra.fluxbatch.testutil.RecordingSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParallelSiteDispatcherTest {
  @TempDir Path dir;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingSink sink = new RecordingSink();
  private final List<String> handled = new CopyOnWriteArrayList<>();

  @Test
  void sevenSitesNeverExceedFiveConcurrentWorkers() throws IOException {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Set<String> threads = ConcurrentHashMap.newKeySet();
    LevelHandler handler = (manifest, context) -> {
      int now = active.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      threads.add(Thread.currentThread().getName());
      try {
        Thread.sleep(150);
      } finally {
        active.decrementAndGet();
      }
      handled.add(context.site().orElseThrow());
      return LevelOutcome.success();
    };
    List<SiteManifest> sites = new ArrayList<>();
    for (int i = 1; i <= 7; i++) {
      sites.add(site("Site" + i, Map.of("1", "l1")));
    }

    dispatcher(registry(handler), ParallelSiteDispatcher.DEFAULT_POOL_SIZE)
        .dispatch(sites, SessionMode.BATCH, CancellationToken.create());

    assertEquals(7, handled.size());
    assertTrue(peak.get() <= 5, "peak concurrency was " + peak.get());
    assertTrue(threads.stream().allMatch(name -> name.startsWith("site-worker-")), threads.toString());
    assertEquals(7L, metrics.counter("batch.site.completed"));
  }

  @Test
  void failingSiteDoesNotPreventOthers() throws IOException {
    LevelHandler handler = (manifest, context) -> {
      String site = context.site().orElseThrow();
      if (site.equals("Bad")) {
        throw new IllegalStateException("site failure");
      }
      handled.add(site);
      return LevelOutcome.success();
    };
    List<SiteManifest> sites = List.of(
        site("Good1", Map.of("1", "l1")),
        site("Bad", Map.of("1", "l1")),
        site("Good2", Map.of("1", "l1")));

    dispatcher(registry(handler), 2).dispatch(sites, SessionMode.BATCH, CancellationToken.create());

    assertEquals(Set.of("Good1", "Good2"), Set.copyOf(handled));
    assertEquals(1L, metrics.counter("batch.unit.failed"));
    assertEquals(3L, metrics.counter("batch.site.completed"));
  }

  @Test
  void errorEscapingOneSiteDoesNotStopTheOthers() throws IOException {
    LevelHandler handler = (manifest, context) -> {
      handled.add(context.site().orElseThrow());
      return LevelOutcome.success();
    };
    LevelResultSink failingForBad = result -> {
      if (result.site().filter("Bad"::equals).isPresent()) {
        throw new AssertionError("sink rejected " + result.manifest());
      }
      sink.accept(result);
    };
    List<SiteManifest> sites = List.of(
        site("Good1", Map.of("1", "l1")),
        site("Bad", Map.of("1", "l1", "2", "l2")),
        site("Good2", Map.of("1", "l1")),
        site("Good3", Map.of("1", "l1")));

    dispatcher(registry(handler), 2, failingForBad)
        .dispatch(sites, SessionMode.BATCH, CancellationToken.create());

    assertEquals(List.of("Bad"), handled.stream().filter("Bad"::equals).toList());
    assertEquals(Set.of("Good1", "Good2", "Good3"), Set.copyOf(sink.results().stream()
        .map(result -> result.site().orElseThrow())
        .toList()));
    assertEquals((long) sites.size(), metrics.counter("batch.site.completed"));
    assertEquals(0L, metrics.counter("batch.site.skipped"));
  }

  @Test
  void siteEntriesRunInNumericOrderWithTheirDeclaredLevels() throws IOException {
    LevelHandler handler = (manifest, context) -> {
      handled.add(context.level().token() + ":" + manifest.name());
      return LevelOutcome.success();
    };
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("3", "l3");
    entries.put("1", "l1");
    entries.put("2", "l2");

    dispatcher(registry(handler), 1)
        .dispatch(List.of(site("SiteA", entries)), SessionMode.BATCH, CancellationToken.create());

    assertEquals(List.of("l1:SiteA_1.yml", "l2:SiteA_2.yml", "l3:SiteA_3.yml"), handled);
  }

  @Test
  void unrecognisedAndExportLevelsNeverReachHandlers() throws IOException {
    LevelHandler handler = (manifest, context) -> {
      handled.add(manifest.name());
      return LevelOutcome.success();
    };
    LevelRegistry registry = LevelRegistry.builder()
        .register(LevelId.L1, handler)
        .register(LevelId.FLUXNET, handler)
        .build();
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("1", "l9");
    entries.put("2", "fluxnet");
    entries.put("3", "l1");

    dispatcher(registry, 1).dispatch(List.of(site("SiteA", entries)), SessionMode.BATCH, CancellationToken.create());

    assertEquals(List.of("SiteA_3.yml"), handled);
    assertEquals(2L, metrics.counter("batch.level.unrecognized"));
  }

  @Test
  void missingAndLevellessEntriesAreSkipped() throws IOException {
    LevelHandler handler = (manifest, context) -> {
      handled.add(manifest.name());
      return LevelOutcome.success();
    };
    ManifestFixtures.write(dir, "nolevel.yml", "Files:\n  out_filename: x.nc\n");
    Map<String, Path> declared = new LinkedHashMap<>();
    declared.put("1", dir.resolve("absent.yml"));
    declared.put("2", dir.resolve("nolevel.yml"));
    declared.put("3", ManifestFixtures.writeManifest(dir, "ok.yml", "l1"));

    dispatcher(registry(handler), 1).dispatch(
        List.of(new SiteManifest("SiteA", ControlFileSet.of(declared))), SessionMode.BATCH, CancellationToken.create());

    assertEquals(List.of("ok.yml"), handled);
  }

  @Test
  void stopRequestedBeforeDispatchSkipsEverySite() throws IOException {
    CancellationToken token = CancellationToken.create();
    token.requestStop();
    LevelHandler handler = (manifest, context) -> {
      handled.add(manifest.name());
      return LevelOutcome.success();
    };

    dispatcher(registry(handler), 2).dispatch(
        List.of(site("A", Map.of("1", "l1")), site("B", Map.of("1", "l1"))), SessionMode.BATCH, token);

    assertTrue(handled.isEmpty());
    assertEquals(2L, metrics.counter("batch.site.skipped"));
    assertEquals(0L, metrics.counter("batch.site.completed"));
  }

  @Test
  void emptySiteListReturnsImmediately() {
    dispatcher(registry((manifest, context) -> LevelOutcome.success()), 3)
        .dispatch(List.of(), SessionMode.BATCH, CancellationToken.create());

    assertEquals(0L, metrics.counter("batch.site.completed"));
  }

  @Test
  void poolSizeMustBePositive() {
    LevelRegistry registry = registry((manifest, context) -> LevelOutcome.success());
    assertThrows(IllegalArgumentException.class, () -> dispatcher(registry, 0));
  }

  private ParallelSiteDispatcher dispatcher(LevelRegistry registry, int poolSize) {
    return dispatcher(registry, poolSize, sink);
  }

  private ParallelSiteDispatcher dispatcher(LevelRegistry registry, int poolSize, LevelResultSink resultSink) {
    YamlManifestLoader loader = new YamlManifestLoader();
    SequentialLevelRunner runner = new SequentialLevelRunner(
        loader, ComplianceUpdater.ACCEPT_ALL, VisualizationPort.NONE, resultSink, metrics, System::currentTimeMillis);
    return new ParallelSiteDispatcher(registry, runner, loader, metrics, poolSize);
  }

  private static LevelRegistry registry(LevelHandler handler) {
    LevelRegistry.Builder builder = LevelRegistry.builder();
    for (LevelId level : LevelId.values()) {
      builder.register(level, handler);
    }
    return builder.build();
  }

  private SiteManifest site(String name, Map<String, String> levelsByKey) throws IOException {
    Path siteDir = Files.createDirectories(dir.resolve(name));
    Map<String, Path> declared = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : levelsByKey.entrySet()) {
      declared.put(entry.getKey(),
          ManifestFixtures.writeManifest(siteDir, name + "_" + entry.getKey() + ".yml", entry.getValue()));
    }
    return new SiteManifest(name, ControlFileSet.of(declared));
  }
}
