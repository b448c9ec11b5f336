package ca.gc.cra.fluxbatch.application.batch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.application.port.ComplianceUpdater;
import ca.gc.cra.fluxbatch.application.port.LevelHandler;
import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.LevelOutcome;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionState;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.infrastructure.manifest.YamlManifestLoader;
import ca.gc.cra.fluxbatch.testutil.ManifestFixtures;
import ca.gc.cra.fluxbatch.testutil.RecordingMetrics;
import ca.gc.cra.fluxbatch.testutil.RecordingSink;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class BatchSessionTest {
  private static final long FIXED_MILLIS = Instant.parse("2024-03-05T14:07:00Z").toEpochMilli();

  @TempDir Path dir;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final RecordingSink sink = new RecordingSink();
  private final List<String> handled = new CopyOnWriteArrayList<>();

  @Test
  void levelsRunInDeclaredOrderAndUnknownTokensAreSkipped() throws IOException {
    BatchPlan plan = new BatchPlan(
        List.of("l2", "l9", "l1"),
        Map.of("l1", files("l1", "a", "b"), "l2", files("l2", "c"), "l9", files("l9", "d")),
        List.of());
    BatchSession session = session(plan, RunMode.LEVELS, registry(recording(), LevelId.L1, LevelId.L2));

    session.run();

    assertEquals(List.of("l2:c.yml", "l1:a.yml", "l1:b.yml"), handled);
    assertEquals(1L, metrics.counter("batch.level.unrecognized"));
    assertEquals(SessionState.COMPLETED, session.state());
  }

  @Test
  void levelWithoutHandlerIsReportedAsUnrecognised() throws IOException {
    BatchPlan plan = new BatchPlan(
        List.of("l6", "l1"), Map.of("l1", files("l1", "a"), "l6", files("l6", "z")), List.of());

    session(plan, RunMode.LEVELS, registry(recording(), LevelId.L1)).run();

    assertEquals(List.of("l1:a.yml"), handled);
    assertEquals(1L, metrics.counter("batch.level.unrecognized"));
  }

  @Test
  void declaredLevelWithoutControlFilesIsANoOp() throws IOException {
    BatchPlan plan = new BatchPlan(List.of("l3", "l1"), Map.of("l1", files("l1", "a")), List.of());

    session(plan, RunMode.LEVELS, registry(recording(), LevelId.L1, LevelId.L3)).run();

    assertEquals(List.of("l1:a.yml"), handled);
  }

  @Test
  void stopDuringRunHaltsRemainingManifestsAndLevels() throws Exception {
    BatchPlan plan = new BatchPlan(
        List.of("l1", "l2"), Map.of("l1", files("l1", "a", "b"), "l2", files("l2", "c")), List.of());
    List<BatchSession> holder = new ArrayList<>();
    LevelHandler handler = (manifest, context) -> {
      handled.add(manifest.name());
      holder.get(0).requestStop();
      return LevelOutcome.success();
    };
    BatchSession session = session(plan, RunMode.LEVELS, registry(handler, LevelId.L1, LevelId.L2));
    holder.add(session);

    session.run();

    assertEquals(List.of("a.yml"), handled);
    assertEquals(SessionState.STOPPED, session.state());
    assertTrue(session.isStopRequested());
    assertTrue(session.awaitCompletion(Duration.ofSeconds(1)));
  }

  @Test
  void stopBeforeRunProcessesNothing() throws IOException {
    BatchPlan plan = new BatchPlan(List.of("l1"), Map.of("l1", files("l1", "a")), List.of());
    BatchSession session = session(plan, RunMode.LEVELS, registry(recording(), LevelId.L1));

    session.requestStop();
    session.requestStop();
    assertEquals(SessionState.STOP_REQUESTED, session.state());
    session.run();

    assertTrue(handled.isEmpty());
    assertEquals(SessionState.STOPPED, session.state());
  }

  @Test
  void sessionRunsOnlyOnce() throws IOException {
    BatchPlan plan = new BatchPlan(List.of("l1"), Map.of("l1", files("l1", "a")), List.of());
    BatchSession session = session(plan, RunMode.LEVELS, registry(recording(), LevelId.L1));

    session.run();

    assertThrows(IllegalStateException.class, session::run);
    assertEquals(1, handled.size());
  }

  @Test
  void stopFromAnotherThreadIsObservedBetweenManifests() throws Exception {
    CountDownLatch firstStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    LevelHandler handler = (manifest, context) -> {
      handled.add(manifest.name());
      firstStarted.countDown();
      release.await(5, TimeUnit.SECONDS);
      return LevelOutcome.success();
    };
    BatchPlan plan = new BatchPlan(List.of("l1"), Map.of("l1", files("l1", "a", "b", "c")), List.of());
    BatchSession session = session(plan, RunMode.LEVELS, registry(handler, LevelId.L1));
    Thread worker = new Thread(session::run, "session-runner");
    worker.start();

    assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
    session.requestStop();
    release.countDown();

    assertTrue(session.awaitCompletion(Duration.ofSeconds(5)));
    worker.join(5_000);
    assertEquals(List.of("a.yml"), handled);
    assertEquals(SessionState.STOPPED, session.state());
  }

  @Test
  void sitesModeDelegatesToDispatcher() throws IOException {
    List<SiteManifest> sites = List.of(
        new SiteManifest("SiteA", files("l1", "sa")),
        new SiteManifest("SiteB", files("l1", "sb")));
    BatchPlan plan = new BatchPlan(List.of(), Map.of(), sites);

    session(plan, RunMode.SITES, registry(recording(), LevelId.L1)).run();

    assertEquals(List.of("l1:sa.yml", "l1:sb.yml"), handled.stream().sorted().collect(Collectors.toList()));
    assertEquals(2L, metrics.counter("batch.site.completed"));
  }

  @Test
  void startAndFinishAreLoggedWithMinuteStamps() throws IOException {
    Logger logger = (Logger) LoggerFactory.getLogger(BatchSession.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender.start();
    logger.addAppender(appender);
    try {
      session(new BatchPlan(List.of(), Map.of(), List.of()), RunMode.LEVELS, registry(recording())).run();
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    String stamp = DateTimeFormatter.ofPattern("yyyyMMddHHmm")
        .format(Instant.ofEpochMilli(FIXED_MILLIS).atZone(ZoneId.systemDefault()));
    List<String> messages = appender.list.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .collect(Collectors.toList());
    assertTrue(messages.contains("Started batch processing at " + stamp), messages.toString());
    assertTrue(messages.contains("Finished batch processing at " + stamp), messages.toString());
  }

  @Test
  void awaitCompletionReturnsImmediatelyWhenNeverStarted() throws Exception {
    BatchSession session =
        session(new BatchPlan(List.of(), Map.of(), List.of()), RunMode.LEVELS, registry(recording()));

    assertTrue(session.awaitCompletion(Duration.ofMillis(10)));
    assertEquals(SessionState.IDLE, session.state());
  }

  private BatchSession session(BatchPlan plan, RunMode mode, LevelRegistry registry) {
    YamlManifestLoader loader = new YamlManifestLoader();
    SequentialLevelRunner runner = new SequentialLevelRunner(
        loader, ComplianceUpdater.ACCEPT_ALL, VisualizationPort.NONE, sink, metrics, () -> FIXED_MILLIS);
    ParallelSiteDispatcher dispatcher = new ParallelSiteDispatcher(registry, runner, loader, metrics, 2);
    return new BatchSession(plan, mode, SessionMode.BATCH, registry, runner, dispatcher, metrics, () -> FIXED_MILLIS);
  }

  private LevelHandler recording() {
    return (manifest, context) -> {
      handled.add(context.level().token() + ":" + manifest.name());
      return LevelOutcome.success();
    };
  }

  private static LevelRegistry registry(LevelHandler handler, LevelId... levels) {
    LevelRegistry.Builder builder = LevelRegistry.builder();
    for (LevelId level : levels) {
      builder.register(level, handler);
    }
    return builder.build();
  }

  private ControlFileSet files(String level, String... names) throws IOException {
    Map<String, Path> declared = new LinkedHashMap<>();
    int ordinal = 1;
    for (String name : names) {
      declared.put(Integer.toString(ordinal++), ManifestFixtures.writeManifest(dir, name + ".yml", level));
    }
    return ControlFileSet.of(declared);
  }
}
