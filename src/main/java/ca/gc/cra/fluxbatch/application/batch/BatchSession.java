package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.application.port.ClockPort;
import ca.gc.cra.fluxbatch.application.port.MetricsPort;
import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionState;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One batch invocation: the plan, its run mode, and the cancellation token.
 * <p><strong>Why:</strong> Gives the command line (and its shutdown hook) a single object to start, stop, and wait
 * on.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>In {@link RunMode#LEVELS}, run each declared level through the {@link SequentialLevelRunner}, checking the
 *   token before every level and skipping unrecognised ones.</li>
 *   <li>In {@link RunMode#SITES}, hand the site lists to the {@link ParallelSiteDispatcher}.</li>
 *   <li>Track the lifecycle in {@link SessionState}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} is called once by one thread; {@link #requestStop()},
 * {@link #state()} and {@link #awaitCompletion(Duration)} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class BatchSession {
  private static final Logger log = LoggerFactory.getLogger(BatchSession.class);
  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

  private final BatchPlan plan;
  private final RunMode runMode;
  private final SessionMode sessionMode;
  private final LevelRegistry registry;
  private final SequentialLevelRunner runner;
  private final ParallelSiteDispatcher dispatcher;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final CancellationToken token = CancellationToken.create();
  private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
  private final AtomicBoolean started = new AtomicBoolean();
  private final CountDownLatch finished = new CountDownLatch(1);

  /**
   * Creates a session.
   *
   * @param plan parsed batch control file
   * @param runMode levels or sites
   * @param sessionMode interactive or batch, forwarded to handlers
   * @param registry level dispatch table
   * @param runner sequential runner for levels mode
   * @param dispatcher site dispatcher for sites mode
   * @param metrics unrecognised-level counter
   * @param clock source of the start and finish stamps
   */
  public BatchSession(
      BatchPlan plan,
      RunMode runMode,
      SessionMode sessionMode,
      LevelRegistry registry,
      SequentialLevelRunner runner,
      ParallelSiteDispatcher dispatcher,
      MetricsPort metrics,
      ClockPort clock) {
    this.plan = Objects.requireNonNull(plan, "plan");
    this.runMode = Objects.requireNonNull(runMode, "runMode");
    this.sessionMode = Objects.requireNonNull(sessionMode, "sessionMode");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.runner = Objects.requireNonNull(runner, "runner");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes the plan. Returns normally however many units fail.
   *
   * @throws IllegalStateException if the session has already been run
   */
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Batch session already started");
    }
    state.compareAndSet(SessionState.IDLE, SessionState.RUNNING);
    log.info("Started batch processing at {}", stamp());
    try {
      if (runMode == RunMode.LEVELS) {
        runLevels();
      } else {
        dispatcher.dispatch(plan.sites(), sessionMode, token);
      }
    } finally {
      SessionState terminal = token.isStopRequested() ? SessionState.STOPPED : SessionState.COMPLETED;
      state.set(terminal);
      log.info("Finished batch processing at {}", stamp());
      finished.countDown();
    }
  }

  /**
   * Requests a cooperative stop. Idempotent and callable from any thread; units already running finish first.
   */
  public void requestStop() {
    if (token.requestStop()) {
      log.info("Stop requested; batch processing will halt at the next control file");
    }
    state.getAndUpdate(current ->
        current == SessionState.IDLE || current == SessionState.RUNNING ? SessionState.STOP_REQUESTED : current);
  }

  /**
   * Waits for {@link #run()} to return.
   *
   * @param timeout maximum wait
   * @return {@code true} if the run finished (or never started) within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    if (!started.get()) {
      return true;
    }
    return finished.await(Objects.requireNonNull(timeout, "timeout").toMillis(), TimeUnit.MILLISECONDS);
  }

  public SessionState state() {
    return state.get();
  }

  public boolean isStopRequested() {
    return token.isStopRequested();
  }

  public RunMode runMode() {
    return runMode;
  }

  public SessionMode sessionMode() {
    return sessionMode;
  }

  private void runLevels() {
    if (plan.levelTokens().isEmpty()) {
      log.warn("No levels declared for batch processing");
      return;
    }
    RunScope scope = RunScope.levels(sessionMode, token);
    for (String levelToken : plan.levelTokens()) {
      if (token.isStopRequested() || Thread.currentThread().isInterrupted()) {
        log.info("Batch processing stopped before level {}", levelToken);
        token.requestStop();
        return;
      }
      Optional<RegisteredLevel> level = registry.lookup(levelToken);
      if (level.isEmpty()) {
        log.warn("Unrecognised batch processing level {}", levelToken);
        metrics.increment("batch.level.unrecognized");
        continue;
      }
      Optional<ControlFileSet> controlFiles = plan.controlFilesFor(levelToken);
      if (controlFiles.isEmpty()) {
        log.warn("No control files declared for level {}", levelToken);
        continue;
      }
      runner.run(level.get(), controlFiles.get(), scope);
    }
  }

  private String stamp() {
    return STAMP.format(Instant.ofEpochMilli(clock.nowMillis()).atZone(ZoneId.systemDefault()));
  }
}
