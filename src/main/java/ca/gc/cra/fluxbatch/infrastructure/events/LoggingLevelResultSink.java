package ca.gc.cra.fluxbatch.infrastructure.events;

import ca.gc.cra.fluxbatch.application.port.LevelResultSink;
import ca.gc.cra.fluxbatch.domain.batch.LevelResult;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes per-manifest results to the log and tallies them for an end-of-run summary line.
 *
 * <p>Thread-safe; site workers publish concurrently.</p>
 *
 * @since 0.1.0
 */
public final class LoggingLevelResultSink implements LevelResultSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingLevelResultSink.class);

  private final Map<LevelResult.Status, LongAdder> tallies = new EnumMap<>(LevelResult.Status.class);

  public LoggingLevelResultSink() {
    for (LevelResult.Status status : LevelResult.Status.values()) {
      tallies.put(status, new LongAdder());
    }
  }

  @Override
  public void accept(LevelResult result) {
    Objects.requireNonNull(result, "result");
    tallies.get(result.status()).increment();

    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("level=" + result.level().token());
    result.site().ifPresent(site -> joiner.add("site=" + site));
    joiner.add("manifest=" + result.manifest());
    joiner.add("status=" + result.status());
    joiner.add("elapsedMs=" + result.elapsedMillis());
    if (!result.message().isEmpty()) {
      joiner.add("detail=" + result.message());
    }
    if (result.status() == LevelResult.Status.SUCCEEDED) {
      log.debug("Unit result {}", joiner);
    } else {
      log.info("Unit result {}", joiner);
    }
  }

  /**
   * Returns how many results with the given status have been seen.
   *
   * @param status result status
   * @return running count
   */
  public long count(LevelResult.Status status) {
    return tallies.get(Objects.requireNonNull(status, "status")).sum();
  }

  /**
   * Logs one summary line with the running counts.
   */
  public void logSummary() {
    log.info(
        "Batch summary: succeeded={}, failed={}, skippedMissing={}, skippedInvalid={}",
        count(LevelResult.Status.SUCCEEDED),
        count(LevelResult.Status.FAILED),
        count(LevelResult.Status.SKIPPED_MISSING),
        count(LevelResult.Status.SKIPPED_INVALID));
  }
}
