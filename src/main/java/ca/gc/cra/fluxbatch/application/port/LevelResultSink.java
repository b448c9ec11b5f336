package ca.gc.cra.fluxbatch.application.port;

import ca.gc.cra.fluxbatch.domain.batch.LevelResult;

/**
 * Receives every per-manifest result produced by the runner.
 *
 * <p>Implementations are called from site worker threads concurrently and must be thread-safe. They must not throw.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LevelResultSink {
  void accept(LevelResult result);

  /** Sink that drops results. */
  LevelResultSink NONE = result -> {};
}
