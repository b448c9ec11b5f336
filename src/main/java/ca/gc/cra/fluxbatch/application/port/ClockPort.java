package ca.gc.cra.fluxbatch.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the batch session and runner.
 * <p><strong>Why:</strong> Lets tests pin the "Started batch processing at" stamp and unit latencies.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; site workers read the clock
 * concurrently.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
