package ca.gc.cra.fluxbatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts fluxbatch logging at runtime from CLI flags.
 * <p><strong>Role:</strong> Called once during CLI bootstrap before the batch session starts.</p>
 * <p><strong>Thread-safety:</strong> Delegates to Logback, which synchronizes level changes.</p>
 *
 * @implNote Logback only; other SLF4J bindings keep their configured level and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises the root logger to DEBUG.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level.
   *
   * @param level new level
   * @return {@code true} if the backend accepted the change
   */
  public static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("Cannot change log level: backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    if (!level.equals(root.getLevel())) {
      root.setLevel(level);
    }
    return true;
  }
}
