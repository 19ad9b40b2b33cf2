package ca.gc.cra.guardian.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime log level control for the GUARDIAN command line.
 * <p><strong>Why:</strong> {@code --verbose} must expose each stage's decisions without editing
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Only Logback supports the change; other SLF4J bindings log a warning and keep their defaults.
 * @since 1.0.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String GUARDIAN_LOGGER = "ca.gc.cra.guardian";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger and the {@code ca.gc.cra.guardian} logger to DEBUG.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
      Logger guardian = context.getLogger(GUARDIAN_LOGGER);
      if (guardian.getLevel() != null) {
        guardian.setLevel(Level.DEBUG);
      }
      log.debug("Verbose logging enabled");
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
