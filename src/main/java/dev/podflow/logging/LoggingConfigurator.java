package dev.podflow.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches podflow's own loggers to DEBUG when {@code --verbose} is given.
 * <p>Only the {@code dev.podflow} hierarchy is raised; OpenTelemetry and other libraries stay at the levels from
 * {@code logback.xml} so stage and platform output remains readable.</p>
 *
 * @implNote Requires Logback; under another SLF4J binding the request is logged and ignored.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy raised by {@link #enableVerboseLogging()}. */
  public static final String PODFLOW_LOGGER = "dev.podflow";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises {@code dev.podflow} to DEBUG. Calling it again is harmless.
   *
   * @return {@code true} if a level changed, {@code false} if already verbose or the backend is not Logback
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    Logger podflow = context.getLogger(PODFLOW_LOGGER);
    if (Level.DEBUG.equals(podflow.getLevel())) {
      return false;
    }
    podflow.setLevel(Level.DEBUG);
    log.debug("Verbose logging enabled for {}", PODFLOW_LOGGER);
    return true;
  }
}
