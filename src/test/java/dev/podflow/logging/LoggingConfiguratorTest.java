package dev.podflow.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private Level podflowLevel;
  private Level rootLevel;

  @BeforeEach
  void remember() {
    podflowLevel = context.getLogger(LoggingConfigurator.PODFLOW_LOGGER).getLevel();
    rootLevel = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
    context.getLogger(LoggingConfigurator.PODFLOW_LOGGER).setLevel(null);
  }

  @AfterEach
  void restore() {
    context.getLogger(LoggingConfigurator.PODFLOW_LOGGER).setLevel(podflowLevel);
  }

  @Test
  void raisesOnlyPodflowLoggers() {
    assertTrue(LoggingConfigurator.enableVerboseLogging());

    Logger stage = context.getLogger("dev.podflow.application.pipeline.WorkflowCoordinator");
    assertEquals(Level.DEBUG, stage.getEffectiveLevel());
    assertEquals(rootLevel, context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel());
    assertFalse(context.getLogger("io.opentelemetry.sdk").isDebugEnabled());
  }

  @Test
  void secondCallChangesNothing() {
    LoggingConfigurator.enableVerboseLogging();

    assertFalse(LoggingConfigurator.enableVerboseLogging());
  }
}
