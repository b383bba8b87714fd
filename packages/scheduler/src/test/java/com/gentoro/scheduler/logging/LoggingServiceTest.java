package com.gentoro.scheduler.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesConfiguredLevels() {
    BaseConfiguration configuration = new BaseConfiguration();
    configuration.setProperty("logging.level.com.gentoro.scheduler.sample", "WARN");
    configuration.setProperty("logging.level.com.gentoro.scheduler.other", " ERROR ");

    LoggingService.applyConfiguration(configuration);

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    assertEquals(Level.WARN, context.getLogger("com.gentoro.scheduler.sample").getLevel());
    assertEquals(Level.ERROR, context.getLogger("com.gentoro.scheduler.other").getLevel());
  }

  @Test
  void ignoresMissingConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
    assertNotNull(LoggingService.getLogger(LoggingServiceTest.class));
  }
}
