package com.gentoro.lightdocs.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  @DisplayName("levels under logging.level are applied to logback loggers")
  void appliesLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.com.gentoro.lightdocs.sample", "TRACE");
    cfg.setProperty("logging.level.com.gentoro.lightdocs.other", "LOUD");

    LoggingService.applyConfiguration(cfg);

    Logger sample = (Logger) LoggerFactory.getLogger("com.gentoro.lightdocs.sample");
    assertEquals(Level.TRACE, sample.getLevel());
    Logger other = (Logger) LoggerFactory.getLogger("com.gentoro.lightdocs.other");
    assertNull(other.getLevel());
  }

  @Test
  @DisplayName("a null configuration is ignored")
  void nullConfiguration() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
