package com.gentoro.chatbot.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  @Test
  void appliesLevelsFromConfiguration() {
    LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
    Logger target = ctx.getLogger("com.gentoro.chatbot.logging.sample");
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("logging.level.com.gentoro.chatbot.logging.sample", "TRACE");
    cfg.setProperty("logging.level.com.gentoro.chatbot.logging.other", "NOT_A_LEVEL");

    LoggingService.applyConfiguration(cfg);

    assertEquals(Level.TRACE, target.getLevel());
    assertNull(ctx.getLogger("com.gentoro.chatbot.logging.other").getLevel());
  }

  @Test
  void nullConfigurationIsIgnored() {
    assertDoesNotThrow(() -> LoggingService.applyConfiguration(null));
  }
}
