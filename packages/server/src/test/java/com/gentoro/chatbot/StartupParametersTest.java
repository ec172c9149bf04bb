package com.gentoro.chatbot;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("interactive", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertEquals(Optional.empty(), params.message());
  }

  @Test
  void parsesOnceModeWithMessage() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config-file", "/etc/bot.yaml", "--mode", "once", "--message", "hi"});

    assertEquals("once", params.mode());
    assertEquals("/etc/bot.yaml", params.configFile());
    assertEquals(Optional.of("hi"), params.message());
  }

  @Test
  void rejectsInvalidCombinations() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "server"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "once"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "once", "--message", "  "}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file", "--mode", "help"}));
  }

  @Test
  void usageListsModes() {
    assertTrue(StartupParameters.usage().contains("interactive|once|help"));
  }
}
