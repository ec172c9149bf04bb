package com.gentoro.chatbot.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.chatbot.exception.ConfigException;
import com.gentoro.chatbot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.chatbot.prompt.impl.FileSystemPromptRepository;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PromptRepositoryFactoryTest {
  @TempDir Path dir;

  @Test
  void defaultsToClasspathPrompts() {
    assertInstanceOf(
        ClasspathPromptRepository.class, PromptRepositoryFactory.create(new BaseConfiguration()));
  }

  @Test
  void filesystemLocationsAreSupported() {
    BaseConfiguration plain = new BaseConfiguration();
    plain.setProperty("location", dir.toString());
    BaseConfiguration uri = new BaseConfiguration();
    uri.setProperty("location", dir.toUri().toString());

    assertInstanceOf(FileSystemPromptRepository.class, PromptRepositoryFactory.create(plain));
    assertInstanceOf(FileSystemPromptRepository.class, PromptRepositoryFactory.create(uri));
  }

  @Test
  void invalidLocationsAreConfigErrors() throws IOException {
    BaseConfiguration missing = new BaseConfiguration();
    missing.setProperty("location", dir.resolve("absent").toString());
    BaseConfiguration file = new BaseConfiguration();
    file.setProperty("location", Files.createFile(dir.resolve("a.txt")).toString());
    BaseConfiguration emptyClasspath = new BaseConfiguration();
    emptyClasspath.setProperty("location", "classpath:/");

    assertThrows(ConfigException.class, () -> PromptRepositoryFactory.create(missing));
    assertThrows(ConfigException.class, () -> PromptRepositoryFactory.create(file));
    assertThrows(ConfigException.class, () -> PromptRepositoryFactory.create(emptyClasspath));
  }

  @Test
  void rendersSystemPromptWithConfiguredVariables() throws IOException {
    Files.writeString(
        dir.resolve("persona.yaml"),
        "sections:\n  - id: main\n    content: I am {{ bot_name }} from {{ city }}.\n");
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("location", dir.toString());
    cfg.setProperty("system", "persona");
    cfg.setProperty("variables.bot_name", "Yuru");
    cfg.setProperty("variables.city", "Osaka");

    assertEquals("I am Yuru from Osaka.", PromptRepositoryFactory.renderSystemPrompt(cfg));
  }
}
