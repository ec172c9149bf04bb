package com.gentoro.chatbot.prompt.impl;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.chatbot.exception.PromptException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemPromptRepositoryTest {
  @TempDir Path dir;

  @Test
  void loadsYmlFilesAndSkipsDisabledSections() throws IOException {
    Files.writeString(
        dir.resolve("greeter.yml"),
        String.join(
            "\n",
            "sections:",
            "  - id: intro",
            "    content: Hello {{ name }}!",
            "  - id: hidden",
            "    enabled: false",
            "    content: secret",
            "  - id: outro",
            "    enabled: true",
            "    content: Bye."));

    String rendered =
        new FileSystemPromptRepository(dir).get("greeter").render(Map.of("name", "Ann"));

    assertEquals("Hello Ann!\n\nBye.", rendered);
  }

  @Test
  void rejectsInvalidDefinitions() throws IOException {
    Files.writeString(dir.resolve("nosections.yaml"), "title: nothing here\n");
    Files.writeString(
        dir.resolve("dup.yaml"),
        "sections:\n  - id: a\n    content: x\n  - id: a\n    content: y\n");
    Files.writeString(dir.resolve("empty.yaml"), "sections:\n  - id: a\n    content: '  '\n");
    Files.writeString(
        dir.resolve("off.yaml"), "sections:\n  - id: a\n    enabled: false\n    content: x\n");
    FileSystemPromptRepository repository = new FileSystemPromptRepository(dir);

    assertThrows(PromptException.class, () -> repository.get("nosections"));
    assertThrows(PromptException.class, () -> repository.get("dup"));
    assertThrows(PromptException.class, () -> repository.get("empty"));
    assertThrows(PromptException.class, () -> repository.get("missing"));
    assertThrows(PromptException.class, () -> repository.get("off").render(Map.of()));
  }
}
