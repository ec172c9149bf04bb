package com.gentoro.chatbot.prompt.impl;

import com.gentoro.chatbot.exception.ExceptionUtil;
import com.gentoro.chatbot.exception.PromptException;
import com.gentoro.chatbot.prompt.PromptRepository;
import com.gentoro.chatbot.prompt.PromptTemplate;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public PromptTemplate get(String name) {
    String id = PromptDefinitionReader.normalizeName(name);
    try {
      Path yamlPath = resolveExisting(id);
      if (yamlPath == null) {
        throw new PromptException("Prompt not found: " + path.resolve(id));
      }
      return PromptDefinitionReader.read(id, Files.readString(yamlPath));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  private Path resolveExisting(String id) {
    Path pYaml = path.resolve(id + ".yaml");
    if (Files.exists(pYaml)) return pYaml;
    Path pYml = path.resolve(id + ".yml");
    if (Files.exists(pYml)) return pYml;
    return null;
  }
}
