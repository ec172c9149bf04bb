package com.gentoro.chatbot.prompt.impl;

import com.gentoro.chatbot.exception.ExceptionUtil;
import com.gentoro.chatbot.exception.PromptException;
import com.gentoro.chatbot.prompt.PromptRepository;
import com.gentoro.chatbot.prompt.PromptTemplate;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loads prompt YAML templates from the classpath starting at a base directory. Example basePath:
 * "prompts" (will resolve resources like "prompts/system.yaml").
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = PromptDefinitionReader.normalizeName(name);
    try {
      String resource = resolveExisting(id);
      if (resource == null) {
        throw new PromptException("Prompt not found on classpath: " + basePath + "/" + id);
      }

      String yamlContent;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is == null) {
          throw new PromptException("Prompt resource not found: " + resource);
        }
        yamlContent = new String(is.readAllBytes(), StandardCharsets.UTF_8);
      }
      return PromptDefinitionReader.read(id, yamlContent);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
