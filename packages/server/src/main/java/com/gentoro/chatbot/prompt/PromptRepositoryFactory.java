package com.gentoro.chatbot.prompt;

import com.gentoro.chatbot.exception.ConfigException;
import com.gentoro.chatbot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.chatbot.prompt.impl.FileSystemPromptRepository;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {
  public static final String DEFAULT_LOCATION = "classpath:prompts";
  public static final String DEFAULT_SYSTEM_PROMPT = "system";

  private PromptRepositoryFactory() {}

  /**
   * Create a PromptRepository from the "prompt" subset of the configuration. {@code location}
   * accepts "classpath:prompts", "file:/absolute/path" or a plain filesystem path.
   */
  public static PromptRepository create(Configuration promptCfg) {
    String location = promptCfg.getString("location", DEFAULT_LOCATION);
    if (location == null || location.isBlank()) {
      location = DEFAULT_LOCATION;
    }
    location = location.trim();

    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompt.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt location is not a directory: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }

  /**
   * Loads and renders the system prompt named by {@code system} (default "system") with the
   * {@code variables.*} keys as template variables.
   */
  public static String renderSystemPrompt(Configuration promptCfg) {
    PromptTemplate template =
        create(promptCfg).get(promptCfg.getString("system", DEFAULT_SYSTEM_PROMPT));
    Map<String, Object> variables = new HashMap<>();
    Configuration vars = promptCfg.subset("variables");
    for (Iterator<String> it = vars.getKeys(); it.hasNext(); ) {
      String key = it.next();
      variables.put(key, vars.getProperty(key));
    }
    return template.render(variables);
  }
}
