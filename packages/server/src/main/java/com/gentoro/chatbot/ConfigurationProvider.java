package com.gentoro.chatbot;

import com.gentoro.chatbot.exception.ConfigException;
import com.gentoro.chatbot.exception.SerializationException;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), "file:/etc/app.yaml", or an absolute or relative filesystem path. Values may refer to
 * environment variables as {@code ${env:NAME}}; variables missing from the environment are looked
 * up in a {@code .env} file.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(ConfigurationProvider.class);
  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    String name = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
    log.info("Loading configuration from classpath resource: {}", name);
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = classLoader.getResourceAsStream(name)) {
      if (input == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + name);
      }
      return read(new InputStreamReader(input, StandardCharsets.UTF_8), name);
    } catch (IOException e) {
      throw new SerializationException("Failed to read YAML from classpath resource: " + name, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file.getAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
      return read(reader, file.getPath());
    } catch (IOException e) {
      throw new SerializationException("Failed to read YAML file: " + file, e);
    }
  }

  private static Configuration read(Reader reader, String source) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML configuration in " + source, e);
    }
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup());
    return config;
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath(DEFAULT_LOCATION.substring("classpath:".length()));
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  /** {@code env:} lookup reading the process environment first and a {@code .env} file second. */
  static class FallbackEnvLookup implements Lookup {
    private final UnaryOperator<String> environment;
    private final Path envFile;
    private volatile Map<String, String> fallback;

    FallbackEnvLookup() {
      this(System::getenv, Paths.get(".env"));
    }

    FallbackEnvLookup(UnaryOperator<String> environment, Path envFile) {
      this.environment = environment;
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String val = environment.apply(key);
      if (val != null && !val.isEmpty()) {
        return val;
      }
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = Files.isRegularFile(envFile) ? readKeyValueFile(envFile) : new HashMap<>();
          }
        }
      }
      return fallback.get(key);
    }

    private Map<String, String> readKeyValueFile(Path path) {
      log.info("Reading .env file: {}", path.toAbsolutePath());
      try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return br.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .map(FallbackEnvLookup::parseLine)
            .filter(e -> !e.getKey().isEmpty())
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path.toAbsolutePath(), e.getMessage());
        return Collections.emptyMap();
      }
    }

    static Map.Entry<String, String> parseLine(String line) {
      int idx = line.indexOf('=');
      if (idx <= 0) return Map.entry("", "");
      String key = line.substring(0, idx).trim();
      if (key.startsWith("export ")) key = key.substring("export ".length()).trim();
      String val = line.substring(idx + 1).trim();
      if (val.length() >= 2
          && ((val.startsWith("\"") && val.endsWith("\""))
              || (val.startsWith("'") && val.endsWith("'")))) {
        val = val.substring(1, val.length() - 1);
      }
      return Map.entry(key, val);
    }
  }
}
