package com.gentoro.chatbot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line options: {@code --config-file <location> --mode <mode> --message <text>}. */
public class StartupParameters {
  public static final Set<String> MODES = Set.of("interactive", "once", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "interactive");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if ("once".equals(mode)
        && (parameters.get("message") == null
            || parameters.get("message").toString().isBlank())) {
      throw new IllegalArgumentException("Mode 'once' requires --message <text>");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/chatbot.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file", String.class)
        .orElse(ConfigurationProvider.DEFAULT_LOCATION);
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public Optional<String> message() {
    return getOptionalParameter("message", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: chatbot [--config-file <location>] [--mode interactive|once|help]"
            + " [--message <text>]",
        "  --config-file  classpath:application.yaml (default), file:/path.yaml or a plain path",
        "  --mode         interactive (default) reads messages from stdin, once answers --message",
        "  --message      the message answered in 'once' mode");
  }
}
