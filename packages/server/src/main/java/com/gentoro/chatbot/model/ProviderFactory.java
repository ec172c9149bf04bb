package com.gentoro.chatbot.model;

import com.gentoro.chatbot.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Factory utility to create {@link Provider} instances from configuration.
 *
 * <p>Resolution uses Java's {@link ServiceLoader} to locate a matching {@link ProviderSupplier} by
 * {@code providerId()}.
 */
public final class ProviderFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(ProviderFactory.class);

  private ProviderFactory() {}

  /**
   * Creates a provider using an indirection key under the {@code llm.*} namespace.
   *
   * <p>Example configuration:
   *
   * <pre>
   *   llm.active-profile = default
   *   llm.default.provider = gemini
   *   llm.default.project-id = my-project
   * </pre>
   *
   * @param configuration root application configuration
   * @return configured provider instance
   */
  public static Provider createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm.%s".formatted(namespace)));
  }

  /**
   * Creates a provider from a profile-specific subset configuration.
   *
   * <p>Expected keys include at least {@code provider} and any provider-specific settings.
   */
  public static Provider create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider in configuration");
    }
    provider = provider.trim().toLowerCase(Locale.ROOT);

    for (ProviderSupplier supplier : ServiceLoader.load(ProviderSupplier.class)) {
      if (provider.equals(supplier.providerId())) {
        log.debug("Creating LLM provider '{}' via {}", provider, supplier.getClass().getName());
        return supplier.create(subConfig);
      }
    }

    throw new ConfigException("Unknown llm provider: %s".formatted(provider));
  }
}
