package com.gentoro.chatbot.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Each supplier identifies
 * itself with a stable {@code providerId} (e.g. "gemini"). The factory selects an implementation
 * by matching the {@code provider} key of the active configuration profile against this id.
 *
 * <p>To register a supplier, add its fully qualified class name to the service resource: {@code
 * META-INF/services/com.gentoro.chatbot.model.ProviderSupplier}.
 */
public interface ProviderSupplier {

  /** A stable, lowercase identifier for this provider (e.g. "gemini"). */
  String providerId();

  /**
   * Creates a configured {@link Provider}.
   *
   * @param subConfiguration profile configuration subset (e.g. {@code llm.default.*})
   * @throws com.gentoro.chatbot.exception.ConfigException when required keys are missing
   */
  Provider create(Configuration subConfiguration);
}
