package com.gentoro.chatbot.model;

import com.gentoro.chatbot.exception.ConfigException;
import com.google.genai.Client;
import org.apache.commons.configuration2.Configuration;

/** SPI supplier for the Vertex AI Gemini {@link Provider}. */
public final class GeminiProviderSupplier implements ProviderSupplier {
  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(GeminiProviderSupplier.class);

  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public Provider create(Configuration subConfiguration) {
    String projectId = subConfiguration.getString("project-id", null);
    if (projectId == null || projectId.isBlank() || projectId.contains("${")) {
      throw new ConfigException(
          "Missing llm.<profile>.project-id in configuration (set GCP_PROJECT_ID)");
    }
    String region = subConfiguration.getString("region", null);
    if (region == null || region.isBlank()) {
      region =
          new RegionResolver(
                  subConfiguration.getString("metadata-url", RegionResolver.DEFAULT_METADATA_URL))
              .resolve();
    }
    String model = subConfiguration.getString("model", GeminiProvider.DEFAULT_MODEL);
    log.info("Using Vertex AI project '{}', region '{}', model '{}'", projectId, region, model);

    Client client =
        Client.builder().project(projectId.trim()).location(region.trim()).vertexAI(true).build();
    return new GeminiProvider(
        client,
        model,
        subConfiguration.getString(
            "cache-display-name", GeminiProvider.DEFAULT_CACHE_DISPLAY_NAME));
  }
}
