package com.gentoro.chatbot.model;

import com.gentoro.chatbot.http.OkHttpFactory;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Determines the Vertex AI region the process runs in.
 *
 * <p>Lookup order: the Cloud Run metadata server, the {@code GCP_REGION} environment variable and
 * finally {@link #DEFAULT_REGION}.
 */
public class RegionResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(RegionResolver.class);

  public static final String DEFAULT_REGION = "us-central1";
  public static final String DEFAULT_METADATA_URL = "http://metadata.google.internal";
  public static final String REGION_ENV = "GCP_REGION";
  static final String REGION_PATH = "/computeMetadata/v1/instance/region";
  static final Duration METADATA_TIMEOUT = Duration.ofSeconds(2);

  private final OkHttpClient httpClient;
  private final String metadataUrl;
  private final UnaryOperator<String> env;

  public RegionResolver(String metadataUrl) {
    this(OkHttpFactory.create(METADATA_TIMEOUT), metadataUrl, System::getenv);
  }

  RegionResolver(OkHttpClient httpClient, String metadataUrl, UnaryOperator<String> env) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.metadataUrl = stripTrailingSlash(Objects.requireNonNull(metadataUrl, "metadataUrl"));
    this.env = Objects.requireNonNull(env, "env");
  }

  public String resolve() {
    Optional<String> fromMetadata = fetchFromMetadata();
    if (fromMetadata.isPresent()) {
      log.debug("Region '{}' resolved from metadata server", fromMetadata.get());
      return fromMetadata.get();
    }
    String fromEnv = env.apply(REGION_ENV);
    if (fromEnv != null && !fromEnv.isBlank()) {
      log.debug("Region '{}' resolved from {}", fromEnv, REGION_ENV);
      return fromEnv.trim();
    }
    log.debug("Region not available, using default '{}'", DEFAULT_REGION);
    return DEFAULT_REGION;
  }

  Optional<String> fetchFromMetadata() {
    Request request =
        new Request.Builder()
            .url(metadataUrl + REGION_PATH)
            .header("Metadata-Flavor", "Google")
            .get()
            .build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        log.debug("Metadata server answered HTTP {}", response.code());
        return Optional.empty();
      }
      ResponseBody body = response.body();
      return body == null ? Optional.empty() : parseRegion(body.string());
    } catch (IOException | IllegalArgumentException e) {
      log.debug("Metadata server not reachable: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Extracts the region from a metadata response of the form {@code
   * projects/<number>/regions/<region>}. Trailing line breaks are ignored; any other deviation
   * yields an empty result.
   */
  static Optional<String> parseRegion(String body) {
    if (body == null) {
      return Optional.empty();
    }
    int end = body.length();
    while (end > 0 && (body.charAt(end - 1) == '\n' || body.charAt(end - 1) == '\r')) {
      end--;
    }
    String value = body.substring(0, end);
    if (value.isEmpty() || !value.equals(value.strip())) {
      return Optional.empty();
    }
    String[] parts = value.split("/", -1);
    if (parts.length != 4
        || !"projects".equals(parts[0])
        || parts[1].isEmpty()
        || !"regions".equals(parts[2])
        || parts[3].isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(parts[3]);
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
