package com.gentoro.chatbot.model;

import com.gentoro.chatbot.exception.AuthException;
import com.gentoro.chatbot.exception.CacheInvalidException;
import com.gentoro.chatbot.exception.LlmException;
import com.gentoro.chatbot.exception.LlmTimeoutException;
import com.gentoro.chatbot.exception.MalformedResponseException;
import com.gentoro.chatbot.exception.NetworkException;
import com.gentoro.chatbot.exception.RateLimitException;
import com.google.genai.errors.ApiException;
import com.google.genai.errors.GenAiIOException;
import java.io.IOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Translates failures raised by the Google Gen AI SDK into the provider error taxonomy.
 *
 * <p>Classification only looks at exception types, HTTP codes and API status values. Message text
 * is carried along for diagnostics but never inspected.
 */
final class GeminiErrorMapper {
  static final String FAILED_PRECONDITION = "FAILED_PRECONDITION";

  private GeminiErrorMapper() {}

  /** Maps a failure of the uncached path or of a cache management call. */
  static LlmException map(String operation, Throwable error) {
    return map(operation, error, null);
  }

  /**
   * Maps a failure. When {@code cacheHandle} is not null the call used cached content, so a
   * missing resource or a rejected precondition means the handle is no longer usable.
   */
  static LlmException map(String operation, Throwable error, String cacheHandle) {
    Throwable t = unwrap(error);
    if (t instanceof LlmException llm) {
      return llm;
    }
    if (t instanceof TimeoutException
        || t instanceof CancellationException
        || t instanceof InterruptedException) {
      return new LlmTimeoutException(operation + " timed out or was cancelled", t);
    }
    if (t instanceof ApiException api) {
      return mapApi(operation, api, cacheHandle);
    }
    if (t instanceof GenAiIOException || t instanceof IOException) {
      return new NetworkException(operation + " failed: network error", t);
    }
    return new MalformedResponseException(operation + " failed: unexpected error", t);
  }

  private static LlmException mapApi(String operation, ApiException api, String cacheHandle) {
    int code = api.code();
    String detail =
        "%s failed with HTTP %d %s: %s".formatted(operation, code, api.status(), api.message());
    if (code == 401 || code == 403) {
      return new AuthException(detail, code, api);
    }
    if (code == 429) {
      return new RateLimitException(detail, api);
    }
    if (cacheHandle != null
        && (code == 404 || (code == 400 && FAILED_PRECONDITION.equals(api.status())))) {
      return new CacheInvalidException(detail, cacheHandle, api);
    }
    return new MalformedResponseException(detail, api);
  }

  private static Throwable unwrap(Throwable error) {
    Throwable t = error;
    while ((t instanceof ExecutionException || t instanceof CompletionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
