package com.gentoro.chatbot.model;

import com.gentoro.chatbot.context.CallContext;
import com.gentoro.chatbot.exception.LlmTimeoutException;
import com.gentoro.chatbot.exception.MalformedResponseException;
import com.gentoro.chatbot.exception.StateException;
import com.google.genai.Client;
import com.google.genai.types.CachedContent;
import com.google.genai.types.Content;
import com.google.genai.types.CreateCachedContentConfig;
import com.google.genai.types.DeleteCachedContentConfig;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link Provider} backed by Gemini on Vertex AI through the Google Gen AI SDK.
 *
 * <p>All SDK calls go through the async API so that the {@link CallContext} deadline bounds the
 * wait and a cancellation cancels the pending request.
 */
public class GeminiProvider implements Provider {
  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(GeminiProvider.class);

  public static final String DEFAULT_MODEL = "gemini-2.5-flash-lite";
  public static final String DEFAULT_CACHE_DISPLAY_NAME = "chatbot-system-prompt";

  private final Client client;
  private final String model;
  private final String cacheDisplayName;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public GeminiProvider(Client client, String model, String cacheDisplayName) {
    this.client = Objects.requireNonNull(client, "client");
    this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model.trim();
    this.cacheDisplayName =
        cacheDisplayName == null || cacheDisplayName.isBlank()
            ? DEFAULT_CACHE_DISPLAY_NAME
            : cacheDisplayName;
  }

  public String model() {
    return model;
  }

  @Override
  public String generateText(CallContext ctx, String systemPrompt, String userMessage) {
    ensureOpen();
    GenerateContentConfig config =
        GenerateContentConfig.builder().systemInstruction(userContent(systemPrompt)).build();
    log.trace("Uncached generation with model {}", model);
    GenerateContentResponse response =
        await(
            ctx,
            "generateContent",
            null,
            () -> client.async.models.generateContent(model, userMessage, config));
    return extractText(response);
  }

  @Override
  public String generateTextCached(CallContext ctx, String cacheHandle, String userMessage) {
    ensureOpen();
    GenerateContentConfig config =
        GenerateContentConfig.builder().cachedContent(cacheHandle).build();
    log.trace("Cached generation with model {} and cache {}", model, cacheHandle);
    GenerateContentResponse response =
        await(
            ctx,
            "generateContent(cached)",
            cacheHandle,
            () -> client.async.models.generateContent(model, userMessage, config));
    return extractText(response);
  }

  @Override
  public String createCachedConfig(CallContext ctx, String systemPrompt, Duration ttl) {
    ensureOpen();
    CreateCachedContentConfig config =
        CreateCachedContentConfig.builder()
            .systemInstruction(userContent(systemPrompt))
            .ttl(ttl)
            .displayName(cacheDisplayName)
            .build();
    CachedContent cached =
        await(ctx, "caches.create", null, () -> client.async.caches.create(model, config));
    String name = cached == null ? null : cached.name().orElse(null);
    if (name == null || name.isBlank()) {
      throw new MalformedResponseException("caches.create returned no cache name");
    }
    log.debug("Created cached content {} (ttl {})", name, ttl);
    return name;
  }

  @Override
  public void deleteCachedConfig(CallContext ctx, String cacheHandle) {
    ensureOpen();
    await(
        ctx,
        "caches.delete",
        null,
        () -> client.async.caches.delete(cacheHandle, DeleteCachedContentConfig.builder().build()));
    log.debug("Deleted cached content {}", cacheHandle);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      client.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close Gemini client", e);
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new StateException("Gemini provider is closed");
    }
  }

  private static Content userContent(String text) {
    return Content.builder().role("user").parts(Part.fromText(text)).build();
  }

  /**
   * Starts the request and waits for it within the bounds of {@code ctx}. A cancelled context
   * cancels the pending future. {@code cacheHandle} is non-null for calls that use cached content.
   */
  static <T> T await(
      CallContext ctx,
      String operation,
      String cacheHandle,
      Supplier<CompletableFuture<T>> request) {
    ctx.throwIfDone();
    CompletableFuture<T> future = start(operation, cacheHandle, request);
    try (CallContext.Registration ignored = ctx.onCancel(() -> future.cancel(true))) {
      Optional<Duration> remaining = ctx.remaining();
      if (remaining.isPresent()) {
        return future.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
      }
      return future.get();
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new LlmTimeoutException(operation + " exceeded the call deadline", e);
    } catch (CancellationException e) {
      throw new LlmTimeoutException(operation + " was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new LlmTimeoutException(operation + " was interrupted", e);
    } catch (ExecutionException e) {
      throw GeminiErrorMapper.map(operation, e, cacheHandle);
    }
  }

  private static <T> CompletableFuture<T> start(
      String operation, String cacheHandle, Supplier<CompletableFuture<T>> request) {
    try {
      return request.get();
    } catch (RuntimeException e) {
      throw GeminiErrorMapper.map(operation, e, cacheHandle);
    }
  }

  /** Returns the generated text or raises a malformed-response error. */
  static String extractText(GenerateContentResponse response) {
    if (response == null
        || response.candidates().isEmpty()
        || response.candidates().get().isEmpty()) {
      throw new MalformedResponseException("no candidates in response");
    }
    String text = response.text();
    if (text == null || text.isEmpty()) {
      throw new MalformedResponseException("response contains no text");
    }
    return text;
  }
}
