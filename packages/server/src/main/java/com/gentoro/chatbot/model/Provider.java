package com.gentoro.chatbot.model;

import com.gentoro.chatbot.context.CallContext;
import java.time.Duration;

/**
 * Narrow, vendor-specific LLM client used by the {@code Agent}.
 *
 * <p>Implementations encapsulate the vendor SDK (request formatting, model selection, credentials)
 * and report every failure as a {@link com.gentoro.chatbot.exception.LlmException} whose code is
 * one of the provider kinds: cache-invalid, timeout, rate-limit, network, auth or
 * malformed-response. Every call must honor the supplied {@link CallContext}: a cancelled or
 * expired context ends the call with a timeout error.
 *
 * <p>A provider may be shared by several agents and must be thread-safe. Its lifetime is owned by
 * whoever created it; agents never call {@link #close()}.
 */
public interface Provider extends AutoCloseable {

  /**
   * Stateless generation. The system prompt is sent in full on every call.
   *
   * @return the generated text, never null or empty
   */
  String generateText(CallContext ctx, String systemPrompt, String userMessage);

  /**
   * Generation against previously created cached content.
   *
   * @throws com.gentoro.chatbot.exception.CacheInvalidException when the handle is stale,
   *     expired or unknown to the backend
   */
  String generateTextCached(CallContext ctx, String cacheHandle, String userMessage);

  /**
   * Registers {@code systemPrompt} as cached content living for {@code ttl}.
   *
   * @return an opaque, non-empty cache handle
   */
  String createCachedConfig(CallContext ctx, String systemPrompt, Duration ttl);

  /** Best-effort release of a cache handle. */
  void deleteCachedConfig(CallContext ctx, String cacheHandle);

  /** Releases vendor-side client resources. Idempotent. */
  @Override
  void close();
}
