package com.gentoro.chatbot.exception;

import java.util.Map;

/** The supplied cache handle is expired, evicted or unknown to the backend. */
public class CacheInvalidException extends LlmException {
  public CacheInvalidException(String message) {
    super(ChatBotErrorCode.CACHE_INVALID, message);
  }

  public CacheInvalidException(String message, Throwable cause) {
    super(ChatBotErrorCode.CACHE_INVALID, message, cause);
  }

  public CacheInvalidException(String message, String cacheHandle, Throwable cause) {
    super(ChatBotErrorCode.CACHE_INVALID, message, Map.of("cacheHandle", cacheHandle), cause);
  }
}
