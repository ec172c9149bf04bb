package com.gentoro.chatbot.exception;

import java.util.Map;

/**
 * Errors raised while interacting with an LLM provider or interpreting its responses.
 *
 * <p>Every failure a {@code Provider} reports is one of the concrete subclasses, so the code is
 * always one of {@link ChatBotErrorCode#CACHE_INVALID}, {@link ChatBotErrorCode#TIMEOUT}, {@link
 * ChatBotErrorCode#RATE_LIMITED}, {@link ChatBotErrorCode#NETWORK_ERROR}, {@link
 * ChatBotErrorCode#UNAUTHENTICATED} or {@link ChatBotErrorCode#MALFORMED_RESPONSE}.
 */
public abstract class LlmException extends ChatBotException {
  protected LlmException(ChatBotErrorCode code, String message) {
    super(code, message);
  }

  protected LlmException(ChatBotErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }

  protected LlmException(
      ChatBotErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(code, message, context, cause);
  }

  /** Shortcut for {@code getCode().isRetryable()}. */
  public boolean isRetryable() {
    return getCode().isRetryable();
  }
}
