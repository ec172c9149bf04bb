package com.gentoro.chatbot.exception;

/** Provider quota or rate limit exceeded (HTTP 429). */
public class RateLimitException extends LlmException {
  public RateLimitException(String message) {
    super(ChatBotErrorCode.RATE_LIMITED, message);
  }

  public RateLimitException(String message, Throwable cause) {
    super(ChatBotErrorCode.RATE_LIMITED, message, cause);
  }
}
