package com.gentoro.chatbot.exception;

import java.util.Map;

/** Authentication or authorization failure (HTTP 401/403). Not retryable. */
public class AuthException extends LlmException {
  private final int statusCode;

  public AuthException(String message, int statusCode) {
    this(message, statusCode, null);
  }

  public AuthException(String message, int statusCode, Throwable cause) {
    super(ChatBotErrorCode.UNAUTHENTICATED, message, Map.of("statusCode", statusCode), cause);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
