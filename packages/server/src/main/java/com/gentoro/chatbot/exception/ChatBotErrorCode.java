package com.gentoro.chatbot.exception;

/**
 * Canonical error codes for the chat bot. Codes are stable and suitable for logs and for callers
 * that need to decide on retries. Classification of failures always goes through these codes,
 * never through message text.
 */
public enum ChatBotErrorCode {
  // Generic
  UNKNOWN,
  FAILED_PRECONDITION,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,
  PROMPT_ERROR,

  // LLM provider taxonomy
  CACHE_INVALID,
  TIMEOUT,
  RATE_LIMITED,
  NETWORK_ERROR,
  UNAUTHENTICATED,
  MALFORMED_RESPONSE,

  // Agent terminal state
  CLOSED;

  /**
   * Whether a caller may reasonably retry an operation that failed with this code. Backoff policy
   * stays with the caller.
   */
  public boolean isRetryable() {
    return switch (this) {
      case TIMEOUT, RATE_LIMITED, NETWORK_ERROR -> true;
      default -> false;
    };
  }
}
