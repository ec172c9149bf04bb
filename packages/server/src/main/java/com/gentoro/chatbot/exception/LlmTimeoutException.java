package com.gentoro.chatbot.exception;

/** The call exceeded the caller's deadline or was cancelled. */
public class LlmTimeoutException extends LlmException {
  public LlmTimeoutException(String message) {
    super(ChatBotErrorCode.TIMEOUT, message);
  }

  public LlmTimeoutException(String message, Throwable cause) {
    super(ChatBotErrorCode.TIMEOUT, message, cause);
  }
}
