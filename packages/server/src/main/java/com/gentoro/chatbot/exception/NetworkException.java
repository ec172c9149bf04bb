package com.gentoro.chatbot.exception;

/** Network-level communication error (connection refused, DNS failure, broken socket). */
public class NetworkException extends LlmException {
  public NetworkException(String message) {
    super(ChatBotErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(ChatBotErrorCode.NETWORK_ERROR, message, cause);
  }
}
