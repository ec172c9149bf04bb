package com.gentoro.chatbot.exception;

/** The provider answered with an error or a response that cannot be interpreted. */
public class MalformedResponseException extends LlmException {
  public MalformedResponseException(String message) {
    super(ChatBotErrorCode.MALFORMED_RESPONSE, message);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(ChatBotErrorCode.MALFORMED_RESPONSE, message, cause);
  }
}
