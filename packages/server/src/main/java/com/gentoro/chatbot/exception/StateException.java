package com.gentoro.chatbot.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends ChatBotException {
  public StateException(String message) {
    super(ChatBotErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(ChatBotErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
