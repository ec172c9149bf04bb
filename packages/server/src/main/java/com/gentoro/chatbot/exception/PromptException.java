package com.gentoro.chatbot.exception;

/** Prompt retrieval, parsing, rendering, or repository initialization error. */
public class PromptException extends ChatBotException {
  public PromptException(String message) {
    super(ChatBotErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(ChatBotErrorCode.PROMPT_ERROR, message, cause);
  }
}
