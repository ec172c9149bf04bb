package com.gentoro.chatbot.exception;

/** The agent has been closed. Terminal and never retryable. */
public class AgentClosedException extends ChatBotException {
  public AgentClosedException(String message) {
    super(ChatBotErrorCode.CLOSED, message);
  }
}
