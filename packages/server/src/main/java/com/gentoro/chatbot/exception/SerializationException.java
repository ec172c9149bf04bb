package com.gentoro.chatbot.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends ChatBotException {
  public SerializationException(String message) {
    super(ChatBotErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ChatBotErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
