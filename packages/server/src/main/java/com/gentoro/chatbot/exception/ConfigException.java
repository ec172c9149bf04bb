package com.gentoro.chatbot.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends ChatBotException {
  public ConfigException(String message) {
    super(ChatBotErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ChatBotErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
