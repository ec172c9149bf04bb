package com.gentoro.chatbot.prompt;

/** Source of named prompt templates. */
public interface PromptRepository {

  /**
   * Loads the template called {@code name} (without extension).
   *
   * @throws com.gentoro.chatbot.exception.PromptException when it is missing or invalid
   */
  PromptTemplate get(String name);
}
