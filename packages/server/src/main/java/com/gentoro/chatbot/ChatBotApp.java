package com.gentoro.chatbot;

public class ChatBotApp {

  private static final org.slf4j.Logger log =
      com.gentoro.chatbot.logging.LoggingService.getLogger(ChatBotApp.class);

  public static void main(String[] args) {
    try {
      new ChatBot(args).initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
