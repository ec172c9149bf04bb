package com.gentoro.chatbot.utility;

import java.io.PrintStream;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  private StdoutUtility() {}

  public static void printReply(PrintStream out, String message) {
    for (String line : message.split("\n")) {
      out.printf("%s%s%s%n", green, line, reset);
    }
  }

  public static void printNewLine(PrintStream out, String message) {
    out.printf("%s%n", message);
  }

  public static void printError(PrintStream out, String message) {
    out.printf("%s%s%s%n", red, message, reset);
  }
}
