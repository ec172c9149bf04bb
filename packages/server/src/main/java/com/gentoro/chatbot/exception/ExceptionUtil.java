package com.gentoro.chatbot.exception;

import java.time.Instant;
import java.util.StringJoiner;
import java.util.function.Function;

/** Utility helpers for classifying exceptions and producing structured error details. */
public final class ExceptionUtil {
  private static final int MAX_CAUSE_DEPTH = 16;
  private static final int DEFAULT_TRACE_FRAMES = 8;

  private ExceptionUtil() {}

  /**
   * Returns the code of the first {@link ChatBotException} found in the cause chain, or {@link
   * ChatBotErrorCode#UNKNOWN} when there is none.
   */
  public static ChatBotErrorCode codeOf(Throwable t) {
    Throwable current = t;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof ChatBotException ex) {
        return ex.getCode();
      }
      current = current.getCause();
    }
    return ChatBotErrorCode.UNKNOWN;
  }

  /** True when the failure means the cache handle used for the call is no longer usable. */
  public static boolean isCacheInvalid(Throwable t) {
    return codeOf(t) == ChatBotErrorCode.CACHE_INVALID;
  }

  /** True for timeout, rate-limit and network failures anywhere in the cause chain. */
  public static boolean isRetryable(Throwable t) {
    return codeOf(t).isRetryable();
  }

  /** True when the failure is the agent's own terminal state. */
  public static boolean isClosed(Throwable t) {
    return codeOf(t) == ChatBotErrorCode.CLOSED;
  }

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging. If the throwable is a
   * {@link ChatBotException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ChatBotException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getCode().isRetryable(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        ChatBotErrorCode.UNKNOWN,
        false,
        null,
        Instant.now());
  }

  /**
   * Top {@code maxFrames} stack frames of {@code t} on one line, innermost first, joined by {@code
   * " > "}. A non-positive {@code maxFrames} keeps every frame; {@code null} yields "".
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) {
      return "";
    }
    StackTraceElement[] frames = t.getStackTrace();
    int limit = maxFrames <= 0 ? frames.length : Math.min(frames.length, maxFrames);
    StringJoiner joined = new StringJoiner(" > ");
    for (int i = 0; i < limit; i++) {
      joined.add(frameOf(frames[i]));
    }
    return joined.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_TRACE_FRAMES);
  }

  private static String frameOf(StackTraceElement frame) {
    String file = frame.getFileName() != null ? frame.getFileName() : "?";
    String line = frame.getLineNumber() >= 0 ? ":" + frame.getLineNumber() : "";
    return frame.getClassName() + "." + frame.getMethodName() + " (" + file + line + ")";
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /**
   * Returns {@code t} unchanged when it already is a {@link ChatBotException}, otherwise wraps it
   * with {@code supplier}.
   */
  public static ChatBotException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ? extends ChatBotException> supplier) {
    if (t instanceof ChatBotException ex) {
      return ex;
    }
    return supplier.apply(t);
  }
}
