package com.gentoro.chatbot.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO exposing structured error information to logs or to a messaging front end. */
public record ErrorDetails(
    String type,
    String message,
    ChatBotErrorCode code,
    boolean retryable,
    Map<String, Object> context,
    Instant timestamp) {}
