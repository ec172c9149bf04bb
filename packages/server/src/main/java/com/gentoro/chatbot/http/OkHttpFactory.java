package com.gentoro.chatbot.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  private OkHttpFactory() {}

  /** Client whose connect, read and whole-call timeouts are all bounded by {@code timeout}. */
  public static OkHttpClient create(Duration timeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .callTimeout(timeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
