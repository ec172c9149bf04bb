package com.gentoro.chatbot;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.chatbot.context.CallContext;
import com.gentoro.chatbot.exception.AuthException;
import com.gentoro.chatbot.exception.RateLimitException;
import com.gentoro.chatbot.exception.StateException;
import com.gentoro.chatbot.model.Provider;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatBotTest {
  @Mock Provider provider;

  private Configuration cfg;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  @BeforeEach
  void setUp() {
    cfg = new ConfigurationProvider("classpath:config/test-application.yaml").config();
  }

  @Test
  void interactiveSessionAnswersThroughCacheAndShutsDownInOrder() {
    when(provider.createCachedConfig(any(), anyString(), eq(Duration.ofMinutes(30))))
        .thenReturn("cache-A");
    when(provider.generateTextCached(any(), eq("cache-A"), eq("hi"))).thenReturn("hello there");
    ChatBot bot = new ChatBot(new String[0]);

    bot.start(cfg, provider);
    bot.run(new BufferedReader(new StringReader("hi\n\n/quit\nignored\n")), out);
    bot.shutdown();
    bot.shutdown();

    String console = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(console.contains("hello there"));
    assertTrue(console.contains("Goodbye!"));
    InOrder order = inOrder(provider);
    order.verify(provider).deleteCachedConfig(any(), eq("cache-A"));
    order.verify(provider).close();
    verify(provider, times(1)).close();
  }

  @Test
  void systemPromptIsRenderedFromConfiguredTemplate() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    ChatBot bot = new ChatBot(new String[0]);

    bot.start(cfg, provider);

    verify(provider)
        .createCachedConfig(
            any(),
            startsWith("You are Testy, a friendly chat companion"),
            eq(Duration.ofMinutes(30)));
    bot.shutdown();
  }

  @Test
  void providerErrorsAreReportedAndLoopContinues() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    when(provider.generateTextCached(any(), eq("cache-A"), anyString()))
        .thenThrow(new RateLimitException("quota"))
        .thenThrow(new AuthException("denied", 403))
        .thenReturn("finally");
    ChatBot bot = new ChatBot(new String[0]);
    bot.start(cfg, provider);

    bot.run(new BufferedReader(new StringReader("one\ntwo\nthree\n")), out);

    String console = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(console.contains("temporarily unavailable"));
    assertTrue(console.contains("UNAUTHENTICATED"));
    assertTrue(console.contains("finally"));
    bot.shutdown();
  }

  @Test
  void closedProviderIsReportedAndLoopContinues() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    when(provider.generateTextCached(any(), eq("cache-A"), anyString()))
        .thenThrow(new StateException("Provider is closed"))
        .thenReturn("still here");
    ChatBot bot = new ChatBot(new String[0]);
    bot.start(cfg, provider);

    bot.run(new BufferedReader(new StringReader("one\ntwo\n")), out);

    String console = buffer.toString(StandardCharsets.UTF_8);
    assertTrue(console.contains("Could not answer this message (FAILED_PRECONDITION)"));
    assertTrue(console.contains("still here"));
    bot.shutdown();
  }

  @Test
  void shutdownBoundsCacheDeletionByCloseTimeout() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    ChatBot bot = new ChatBot(new String[0]);
    bot.start(cfg, provider);

    bot.shutdown();

    ArgumentCaptor<CallContext> ctx = ArgumentCaptor.forClass(CallContext.class);
    verify(provider).deleteCachedConfig(ctx.capture(), eq("cache-A"));
    assertTrue(ctx.getValue().deadline().isPresent());
    assertTrue(ctx.getValue().remaining().orElseThrow().compareTo(Duration.ofSeconds(1)) <= 0);
  }

  @Test
  void closedAgentEndsTheLoop() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    ChatBot bot = new ChatBot(new String[0]);
    bot.start(cfg, provider);
    bot.agent().close();

    bot.run(new BufferedReader(new StringReader("hello\nagain\n")), out);

    assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("shutting down"));
    bot.shutdown();
  }

  @Test
  void onceModeAnswersMessage() {
    when(provider.createCachedConfig(any(), anyString(), any())).thenReturn("cache-A");
    when(provider.generateTextCached(any(), eq("cache-A"), eq("ping"))).thenReturn("pong");
    ChatBot bot = new ChatBot(new String[] {"--mode", "once", "--message", "ping"});
    bot.start(cfg, provider);

    bot.run(new BufferedReader(new StringReader("")), out);

    assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("pong"));
    bot.shutdown();
  }

  @Test
  void answerBeforeStartIsAnError() {
    ChatBot bot = new ChatBot(new String[0]);

    assertThrows(StateException.class, () -> bot.answer("x"));
  }
}
