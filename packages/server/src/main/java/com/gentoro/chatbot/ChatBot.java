package com.gentoro.chatbot;

import com.gentoro.chatbot.agent.Agent;
import com.gentoro.chatbot.agent.AgentSettings;
import com.gentoro.chatbot.context.CallContext;
import com.gentoro.chatbot.exception.AgentClosedException;
import com.gentoro.chatbot.exception.ChatBotException;
import com.gentoro.chatbot.exception.ExceptionUtil;
import com.gentoro.chatbot.exception.StateException;
import com.gentoro.chatbot.logging.LoggingService;
import com.gentoro.chatbot.model.Provider;
import com.gentoro.chatbot.model.ProviderFactory;
import com.gentoro.chatbot.prompt.PromptRepositoryFactory;
import com.gentoro.chatbot.utility.StdoutUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires configuration, system prompt, provider and {@link Agent} together and serves user
 * messages from the console.
 *
 * <p>The chat bot owns the provider it creates: on shutdown the agent is closed first and the
 * provider afterwards.
 */
public class ChatBot {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ChatBot.class);
  public static final String QUIT_COMMAND = "/quit";
  static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

  private final StartupParameters startupParameters;
  private Configuration configuration;
  private Provider provider;
  private Agent agent;
  private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
  private Duration closeTimeout = Agent.DEFAULT_CLOSE_TIMEOUT;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private volatile Thread shutdownHook;

  public ChatBot(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  /** Loads everything and runs the selected mode until it ends. */
  public void initialize() {
    if ("help".equals(startupParameters.mode())) {
      StdoutUtility.printNewLine(System.out, StartupParameters.usage());
      return;
    }

    Configuration cfg = new ConfigurationProvider(startupParameters.configFile()).config();
    LoggingService.applyConfiguration(cfg);
    if ("interactive".equals(startupParameters.mode())) {
      LoggingService.configureFileOnlyLogging(cfg);
    }
    registerShutdownHook();

    try {
      start(cfg, ProviderFactory.createProvider(cfg));
      run(
          new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
          System.out);
    } finally {
      shutdown();
    }
  }

  /** Builds the agent over {@code provider}, which this chat bot then owns. */
  void start(Configuration cfg, Provider provider) {
    this.configuration = cfg;
    this.provider = provider;
    this.requestTimeout =
        AgentSettings.duration(cfg, "agent.request-timeout", DEFAULT_REQUEST_TIMEOUT);

    String systemPrompt = PromptRepositoryFactory.renderSystemPrompt(cfg.subset("prompt"));
    AgentSettings settings = AgentSettings.from(cfg);
    this.closeTimeout = settings.closeTimeout();
    this.agent =
        settings.applyTo(Agent.builder(provider, systemPrompt, settings.ttl())).build();
    log.info(
        "Chat bot ready (cache ttl {}, refresh {})",
        settings.ttl(),
        settings.refreshEnabled() ? settings.refreshInterval() : "disabled");
  }

  void run(BufferedReader in, PrintStream out) {
    switch (startupParameters.mode()) {
      case "interactive":
        enterInteractiveMode(in, out);
        break;
      case "once":
        StdoutUtility.printReply(out, answer(startupParameters.message().orElseThrow()));
        break;
      default:
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  /** Answers lines from {@code in} until {@value #QUIT_COMMAND}, end of input or agent close. */
  void enterInteractiveMode(BufferedReader in, PrintStream out) {
    StdoutUtility.printNewLine(out, "Welcome! Type a message (or '" + QUIT_COMMAND + "' to quit):");
    while (true) {
      out.print("> ");
      out.flush();
      String line;
      try {
        line = in.readLine();
      } catch (IOException e) {
        log.error("Failed to read from console", e);
        break;
      }
      if (line == null) {
        break;
      }
      String input = line.trim();
      if (input.isEmpty()) {
        continue;
      }
      if (QUIT_COMMAND.equalsIgnoreCase(input)) {
        StdoutUtility.printNewLine(out, "Goodbye!");
        break;
      }

      try {
        StdoutUtility.printReply(out, answer(input));
      } catch (AgentClosedException e) {
        StdoutUtility.printError(out, "The chat bot is shutting down.");
        break;
      } catch (ChatBotException e) {
        log.error(
            "Failed to answer message: {} at {}",
            ExceptionUtil.toErrorDetails(e),
            ExceptionUtil.formatCompactStackTrace(e));
        StdoutUtility.printError(
            out,
            e.getCode().isRetryable()
                ? "The model is temporarily unavailable, please try again."
                : "Could not answer this message (" + e.getCode() + ").");
      }
    }
  }

  /** One request: a fresh context bounded by {@code agent.request-timeout}. */
  public String answer(String message) {
    if (agent == null) {
      throw new StateException("ChatBot not started");
    }
    return agent.generate(CallContext.background().withTimeout(requestTimeout), message);
  }

  private void registerShutdownHook() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "chatbot-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    if (agent != null) {
      try {
        agent.close(CallContext.background().withTimeout(closeTimeout));
      } catch (RuntimeException e) {
        log.warn("Failed to close agent", e);
      }
    }
    if (provider != null) {
      try {
        provider.close();
      } catch (RuntimeException e) {
        log.warn("Failed to close provider", e);
      }
    }
    log.info("Chat bot stopped");
  }

  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("ChatBot not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  Agent agent() {
    return agent;
  }
}
