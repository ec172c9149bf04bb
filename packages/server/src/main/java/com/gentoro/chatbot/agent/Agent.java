package com.gentoro.chatbot.agent;

import com.gentoro.chatbot.context.CallContext;
import com.gentoro.chatbot.exception.AgentClosedException;
import com.gentoro.chatbot.exception.ExceptionUtil;
import com.gentoro.chatbot.exception.LlmException;
import com.gentoro.chatbot.exception.MalformedResponseException;
import com.gentoro.chatbot.logging.LoggingService;
import com.gentoro.chatbot.model.Provider;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Answers user messages through a {@link Provider} while keeping the system prompt registered as
 * server-side cached content.
 *
 * <p>The agent creates the cache on construction and uses it for every call while it is valid.
 * When the provider reports the cache as invalid the agent clears the handle, answers the current
 * call uncached and recreates the cache in the background. At most one creation call issued by the
 * agent is in flight at any time; callers never wait for it. Failing to create a cache is never an
 * error for callers: the agent keeps answering uncached.
 *
 * <p>The provider is shared and is never closed by the agent. {@link #close(CallContext)} releases
 * the cache handle and the agent's background resources; afterwards every {@link
 * #generate(CallContext, String)} fails with {@link AgentClosedException}.
 *
 * <pre>
 *   try (Agent agent = Agent.create(provider, systemPrompt, Duration.ofMinutes(60), null)) {
 *     String reply = agent.generate(CallContext.background().withTimeout(timeout), "hi");
 *   }
 * </pre>
 */
public final class Agent implements AutoCloseable {
  public static final Duration DEFAULT_CREATE_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private final Provider provider;
  private final String systemPrompt;
  private final Duration ttl;
  private final Logger log;
  private final Duration createTimeout;
  private final Duration closeTimeout;
  private final ScheduledExecutorService executor;
  private final boolean ownsExecutor;
  private final CallContext lifetime = CallContext.background();
  private final CacheState state;
  private final ScheduledFuture<?> refreshTask;

  private Agent(Builder builder) {
    this.provider = builder.provider;
    this.systemPrompt = builder.systemPrompt;
    this.ttl = builder.ttl;
    this.log = builder.logger != null ? builder.logger : defaultLogger();
    this.createTimeout = builder.createTimeout;
    this.closeTimeout = builder.closeTimeout;
    this.ownsExecutor = builder.maintenanceExecutor == null;
    this.executor = ownsExecutor ? newMaintenanceExecutor() : builder.maintenanceExecutor;
    this.state = new CacheState(createInitialCache());
    this.refreshTask =
        builder.refreshInterval == null
            ? null
            : executor.scheduleWithFixedDelay(
                this::refresh,
                builder.refreshInterval.toNanos(),
                builder.refreshInterval.toNanos(),
                TimeUnit.NANOSECONDS);
  }

  /**
   * Creates an agent and attempts to register {@code systemPrompt} as cached content living for
   * {@code ttl}. A failed attempt is logged and leaves the agent in uncached mode.
   *
   * @param logger destination of the agent's log events; {@code null} uses the agent's own logger
   */
  public static Agent create(Provider provider, String systemPrompt, Duration ttl, Logger logger) {
    return builder(provider, systemPrompt, ttl).logger(logger).build();
  }

  public static Builder builder(Provider provider, String systemPrompt, Duration ttl) {
    return new Builder(provider, systemPrompt, ttl);
  }

  /**
   * Generates the reply to {@code userMessage}, through the cache when one exists.
   *
   * <p>Provider errors other than an invalid cache are propagated unchanged.
   *
   * @throws AgentClosedException when the agent was closed
   * @throws LlmException for timeout, rate-limit, network, auth and malformed-response failures
   */
  public String generate(CallContext ctx, String userMessage) {
    Objects.requireNonNull(ctx, "ctx");
    CacheState.Snapshot snapshot = state.snapshot();
    if (snapshot.closed()) {
      throw new AgentClosedException("Agent is closed");
    }

    String handle = snapshot.handle();
    if (handle != null) {
      try {
        return provider.generateTextCached(ctx, handle, userMessage);
      } catch (LlmException e) {
        if (!ExceptionUtil.isCacheInvalid(e)) {
          throw e;
        }
        log.warn("Cache {} is no longer valid, answering uncached", handle);
        if (state.invalidate(handle)) {
          scheduleRecreation();
        }
      }
    }
    return provider.generateText(ctx, systemPrompt, userMessage);
  }

  /**
   * Closes the agent. The first call marks it closed, stops background maintenance and deletes the
   * current cache handle, if any; deletion failures are logged only. Later calls do nothing. In
   * flight {@code generate} calls are not interrupted. The provider is left open.
   */
  public void close(CallContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    CacheState.Closing closing = state.markClosed();
    if (!closing.firstClose()) {
      return;
    }
    lifetime.cancel();
    if (refreshTask != null) {
      refreshTask.cancel(false);
    }
    if (ownsExecutor) {
      stopExecutor();
    }
    if (closing.handle() != null) {
      deleteQuietly(ctx, closing.handle());
    }
    log.debug("Agent closed");
  }

  /** Same as {@code close(CallContext.background())}. */
  @Override
  public void close() {
    close(CallContext.background());
  }

  public boolean isClosed() {
    return state.isClosed();
  }

  /** The handle the next {@code generate} call would use. */
  public Optional<String> cacheHandle() {
    return Optional.ofNullable(state.handle());
  }

  public boolean isRecreationInProgress() {
    return state.isRecreating();
  }

  private String createInitialCache() {
    try {
      String handle = createCache();
      log.info("Cached system prompt as {} (ttl {})", handle, ttl);
      return handle;
    } catch (RuntimeException e) {
      log.warn(
          "Could not cache the system prompt, continuing uncached: {}",
          ExceptionUtil.toErrorDetails(e));
      return null;
    }
  }

  private String createCache() {
    String handle =
        provider.createCachedConfig(lifetime.withTimeout(createTimeout), systemPrompt, ttl);
    if (handle == null || handle.isEmpty()) {
      throw new MalformedResponseException("Provider returned an empty cache handle");
    }
    return handle;
  }

  private void scheduleRecreation() {
    if (!state.tryBeginRecreation()) {
      log.debug("Cache creation already in flight, not starting another one");
      return;
    }
    try {
      executor.execute(() -> createAndInstall("recreation"));
    } catch (RejectedExecutionException e) {
      state.abortRecreation();
      log.debug("Maintenance executor rejected cache recreation: {}", e.getMessage());
    }
  }

  private void refresh() {
    if (!state.tryBeginRecreation()) {
      log.debug("Skipping cache refresh, a creation is already in flight");
      return;
    }
    createAndInstall("refresh");
  }

  /** Runs with the recreation slot held and always releases it. */
  private void createAndInstall(String reason) {
    String created = null;
    try {
      created = createCache();
    } catch (RuntimeException e) {
      log.warn(
          "Cache {} failed, continuing uncached: {} at {}",
          reason,
          ExceptionUtil.toErrorDetails(e),
          ExceptionUtil.formatCompactStackTrace(e));
    } finally {
      if (created == null) {
        state.abortRecreation();
      }
    }
    if (created == null) {
      return;
    }

    CacheState.Installation installation = state.finishRecreation(created);
    if (!installation.installed()) {
      log.debug("Agent closed during cache {}, releasing {}", reason, created);
      deleteQuietly(CallContext.background().withTimeout(closeTimeout), created);
      return;
    }
    log.info("Cache {} succeeded, now using {}", reason, created);
    String replaced = installation.replaced();
    if (replaced != null && !replaced.equals(created)) {
      deleteQuietly(lifetime.withTimeout(createTimeout), replaced);
    }
  }

  private void deleteQuietly(CallContext ctx, String handle) {
    try {
      provider.deleteCachedConfig(ctx, handle);
      log.debug("Deleted cache {}", handle);
    } catch (RuntimeException e) {
      log.warn("Failed to delete cache {}: {}", handle, ExceptionUtil.toErrorDetails(e));
    }
  }

  private void stopExecutor() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Cache maintenance did not stop within {}", closeTimeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static ScheduledExecutorService newMaintenanceExecutor() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "agent-cache-maintenance");
          thread.setDaemon(true);
          return thread;
        });
  }

  private static Logger defaultLogger() {
    return LoggingService.getLogger(Agent.class);
  }

  /** Builder for agents with non-default maintenance settings. */
  public static final class Builder {
    private final Provider provider;
    private final String systemPrompt;
    private final Duration ttl;
    private Logger logger;
    private Duration refreshInterval;
    private Duration createTimeout = DEFAULT_CREATE_TIMEOUT;
    private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
    private ScheduledExecutorService maintenanceExecutor;

    private Builder(Provider provider, String systemPrompt, Duration ttl) {
      this.provider = Objects.requireNonNull(provider, "provider");
      this.systemPrompt = Objects.requireNonNull(systemPrompt, "systemPrompt");
      this.ttl = requirePositive(ttl, "ttl");
    }

    public Builder logger(Logger logger) {
      this.logger = logger;
      return this;
    }

    /** Enables proactive refresh every {@code interval}; {@code null} disables it. */
    public Builder refreshInterval(Duration interval) {
      this.refreshInterval = interval == null ? null : requirePositive(interval, "refreshInterval");
      return this;
    }

    /** Deadline for cache creation calls issued by the agent itself. */
    public Builder createTimeout(Duration timeout) {
      this.createTimeout = requirePositive(timeout, "createTimeout");
      return this;
    }

    /** Upper bound for stopping background maintenance on close. */
    public Builder closeTimeout(Duration timeout) {
      this.closeTimeout = requirePositive(timeout, "closeTimeout");
      return this;
    }

    /**
     * Executor for recreation and refresh. A supplied executor is not shut down by the agent.
     * Without one, the agent owns a single daemon thread.
     */
    public Builder maintenanceExecutor(ScheduledExecutorService executor) {
      this.maintenanceExecutor = executor;
      return this;
    }

    public Agent build() {
      return new Agent(this);
    }

    private static Duration requirePositive(Duration value, String name) {
      Objects.requireNonNull(value, name);
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(name + " must be positive: " + value);
      }
      return value;
    }
  }
}
