package com.gentoro.chatbot.context;

import com.gentoro.chatbot.exception.LlmTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellable call context carried as the first argument of every provider and agent operation.
 *
 * <p>A context has an optional deadline and a cancellation flag. Children inherit both: a child
 * deadline is never later than its parent's, and cancelling a parent cancels every child created
 * from it. Contexts are thread-safe; one context is typically shared by all calls made on behalf
 * of a single inbound request.
 *
 * <pre>
 *   CallContext ctx = CallContext.background().withTimeout(Duration.ofSeconds(30));
 *   String reply = agent.generate(ctx, "hello");
 * </pre>
 */
public final class CallContext {

  /** Handle returned by {@link #onCancel(Runnable)}; closing it unregisters the callback. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }

  private final CallContext parent;
  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  private CallContext(CallContext parent, Instant deadline, Clock clock) {
    this.parent = parent;
    this.deadline = deadline;
    this.clock = clock;
  }

  /** Root context without deadline. It is only cancelled when {@link #cancel()} is called on it. */
  public static CallContext background() {
    return new CallContext(null, null, Clock.systemUTC());
  }

  /** Root context using the given clock for deadline evaluation. Intended for tests. */
  public static CallContext background(Clock clock) {
    return new CallContext(null, null, Objects.requireNonNull(clock, "clock"));
  }

  /** Child whose deadline is {@code timeout} from now, capped by this context's deadline. */
  public CallContext withTimeout(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return withDeadline(clock.instant().plus(timeout));
  }

  /** Child whose deadline is the earlier of {@code deadline} and this context's deadline. */
  public CallContext withDeadline(Instant deadline) {
    Objects.requireNonNull(deadline, "deadline");
    Instant effective =
        this.deadline != null && this.deadline.isBefore(deadline) ? this.deadline : deadline;
    return new CallContext(this, effective, clock);
  }

  /**
   * Cancels this context and, through {@link #isCancelled()}, every context derived from it.
   * Callbacks registered here or on a descendant run once, on the calling thread.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (Runnable callback : callbacks) {
      callback.run();
    }
    callbacks.clear();
  }

  public boolean isCancelled() {
    return cancelled.get() || (parent != null && parent.isCancelled());
  }

  public boolean isExpired() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  /** True once the context is cancelled or past its deadline. */
  public boolean isDone() {
    return isCancelled() || isExpired();
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /** Time left until the deadline (zero when expired), or empty when there is no deadline. */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(clock.instant(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Registers a callback fired when this context or one of its ancestors is cancelled. Runs
   * immediately when the context is already cancelled. Close the returned registration once the
   * guarded operation finished, so long-lived parents do not accumulate callbacks.
   */
  public Registration onCancel(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    if (isCancelled()) {
      callback.run();
      return () -> {};
    }
    Runnable once = runOnce(callback);
    for (CallContext c = this; c != null; c = c.parent) {
      c.callbacks.add(once);
    }
    // cancel() may have raced with the registration above
    if (isCancelled()) {
      once.run();
    }
    return () -> {
      for (CallContext c = this; c != null; c = c.parent) {
        c.callbacks.remove(once);
      }
    };
  }

  private static Runnable runOnce(Runnable callback) {
    AtomicBoolean fired = new AtomicBoolean(false);
    return () -> {
      if (fired.compareAndSet(false, true)) {
        callback.run();
      }
    };
  }

  /** Throws {@link LlmTimeoutException} when the context is cancelled or past its deadline. */
  public void throwIfDone() {
    if (isCancelled()) {
      throw new LlmTimeoutException("call context cancelled");
    }
    if (isExpired()) {
      throw new LlmTimeoutException("call context deadline exceeded at " + deadline);
    }
  }

  @Override
  public String toString() {
    return "CallContext{" + "deadline=" + deadline + ", cancelled=" + isCancelled() + '}';
  }
}
