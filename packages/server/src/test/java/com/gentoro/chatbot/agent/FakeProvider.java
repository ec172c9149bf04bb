package com.gentoro.chatbot.agent;

import com.gentoro.chatbot.context.CallContext;
import com.gentoro.chatbot.model.Provider;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Scripted {@link Provider} double. Create results are consumed in order; each entry is either a
 * handle or a {@link RuntimeException} to throw. Once the script is exhausted every create fails.
 */
final class FakeProvider implements Provider {
  final Queue<Object> createScript = new ConcurrentLinkedQueue<>();
  volatile BiFunction<String, String, String> cached = (handle, msg) -> "cached:" + msg;
  volatile BiFunction<String, String, String> uncached = (prompt, msg) -> "uncached:" + msg;
  volatile Consumer<String> delete = handle -> {};
  volatile CountDownLatch createGate;

  final AtomicInteger createCalls = new AtomicInteger();
  final AtomicInteger cachedCalls = new AtomicInteger();
  final AtomicInteger uncachedCalls = new AtomicInteger();
  final AtomicInteger deleteCalls = new AtomicInteger();
  final AtomicInteger closeCalls = new AtomicInteger();
  final AtomicInteger createsInFlight = new AtomicInteger();
  final AtomicInteger maxCreatesInFlight = new AtomicInteger();
  final List<String> cachedHandles = new CopyOnWriteArrayList<>();
  final List<String> deletedHandles = new CopyOnWriteArrayList<>();
  final List<CallContext> createContexts = new CopyOnWriteArrayList<>();
  final List<Duration> createTtls = new CopyOnWriteArrayList<>();

  FakeProvider creates(Object... results) {
    createScript.addAll(List.of(results));
    return this;
  }

  @Override
  public String generateText(CallContext ctx, String systemPrompt, String userMessage) {
    uncachedCalls.incrementAndGet();
    return uncached.apply(systemPrompt, userMessage);
  }

  @Override
  public String generateTextCached(CallContext ctx, String cacheHandle, String userMessage) {
    cachedCalls.incrementAndGet();
    cachedHandles.add(cacheHandle);
    return cached.apply(cacheHandle, userMessage);
  }

  @Override
  public String createCachedConfig(CallContext ctx, String systemPrompt, Duration ttl) {
    createCalls.incrementAndGet();
    createContexts.add(ctx);
    createTtls.add(ttl);
    int inFlight = createsInFlight.incrementAndGet();
    maxCreatesInFlight.accumulateAndGet(inFlight, Math::max);
    try {
      CountDownLatch gate = createGate;
      if (gate != null && !gate.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("create gate was never opened");
      }
      Object next = createScript.poll();
      if (next instanceof RuntimeException e) {
        throw e;
      }
      if (next == null) {
        throw new IllegalStateException("no scripted create result");
      }
      return (String) next;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    } finally {
      createsInFlight.decrementAndGet();
    }
  }

  @Override
  public void deleteCachedConfig(CallContext ctx, String cacheHandle) {
    deleteCalls.incrementAndGet();
    deletedHandles.add(cacheHandle);
    delete.accept(cacheHandle);
  }

  @Override
  public void close() {
    closeCalls.incrementAndGet();
  }

  boolean awaitCreateCalls(int expected) {
    return await(() -> createCalls.get() >= expected);
  }

  static boolean await(BooleanSupplier condition) {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      if (condition.getAsBoolean()) {
        return true;
      }
      try {
        Thread.sleep(5);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
    return condition.getAsBoolean();
  }
}
