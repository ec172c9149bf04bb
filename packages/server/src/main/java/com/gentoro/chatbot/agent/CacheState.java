package com.gentoro.chatbot.agent;

import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable cache state of one {@link Agent}: the current handle, the recreation-in-progress flag and
 * the closed flag, all guarded by a single read/write lock.
 *
 * <p>Every transition is a single critical section, so check-and-set operations such as {@link
 * #tryBeginRecreation()} are atomic. A {@code null} handle means no cache exists.
 */
final class CacheState {

  /** Consistent view of handle and closed flag taken under the read lock. */
  record Snapshot(String handle, boolean closed) {}

  /** Outcome of {@link #finishRecreation(String)}. {@code replaced} is the displaced handle. */
  record Installation(boolean installed, String replaced) {}

  /** Outcome of {@link #markClosed()}. {@code handle} is the handle to release, if any. */
  record Closing(boolean firstClose, String handle) {}

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private String handle;
  private boolean recreating;
  private boolean closed;

  CacheState(String initialHandle) {
    this.handle = initialHandle;
  }

  Snapshot snapshot() {
    lock.readLock().lock();
    try {
      return new Snapshot(handle, closed);
    } finally {
      lock.readLock().unlock();
    }
  }

  String handle() {
    return snapshot().handle();
  }

  boolean isClosed() {
    return snapshot().closed();
  }

  boolean isRecreating() {
    lock.readLock().lock();
    try {
      return recreating;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Clears the handle only if it still equals {@code stale}. Returns false when another caller
   * already cleared or replaced it, or when the agent is closed.
   */
  boolean invalidate(String stale) {
    lock.writeLock().lock();
    try {
      if (closed || handle == null || !handle.equals(stale)) {
        return false;
      }
      handle = null;
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Claims the single recreation slot. Returns false if it is taken or the agent is closed. */
  boolean tryBeginRecreation() {
    lock.writeLock().lock();
    try {
      if (closed || recreating) {
        return false;
      }
      recreating = true;
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Releases the recreation slot and installs {@code newHandle} unless the agent was closed in
   * the meantime, in which case the caller owns {@code newHandle} and must release it.
   */
  Installation finishRecreation(String newHandle) {
    lock.writeLock().lock();
    try {
      recreating = false;
      if (closed) {
        return new Installation(false, null);
      }
      String replaced = handle;
      handle = newHandle;
      return new Installation(true, replaced);
    } finally {
      lock.writeLock().unlock();
    }
  }

  void abortRecreation() {
    lock.writeLock().lock();
    try {
      recreating = false;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Moves to the closed state once and hands over the last handle. */
  Closing markClosed() {
    lock.writeLock().lock();
    try {
      if (closed) {
        return new Closing(false, null);
      }
      closed = true;
      String last = handle;
      handle = null;
      return new Closing(true, last);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
