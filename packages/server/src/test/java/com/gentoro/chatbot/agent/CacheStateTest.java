package com.gentoro.chatbot.agent;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class CacheStateTest {

  @Test
  void invalidateIsCompareAndClear() {
    CacheState state = new CacheState("cache-A");

    assertFalse(state.invalidate("cache-old"));
    assertEquals("cache-A", state.handle());

    assertTrue(state.invalidate("cache-A"));
    assertNull(state.handle());
    assertFalse(state.invalidate("cache-A"));
  }

  @Test
  void staleInvalidationDoesNotClearRecreatedHandle() {
    CacheState state = new CacheState("cache-A");
    assertTrue(state.invalidate("cache-A"));
    assertTrue(state.tryBeginRecreation());
    state.finishRecreation("cache-B");

    assertFalse(state.invalidate("cache-A"));
    assertEquals("cache-B", state.handle());
  }

  @Test
  void onlyOneRecreationSlot() {
    CacheState state = new CacheState(null);

    assertTrue(state.tryBeginRecreation());
    assertTrue(state.isRecreating());
    assertFalse(state.tryBeginRecreation());

    state.abortRecreation();
    assertFalse(state.isRecreating());
    assertTrue(state.tryBeginRecreation());
  }

  @Test
  void finishRecreationReportsReplacedHandle() {
    CacheState state = new CacheState("cache-A");
    assertTrue(state.tryBeginRecreation());

    CacheState.Installation installation = state.finishRecreation("cache-B");

    assertTrue(installation.installed());
    assertEquals("cache-A", installation.replaced());
    assertEquals("cache-B", state.handle());
    assertFalse(state.isRecreating());
  }

  @Test
  void closeIsTerminalAndHandsOverHandleOnce() {
    CacheState state = new CacheState("cache-A");

    CacheState.Closing first = state.markClosed();
    CacheState.Closing second = state.markClosed();

    assertTrue(first.firstClose());
    assertEquals("cache-A", first.handle());
    assertFalse(second.firstClose());
    assertNull(second.handle());
    assertTrue(state.isClosed());
    assertNull(state.handle());
  }

  @Test
  void closedStateRefusesRecreationAndInstallation() {
    CacheState state = new CacheState("cache-A");
    assertTrue(state.tryBeginRecreation());
    state.markClosed();

    CacheState.Installation installation = state.finishRecreation("cache-B");

    assertFalse(installation.installed());
    assertNull(state.handle());
    assertFalse(state.isRecreating());
    assertFalse(state.tryBeginRecreation());
    assertFalse(state.invalidate("cache-A"));
  }
}
