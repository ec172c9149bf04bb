package com.gentoro.chatbot.prompt;

import java.util.List;
import java.util.Map;

/**
 * Immutable prompt template made of sections. Rendering evaluates every enabled section with the
 * given variables and joins the results with a blank line.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "system"). */
  String id();

  /** Read-only view of the sections defined by this template. */
  List<PromptSection> sections();

  /**
   * Renders the enabled sections.
   *
   * @throws com.gentoro.chatbot.exception.PromptException when a variable is missing or nothing is
   *     enabled
   */
  String render(Map<String, Object> variables);

  /** A single prompt section definition. */
  record PromptSection(String id, boolean enabled, String content) {}
}
