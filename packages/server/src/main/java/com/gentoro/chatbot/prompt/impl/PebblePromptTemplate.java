package com.gentoro.chatbot.prompt.impl;

import com.gentoro.chatbot.exception.PromptException;
import com.gentoro.chatbot.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Pebble-based implementation of an immutable {@link PromptTemplate}. */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    try {
      this.compiled =
          this.sections.stream()
              .map(s -> new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())))
              .collect(Collectors.toUnmodifiableList());
    } catch (RuntimeException e) {
      throw new PromptException("Failed to compile prompt template '" + id + "'", e);
    }
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public String render(Map<String, Object> variables) {
    Map<String, Object> ctx = variables == null ? Map.of() : new HashMap<>(variables);
    List<String> out = new ArrayList<>();
    for (CompiledSection cs : compiled) {
      PromptSection s = cs.section();
      if (!s.enabled()) {
        continue;
      }
      try {
        Writer writer = new StringWriter();
        cs.template().evaluate(writer, ctx);
        out.add(writer.toString().strip());
      } catch (Exception e) {
        throw new PromptException(
            "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
      }
    }
    if (out.isEmpty()) {
      throw new PromptException("Prompt template '" + id + "' has no enabled sections");
    }
    return String.join("\n\n", out);
  }
}
