package com.gentoro.chatbot.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.chatbot.exception.PromptException;
import com.gentoro.chatbot.prompt.PromptTemplate;
import com.gentoro.chatbot.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Turns the YAML of a prompt file into a {@link PebblePromptTemplate}. */
final class PromptDefinitionReader {

  private PromptDefinitionReader() {}

  static PromptTemplate read(String id, String yamlContent) {
    JsonNode root = JacksonUtility.readYamlTree(yamlContent);
    JsonNode arr = root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new PromptException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (JsonNode n : arr) {
      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new PromptException("Missing section id in prompt: " + id);
      }
      if (!seen.add(sectionId)) {
        throw new PromptException(
            "Duplicate section id '" + sectionId + "' in prompt: " + id);
      }
      boolean enabled = n.path("enabled").asBoolean(true);
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new PromptException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(new PromptTemplate.PromptSection(sectionId, enabled, content));
    }
    return new PebblePromptTemplate(id, sections);
  }

  static String normalizeName(String name) {
    if (name == null || name.isBlank()) {
      throw new PromptException("Prompt name must not be blank");
    }
    String id = name.trim();
    return id.charAt(0) == '/' ? id.substring(1) : id;
  }
}
