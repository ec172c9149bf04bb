package com.gentoro.chatbot.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.chatbot.exception.SerializationException;

public class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JacksonUtility() {}

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  /** Parses a YAML document into a tree; an empty document yields a missing node. */
  public static JsonNode readYamlTree(String yaml) {
    try {
      JsonNode node = YAML_MAPPER.readTree(yaml);
      return node == null ? YAML_MAPPER.missingNode() : node;
    } catch (Exception e) {
      throw new SerializationException("Failed to parse YAML document", e);
    }
  }
}
