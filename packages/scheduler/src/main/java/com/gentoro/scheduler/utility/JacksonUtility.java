package com.gentoro.scheduler.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson configuration. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Compact JSON text for the given node; {@code null} is written as {@code {}}. */
  public static String toJson(JsonNode node) {
    try {
      return JSON_MAPPER.writeValueAsString(node == null ? JSON_MAPPER.createObjectNode() : node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize JSON node", e);
    }
  }

  /** Reads a JSON document, returning {@link NullNode} for {@code null} input. */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return json == null ? NullNode.getInstance() : JSON_MAPPER.readTree(json);
  }
}
