package com.gentoro.onerag.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.gentoro.onerag.exception.SerializationException;
import java.util.Map;

/** Shared Jackson mappers. JSON for payloads and LLM answers, YAML for prompt files. */
public final class JacksonUtility {
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private static final ObjectMapper JSON =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  private static final ObjectMapper YAML =
      YAMLMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON;
  }

  public static ObjectMapper getYamlMapper() {
    return YAML;
  }

  public static String toJson(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
    }
  }

  /** JSON object text as a map; {@code null} or blank text is an empty map. */
  public static Map<String, Object> toMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return JSON.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Expected a JSON object", e);
    }
  }
}
