package com.flamingo.ai.tabbacklog.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for free-form metadata maps persisted as a JSON object in a TEXT column. */
@Converter
@Slf4j
public class JsonMapConverter implements AttributeConverter<Map<String, Object>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(Map<String, Object> attribute) {
    try {
      return MAPPER.writeValueAsString(attribute == null ? Map.of() : attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize metadata: " + e.getMessage(), e);
    }
  }

  @Override
  public Map<String, Object> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return new LinkedHashMap<>();
    }
    try {
      return MAPPER.readValue(dbData, MAP_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize metadata column: {}", e.getMessage());
      return new LinkedHashMap<>();
    }
  }
}
