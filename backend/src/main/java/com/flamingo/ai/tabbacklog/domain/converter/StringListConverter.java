package com.flamingo.ai.tabbacklog.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores ordered tag and project lists as a JSON array in a TEXT column. An empty list is written
 * as {@code []} so that order-sensitive readers never see null.
 */
@Converter
@Slf4j
public class StringListConverter implements AttributeConverter<List<String>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<String> values) {
    try {
      return MAPPER.writeValueAsString(values == null ? List.of() : values);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize list column: " + e.getMessage(), e);
    }
  }

  @Override
  public List<String> convertToEntityAttribute(String column) {
    if (column == null || column.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return MAPPER.readValue(column, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Unreadable list column, treating as empty: {}", e.getMessage());
      return new ArrayList<>();
    }
  }
}
