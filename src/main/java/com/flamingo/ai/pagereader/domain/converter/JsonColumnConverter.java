package com.flamingo.ai.pagereader.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * Base converter that stores a value as JSON in a TEXT column. Serialization errors are rethrown so
 * that a row is never silently written without its content.
 *
 * @param <T> attribute type
 */
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<T> type;

  protected JsonColumnConverter(TypeReference<T> type) {
    this.type = type;
  }

  /** Value returned for NULL or blank columns. */
  protected abstract T emptyValue();

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize column value: " + e.getMessage(), e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to deserialize column value: " + e.getMessage(), e);
    }
  }
}
