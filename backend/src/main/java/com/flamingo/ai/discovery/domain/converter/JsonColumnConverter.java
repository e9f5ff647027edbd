package com.flamingo.ai.discovery.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Base JPA converter storing a small collection as JSON in a TEXT column. Empty values are stored
 * as NULL and read back as an empty collection.
 *
 * @param <T> the attribute type
 */
abstract class JsonColumnConverter<T> implements AttributeConverter<T, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TypeReference<T> type;
  private final Predicate<T> isEmpty;
  private final Supplier<T> emptyValue;

  JsonColumnConverter(TypeReference<T> type, Predicate<T> isEmpty, Supplier<T> emptyValue) {
    this.type = type;
    this.isEmpty = isEmpty;
    this.emptyValue = emptyValue;
  }

  @Override
  public String convertToDatabaseColumn(T attribute) {
    if (attribute == null || isEmpty.test(attribute)) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize column value: " + e.getMessage(), e);
    }
  }

  @Override
  public T convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return emptyValue.get();
    }
    try {
      return MAPPER.readValue(dbData, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt JSON column value: " + e.getMessage(), e);
    }
  }
}
