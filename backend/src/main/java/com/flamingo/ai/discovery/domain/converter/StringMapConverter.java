package com.flamingo.ai.discovery.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.LinkedHashMap;
import java.util.Map;

/** Persists {@code Map<String, String>} as a JSON object. Entry order survives a round trip. */
@Converter
public class StringMapConverter extends JsonColumnConverter<Map<String, String>> {

  public StringMapConverter() {
    super(new TypeReference<>() {}, Map::isEmpty, LinkedHashMap::new);
  }
}
