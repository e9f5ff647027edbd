package com.flamingo.ai.discovery.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/** Persists {@code List<String>} as a JSON array. */
@Converter
public class StringListConverter extends JsonColumnConverter<List<String>> {

  public StringListConverter() {
    super(new TypeReference<>() {}, List::isEmpty, ArrayList::new);
  }
}
