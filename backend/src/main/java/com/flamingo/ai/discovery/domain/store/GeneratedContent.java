package com.flamingo.ai.discovery.domain.store;

import java.util.List;
import java.util.Map;

/** Result of a successful generation, written in one step when an output completes. */
public record GeneratedContent(
    String content, List<String> sourceReferences, int wordCount, Map<String, String> metadata) {

  public GeneratedContent {
    sourceReferences = List.copyOf(sourceReferences);
    metadata = Map.copyOf(metadata);
  }
}
