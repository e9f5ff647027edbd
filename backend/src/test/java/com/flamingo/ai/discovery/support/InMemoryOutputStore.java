package com.flamingo.ai.discovery.support;

import com.flamingo.ai.discovery.domain.entity.GenerationSettings;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.enums.OutputStatus;
import com.flamingo.ai.discovery.domain.store.GeneratedContent;
import com.flamingo.ai.discovery.domain.store.OutputStore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Output store with the same conditional transitions as the JPA one, guarded by one monitor. */
public class InMemoryOutputStore implements OutputStore {

  private final Map<UUID, Output> outputs = new HashMap<>();

  @Override
  public synchronized Output create(Output output) {
    Output stored =
        output.toBuilder()
            .id(output.getId() == null ? UUID.randomUUID() : output.getId())
            .status(OutputStatus.DRAFT)
            .createdAt(LocalDateTime.now())
            .updatedAt(LocalDateTime.now())
            .build();
    outputs.put(stored.getId(), stored);
    return copy(stored);
  }

  @Override
  public synchronized Optional<Output> findById(UUID outputId) {
    return Optional.ofNullable(outputs.get(outputId)).map(InMemoryOutputStore::copy);
  }

  @Override
  public synchronized boolean startGeneration(UUID outputId) {
    Output output = outputs.get(outputId);
    if (output == null || output.getStatus() != OutputStatus.DRAFT) {
      return false;
    }
    output.setStatus(OutputStatus.GENERATING);
    output.setGenerationStartedAt(LocalDateTime.now());
    output.setLastError(null);
    return true;
  }

  @Override
  public synchronized boolean restartGeneration(UUID outputId) {
    Output output = outputs.get(outputId);
    if (output == null || !output.getStatus().isTerminal()) {
      return false;
    }
    output.setStatus(OutputStatus.GENERATING);
    output.setVersion(output.getVersion() + 1);
    output.setGenerationStartedAt(LocalDateTime.now());
    output.setLastError(null);
    return true;
  }

  @Override
  public synchronized void updateSettings(
      UUID outputId, String title, GenerationSettings settings) {
    Output output = outputs.get(outputId);
    if (output == null || output.getStatus() != OutputStatus.GENERATING) {
      throw new IllegalStateException("Output " + outputId + " is not GENERATING");
    }
    output.setTitle(title);
    output.setSettings(settings);
  }

  @Override
  public synchronized boolean complete(UUID outputId, GeneratedContent result) {
    Output output = outputs.get(outputId);
    if (output == null || output.getStatus() != OutputStatus.GENERATING) {
      return false;
    }
    output.setStatus(OutputStatus.COMPLETED);
    output.setContent(result.content());
    output.setSourceReferences(new ArrayList<>(result.sourceReferences()));
    output.setWordCount(result.wordCount());
    output.setMetadata(new LinkedHashMap<>(result.metadata()));
    output.setGeneratedAt(LocalDateTime.now());
    return true;
  }

  @Override
  public synchronized boolean fail(UUID outputId, String error) {
    Output output = outputs.get(outputId);
    if (output == null || output.getStatus() != OutputStatus.GENERATING) {
      return false;
    }
    output.setStatus(OutputStatus.FAILED);
    output.setLastError(error);
    Map<String, String> metadata = new LinkedHashMap<>(output.getMetadata());
    metadata.put("error", error);
    output.setMetadata(metadata);
    return true;
  }

  @Override
  public synchronized List<Output> findStaleGenerating(LocalDateTime startedBefore) {
    return outputs.values().stream()
        .filter(o -> o.getStatus() == OutputStatus.GENERATING)
        .filter(o -> o.getGenerationStartedAt().isBefore(startedBefore))
        .map(InMemoryOutputStore::copy)
        .toList();
  }

  /** Test hook: backdates the generation start of an output. */
  public synchronized void setGenerationStartedAt(UUID outputId, LocalDateTime startedAt) {
    outputs.get(outputId).setGenerationStartedAt(startedAt);
  }

  private static Output copy(Output output) {
    return output.toBuilder()
        .sourceReferences(new ArrayList<>(output.getSourceReferences()))
        .metadata(new LinkedHashMap<>(output.getMetadata()))
        .build();
  }
}
