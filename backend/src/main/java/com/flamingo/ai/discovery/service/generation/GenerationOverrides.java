package com.flamingo.ai.discovery.service.generation;

import com.flamingo.ai.discovery.domain.enums.Tone;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/** Optional changes applied to an output's stored settings on regenerate. Null keeps a value. */
@Builder
public record GenerationOverrides(
    String title,
    List<UUID> sourceIds,
    String templateId,
    String customPrompt,
    Tone tone,
    Integer targetLength,
    Integer maxSources,
    Double temperature,
    Integer maxTokens,
    Boolean includeReferences) {

  public static GenerationOverrides none() {
    return builder().build();
  }

  public GenerationRequest applyTo(GenerationRequest base) {
    GenerationRequest.GenerationRequestBuilder builder = base.toBuilder();
    if (title != null) {
      builder.title(title);
    }
    if (sourceIds != null) {
      builder.sourceIds(sourceIds);
    }
    if (templateId != null) {
      builder.templateId(templateId);
    }
    if (customPrompt != null) {
      builder.customPrompt(customPrompt);
    }
    if (tone != null) {
      builder.tone(tone);
    }
    if (targetLength != null) {
      builder.targetLength(targetLength);
    }
    if (maxSources != null) {
      builder.maxSources(maxSources);
    }
    if (temperature != null) {
      builder.temperature(temperature);
    }
    if (maxTokens != null) {
      builder.maxTokens(maxTokens);
    }
    if (includeReferences != null) {
      builder.includeReferences(includeReferences);
    }
    return builder.build();
  }
}
