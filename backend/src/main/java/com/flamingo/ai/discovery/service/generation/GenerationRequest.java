package com.flamingo.ai.discovery.service.generation;

import com.flamingo.ai.discovery.domain.entity.GenerationSettings;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.enums.OutputType;
import com.flamingo.ai.discovery.domain.enums.Tone;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Builder;

/**
 * Parameters of one generation. Embedded into the output it creates as {@link
 * GenerationSettings}.
 *
 * @param notebookId notebook to generate from
 * @param title output title; the template name is used when absent
 * @param outputType kind of output
 * @param sourceIds sources to draw from; empty means every active source
 * @param templateId stored template to use, or null for the built-in one
 * @param customPrompt extra user instructions, or null
 * @param tone writing tone, or null to leave it to the model
 * @param targetLength target length in words, or null
 * @param maxSources maximum number of excerpts retrieved
 * @param temperature sampling temperature
 * @param maxTokens token budget for prompt and completion together
 * @param includeReferences append a references section listing cited sources
 */
@Builder(toBuilder = true)
public record GenerationRequest(
    UUID notebookId,
    String title,
    OutputType outputType,
    List<UUID> sourceIds,
    String templateId,
    String customPrompt,
    Tone tone,
    Integer targetLength,
    int maxSources,
    double temperature,
    int maxTokens,
    boolean includeReferences) {

  public static final int DEFAULT_MAX_SOURCES = 10;
  public static final double DEFAULT_TEMPERATURE = 0.7;
  public static final int DEFAULT_MAX_TOKENS = 8192;
  public static final int DEFAULT_TARGET_LENGTH = 550;
  public static final int MIN_TARGET_LENGTH = 100;
  public static final int MAX_TARGET_LENGTH = 2000;
  public static final int MAX_CUSTOM_PROMPT_LENGTH = 5000;

  public GenerationRequest {
    sourceIds = sourceIds == null ? List.of() : List.copyOf(sourceIds);
  }

  /** Builder pre-filled with the defaults for document generation. */
  public static class GenerationRequestBuilder {
    private List<UUID> sourceIds = List.of();
    private Tone tone = Tone.INFORMATIVE;
    private Integer targetLength = DEFAULT_TARGET_LENGTH;
    private int maxSources = DEFAULT_MAX_SOURCES;
    private double temperature = DEFAULT_TEMPERATURE;
    private int maxTokens = DEFAULT_MAX_TOKENS;
    private boolean includeReferences = true;
  }

  /**
   * Checks parameter ranges.
   *
   * @return this request
   * @throws IllegalArgumentException on the first invalid parameter
   */
  public GenerationRequest validate() {
    if (notebookId == null) {
      throw new IllegalArgumentException("notebookId is required");
    }
    if (outputType == null) {
      throw new IllegalArgumentException("outputType is required");
    }
    if (title != null) {
      Output.requireValidTitle(title);
    }
    if (maxSources < 0) {
      throw new IllegalArgumentException("maxSources must not be negative");
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
    }
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be positive");
    }
    if (targetLength != null
        && (targetLength < MIN_TARGET_LENGTH || targetLength > MAX_TARGET_LENGTH)) {
      throw new IllegalArgumentException(
          "targetLength must be between "
              + MIN_TARGET_LENGTH
              + " and "
              + MAX_TARGET_LENGTH
              + " words");
    }
    if (customPrompt != null && customPrompt.length() > MAX_CUSTOM_PROMPT_LENGTH) {
      throw new IllegalArgumentException(
          "customPrompt must be at most " + MAX_CUSTOM_PROMPT_LENGTH + " characters");
    }
    return this;
  }

  public boolean hasCustomPrompt() {
    return customPrompt != null && !customPrompt.isBlank();
  }

  public GenerationSettings toSettings() {
    List<String> ids = new ArrayList<>();
    sourceIds.forEach(id -> ids.add(id.toString()));
    return GenerationSettings.builder()
        .sourceIds(ids)
        .templateId(templateId)
        .customPrompt(customPrompt)
        .tone(tone)
        .targetLength(targetLength)
        .maxSources(maxSources)
        .temperature(temperature)
        .maxTokens(maxTokens)
        .includeReferences(includeReferences)
        .build();
  }

  /** Rebuilds the request an output was last generated with. */
  public static GenerationRequest fromOutput(Output output) {
    GenerationSettings settings = output.getSettings();
    GenerationRequestBuilder builder =
        builder()
            .notebookId(output.getNotebookId())
            .title(output.getTitle())
            .outputType(output.getOutputType());
    if (settings == null) {
      return builder.build();
    }
    List<UUID> ids = new ArrayList<>();
    if (settings.getSourceIds() != null) {
      settings.getSourceIds().forEach(id -> ids.add(UUID.fromString(id)));
    }
    return builder
        .sourceIds(ids)
        .templateId(settings.getTemplateId())
        .customPrompt(settings.getCustomPrompt())
        .tone(settings.getTone())
        .targetLength(settings.getTargetLength())
        .maxSources(settings.getMaxSources())
        .temperature(settings.getTemperature())
        .maxTokens(settings.getMaxTokens())
        .includeReferences(settings.isIncludeReferences())
        .build();
  }
}
