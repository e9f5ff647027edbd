package com.flamingo.ai.discovery.service.generation;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.entity.Source;
import com.flamingo.ai.discovery.domain.store.GeneratedContent;
import com.flamingo.ai.discovery.domain.store.OutputStore;
import com.flamingo.ai.discovery.domain.store.SourceStore;
import com.flamingo.ai.discovery.exception.ConflictException;
import com.flamingo.ai.discovery.exception.GenerationFailureException;
import com.flamingo.ai.discovery.exception.OutputNotFoundException;
import com.flamingo.ai.discovery.service.generation.prompt.CitationMarkers;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import com.flamingo.ai.discovery.service.generation.prompt.PromptAssembler;
import com.flamingo.ai.discovery.service.generation.template.ResolvedTemplate;
import com.flamingo.ai.discovery.service.generation.template.TemplateResolver;
import com.flamingo.ai.discovery.service.generation.template.TemplateSection;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalEngine;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives the output lifecycle: DRAFT to GENERATING to COMPLETED or FAILED, and regenerate from a
 * terminal state back to GENERATING with a new version.
 *
 * <p>Everything that can fail for a caller-fixable reason (validation, template, retrieval, empty
 * context) runs before an output is created or moved, and is thrown. Once GENERATING is persisted
 * the LLM is called; a failed generation is recorded as FAILED and returned rather than thrown. A
 * cancelled call leaves the output GENERATING for {@link GenerationReconciler}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationOrchestrator {

  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private final TemplateResolver templateResolver;
  private final RetrievalEngine retrievalEngine;
  private final PromptAssembler promptAssembler;
  private final ResilientLlmCaller llmCaller;
  private final OutputStore outputStore;
  private final SourceStore sourceStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Generates a new output.
   *
   * @param request generation parameters
   * @return the output in COMPLETED or FAILED
   * @throws com.flamingo.ai.discovery.exception.EmptyContextException when there is nothing to
   *     ground the output on
   * @throws CancellationException when the calling thread is interrupted during the LLM call
   */
  @Timed(value = "generation.generate", description = "Time to generate an output")
  public Output generate(GenerationRequest request) {
    request.validate();
    if (request.title() == null) {
      request = request.toBuilder().title(request.outputType().getDisplayName()).build();
    }
    ResolvedTemplate template =
        templateResolver.resolve(request.templateId(), request.outputType());
    Prompt prompt = prepare(request, template);

    Output draft =
        Output.builder()
            .notebookId(request.notebookId())
            .title(request.title())
            .outputType(request.outputType())
            .settings(request.toSettings())
            .build();
    Output output = outputStore.create(draft);
    if (!outputStore.startGeneration(output.getId())) {
      throw new ConflictException(output.getId(), "Output " + output.getId() + " left DRAFT");
    }
    log.info(
        "Generating {} output {} for notebook {} with template '{}'",
        request.outputType(),
        output.getId(),
        request.notebookId(),
        template.name());
    return run(output.getId(), request, template, prompt);
  }

  /**
   * Regenerates an existing output, always producing a new version.
   *
   * @param outputId output to regenerate
   * @param overrides settings to change, or null to reuse the stored ones
   * @return the output in COMPLETED or FAILED
   * @throws OutputNotFoundException when the output does not exist
   * @throws ConflictException when a generation of the output is in flight
   */
  @Timed(value = "generation.regenerate", description = "Time to regenerate an output")
  public Output regenerate(UUID outputId, GenerationOverrides overrides) {
    Output existing =
        outputStore.findById(outputId).orElseThrow(() -> new OutputNotFoundException(outputId));
    if (!existing.getStatus().isTerminal()) {
      throw new ConflictException(
          outputId, "Output " + outputId + " is " + existing.getStatus() + ", cannot regenerate");
    }

    GenerationOverrides applied = overrides == null ? GenerationOverrides.none() : overrides;
    GenerationRequest request = applied.applyTo(GenerationRequest.fromOutput(existing)).validate();
    ResolvedTemplate template =
        templateResolver.resolve(request.templateId(), request.outputType());
    Prompt prompt = prepare(request, template);

    if (!outputStore.restartGeneration(outputId)) {
      throw new ConflictException(outputId, "Output " + outputId + " is already generating");
    }
    try {
      outputStore.updateSettings(outputId, request.title(), request.toSettings());
    } catch (RuntimeException e) {
      log.error("Could not store new settings of output {}", outputId, e);
      recordFailure(outputId, "Could not store settings: " + e.getMessage());
      throw e;
    }
    log.info(
        "Regenerating output {} (was version {}, {})",
        outputId,
        existing.getVersion(),
        existing.getStatus());
    return run(outputId, request, template, prompt);
  }

  private Prompt prepare(GenerationRequest request, ResolvedTemplate template) {
    Set<UUID> allowed = allowedSources(request);
    List<RetrievalResult> retrieved =
        allowed.isEmpty()
            ? List.of()
            : retrievalEngine.search(
                request.notebookId(),
                retrievalQuery(request, template),
                request.maxSources(),
                ragConfig.getRetrieval().getMinRelevance(),
                allowed);
    return promptAssembler.assemble(request, retrieved, template);
  }

  /** Active sources of the notebook, narrowed to the requested subset when one is given. */
  private Set<UUID> allowedSources(GenerationRequest request) {
    Set<UUID> active = new HashSet<>();
    for (Source source : sourceStore.findActive(request.notebookId())) {
      if (!source.isDeleted()) {
        active.add(source.getId());
      }
    }
    if (!request.sourceIds().isEmpty()) {
      active.retainAll(new HashSet<>(request.sourceIds()));
    }
    return active;
  }

  private static String retrievalQuery(GenerationRequest request, ResolvedTemplate template) {
    if (request.hasCustomPrompt()) {
      return request.customPrompt();
    }
    String sections =
        template.sections().stream().map(TemplateSection::name).collect(Collectors.joining(", "));
    String subject =
        request.title() != null ? request.title() : request.outputType().getDisplayName();
    return subject + ": " + sections;
  }

  private Output run(
      UUID outputId, GenerationRequest request, ResolvedTemplate template, Prompt prompt) {
    try {
      String answer = llmCaller.call(prompt, request.temperature());
      complete(outputId, request, template, prompt, answer);
    } catch (GenerationFailureException e) {
      log.warn("Generation of output {} failed: {}", outputId, e.getMessage());
      recordFailure(outputId, e.getMessage());
    } catch (CancellationException e) {
      log.warn("Generation of output {} cancelled, leaving it GENERATING", outputId);
      throw e;
    } catch (RuntimeException e) {
      log.error("Unexpected error while generating output {}", outputId, e);
      recordFailure(outputId, "Unexpected error: " + e.getMessage());
      throw e;
    }
    return outputStore.findById(outputId).orElseThrow(() -> new OutputNotFoundException(outputId));
  }

  private void complete(
      UUID outputId,
      GenerationRequest request,
      ResolvedTemplate template,
      Prompt prompt,
      String answer) {
    CitationMarkers.Citations citations = CitationMarkers.extract(answer, prompt.excerptRefs());
    List<UUID> citedSources = citations.sourceIds();

    String content = answer.strip();
    if (request.includeReferences() && !citedSources.isEmpty()) {
      String withReferences = content + referencesSection(citedSources, prompt);
      if (withReferences.length() <= ragConfig.getGeneration().getMaxContentLength()) {
        content = withReferences;
      } else {
        log.warn("Skipping references for output {}: content would exceed the limit", outputId);
      }
    }

    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("template", template.name());
    metadata.put("excerpts", String.valueOf(prompt.excerpts().size()));
    metadata.put("prompt_tokens", String.valueOf(prompt.estimatedTokens()));
    metadata.put("citations", String.valueOf(citations.cited().size()));
    metadata.put("uncited_markers", String.valueOf(citations.unmatched()));

    GeneratedContent result =
        new GeneratedContent(
            content,
            citedSources.stream().map(UUID::toString).toList(),
            WORDS.splitToList(content).size(),
            metadata);
    if (outputStore.complete(outputId, result)) {
      meterRegistry
          .counter("generation.completed", "type", request.outputType().name())
          .increment();
      log.info(
          "Output {} completed: {} words, {} cited sources, {} unmatched markers",
          outputId,
          result.wordCount(),
          citedSources.size(),
          citations.unmatched());
    }
  }

  private void recordFailure(UUID outputId, String error) {
    meterRegistry.counter("generation.failed").increment();
    if (!outputStore.fail(outputId, error)) {
      log.warn("Output {} was no longer GENERATING when recording failure", outputId);
    }
  }

  private static String referencesSection(List<UUID> citedSources, Prompt prompt) {
    Map<UUID, String> names = new LinkedHashMap<>();
    for (RetrievalResult excerpt : prompt.excerpts()) {
      names.putIfAbsent(excerpt.sourceId(), excerpt.sourceName());
    }
    StringBuilder sb = new StringBuilder("\n\n## References\n");
    int n = 1;
    for (UUID sourceId : citedSources) {
      String name = names.get(sourceId);
      sb.append('\n')
          .append(n++)
          .append(". ")
          .append(name == null || name.isBlank() ? sourceId.toString() : name);
    }
    return sb.toString();
  }
}
