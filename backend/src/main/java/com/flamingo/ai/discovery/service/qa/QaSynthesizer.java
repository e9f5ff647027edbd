package com.flamingo.ai.discovery.service.qa;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.domain.entity.Source;
import com.flamingo.ai.discovery.domain.enums.OutputType;
import com.flamingo.ai.discovery.domain.store.SourceStore;
import com.flamingo.ai.discovery.exception.EmptyContextException;
import com.flamingo.ai.discovery.service.generation.GenerationRequest;
import com.flamingo.ai.discovery.service.generation.ResilientLlmCaller;
import com.flamingo.ai.discovery.service.generation.prompt.CitationMarkers;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import com.flamingo.ai.discovery.service.generation.prompt.PromptAssembler;
import com.flamingo.ai.discovery.service.generation.template.ResolvedTemplate;
import com.flamingo.ai.discovery.service.generation.template.TemplateResolver;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalEngine;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import com.google.common.base.Stopwatch;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers one question from a notebook's sources. Nothing is persisted.
 *
 * <p>The answer only ever reports excerpts that were in the prompt. When nothing relevant is found
 * the fixed no-information answer is returned instead of calling the model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QaSynthesizer {

  private final RetrievalEngine retrievalEngine;
  private final TemplateResolver templateResolver;
  private final PromptAssembler promptAssembler;
  private final ResilientLlmCaller llmCaller;
  private final SourceStore sourceStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Answers with the configured number of sources, temperature and token budget. */
  public QaAnswer ask(UUID notebookId, String question) {
    RagConfig.Qa qa = ragConfig.getQa();
    return ask(notebookId, question, qa.getMaxSources(), qa.getTemperature(), qa.getMaxTokens());
  }

  /**
   * Answers a question.
   *
   * @throws IllegalArgumentException when the question is blank or a parameter is out of range
   * @throws com.flamingo.ai.discovery.exception.GenerationFailureException when the model keeps
   *     failing
   */
  @Timed(value = "qa.ask", description = "Time to answer a question")
  public QaAnswer ask(
      UUID notebookId, String question, int maxSources, double temperature, int maxTokens) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ResolvedTemplate template = templateResolver.forQuestion(question);
    GenerationRequest request =
        GenerationRequest.builder()
            .notebookId(notebookId)
            .outputType(OutputType.QA_ANSWER)
            .tone(null)
            .targetLength(null)
            .maxSources(maxSources)
            .temperature(temperature)
            .maxTokens(maxTokens)
            .includeReferences(false)
            .build()
            .validate();

    Set<UUID> allowed = activeSourceIds(notebookId);
    List<RetrievalResult> retrieved =
        allowed.isEmpty()
            ? List.of()
            : retrievalEngine.search(
                notebookId,
                question,
                maxSources,
                ragConfig.getRetrieval().getMinRelevance(),
                allowed);

    Prompt prompt;
    try {
      prompt = promptAssembler.assemble(request, retrieved, template);
    } catch (EmptyContextException e) {
      log.info("No context for question in notebook {}: {}", notebookId, e.getMessage());
      meterRegistry.counter("qa.answers", "grounded", "false").increment();
      return new QaAnswer(
          question,
          ragConfig.getQa().getNoInformationAnswer(),
          List.of(),
          0.0,
          stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    String answer = llmCaller.call(prompt, temperature).strip();
    CitationMarkers.Citations citations = CitationMarkers.extract(answer, prompt.excerptRefs());

    List<QaSourceItem> sources = new ArrayList<>();
    double citedRelevance = 0.0;
    int cited = 0;
    for (RetrievalResult excerpt : prompt.excerpts()) {
      boolean isCited = citations.contains(excerpt.ref());
      if (isCited) {
        citedRelevance += excerpt.relevanceScore();
        cited++;
      }
      sources.add(
          new QaSourceItem(
              excerpt.text(),
              excerpt.sourceId(),
              excerpt.sourceName(),
              excerpt.chunkIndex(),
              excerpt.relevanceScore(),
              isCited));
    }
    Double confidence = cited == 0 ? null : Math.max(0.0, Math.min(1.0, citedRelevance / cited));

    meterRegistry.counter("qa.answers", "grounded", "true").increment();
    log.info(
        "Answered question for notebook {} from {} excerpts, {} cited, confidence {}",
        notebookId,
        sources.size(),
        cited,
        confidence);
    return new QaAnswer(
        question, answer, sources, confidence, stopwatch.elapsed(TimeUnit.MILLISECONDS));
  }

  private Set<UUID> activeSourceIds(UUID notebookId) {
    Set<UUID> ids = new HashSet<>();
    for (Source source : sourceStore.findActive(notebookId)) {
      ids.add(source.getId());
    }
    return ids;
  }
}
