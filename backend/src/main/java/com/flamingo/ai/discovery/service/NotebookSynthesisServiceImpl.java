package com.flamingo.ai.discovery.service;

import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.store.SourceStore;
import com.flamingo.ai.discovery.service.generation.GenerationOrchestrator;
import com.flamingo.ai.discovery.service.generation.GenerationOverrides;
import com.flamingo.ai.discovery.service.generation.GenerationRequest;
import com.flamingo.ai.discovery.service.qa.QaAnswer;
import com.flamingo.ai.discovery.service.qa.QaSynthesizer;
import com.flamingo.ai.discovery.service.rag.chunking.ChunkIndexer;
import com.flamingo.ai.discovery.service.rag.chunking.IndexReport;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalEngine;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/** Implementation of the NotebookSynthesisService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotebookSynthesisServiceImpl implements NotebookSynthesisService {

  private final ChunkIndexer chunkIndexer;
  private final RetrievalEngine retrievalEngine;
  private final GenerationOrchestrator generationOrchestrator;
  private final QaSynthesizer qaSynthesizer;
  private final SourceStore sourceStore;

  @Override
  public IndexReport indexNotebook(UUID notebookId, boolean force) {
    return chunkIndexer.index(notebookId, sourceStore.findActive(notebookId), force);
  }

  @Override
  @Async("indexingExecutor")
  public CompletableFuture<IndexReport> indexNotebookAsync(UUID notebookId, boolean force) {
    log.debug("Indexing notebook {} asynchronously", notebookId);
    return CompletableFuture.completedFuture(indexNotebook(notebookId, force));
  }

  @Override
  public void deleteNotebookVectors(UUID notebookId) {
    chunkIndexer.deleteNotebook(notebookId);
  }

  @Override
  public long countVectors(UUID notebookId) {
    return chunkIndexer.countVectors(notebookId);
  }

  @Override
  public List<RetrievalResult> searchSimilar(
      UUID notebookId, String query, int limit, double minRelevance) {
    return retrievalEngine.search(notebookId, query, limit, minRelevance);
  }

  @Override
  public Output generateOutput(GenerationRequest request) {
    return generationOrchestrator.generate(request);
  }

  @Override
  @Async("generationExecutor")
  public CompletableFuture<Output> generateOutputAsync(GenerationRequest request) {
    log.debug("Generating {} output asynchronously", request.outputType());
    return CompletableFuture.completedFuture(generationOrchestrator.generate(request));
  }

  @Override
  public Output regenerateOutput(UUID outputId, GenerationOverrides overrides) {
    return generationOrchestrator.regenerate(outputId, overrides);
  }

  @Override
  public QaAnswer askQuestion(
      UUID notebookId, String question, int maxSources, double temperature, int maxTokens) {
    return qaSynthesizer.ask(notebookId, question, maxSources, temperature, maxTokens);
  }

  @Override
  public QaAnswer askQuestion(UUID notebookId, String question) {
    return qaSynthesizer.ask(notebookId, question);
  }
}
