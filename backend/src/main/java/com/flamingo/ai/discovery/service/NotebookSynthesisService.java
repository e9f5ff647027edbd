package com.flamingo.ai.discovery.service;

import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.service.generation.GenerationOverrides;
import com.flamingo.ai.discovery.service.generation.GenerationRequest;
import com.flamingo.ai.discovery.service.qa.QaAnswer;
import com.flamingo.ai.discovery.service.rag.chunking.IndexReport;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/** Entry point for indexing, retrieval, output generation and question answering. */
public interface NotebookSynthesisService {

  /**
   * Indexes every active source of a notebook.
   *
   * @param notebookId the notebook ID
   * @param force rebuild chunks of sources that are already indexed
   * @return counts for this call
   * @throws com.flamingo.ai.discovery.exception.IndexingException when a source fails
   */
  IndexReport indexNotebook(UUID notebookId, boolean force);

  /** Runs {@link #indexNotebook} on the indexing executor. */
  CompletableFuture<IndexReport> indexNotebookAsync(UUID notebookId, boolean force);

  void deleteNotebookVectors(UUID notebookId);

  long countVectors(UUID notebookId);

  /**
   * Searches the notebook's chunks.
   *
   * @param notebookId the notebook ID
   * @param query query text
   * @param limit maximum results
   * @param minRelevance minimum relevance in 0..1
   * @return results, best first
   */
  List<RetrievalResult> searchSimilar(
      UUID notebookId, String query, int limit, double minRelevance);

  /**
   * Generates a new output.
   *
   * @param request generation parameters
   * @return the output, COMPLETED or FAILED
   */
  Output generateOutput(GenerationRequest request);

  /** Runs {@link #generateOutput} on the generation executor. */
  CompletableFuture<Output> generateOutputAsync(GenerationRequest request);

  /**
   * Regenerates an existing output as a new version.
   *
   * @param outputId the output ID
   * @param overrides settings to change, or null to reuse the stored ones
   * @return the output, COMPLETED or FAILED
   * @throws com.flamingo.ai.discovery.exception.ConflictException when it is generating
   */
  Output regenerateOutput(UUID outputId, GenerationOverrides overrides);

  QaAnswer askQuestion(
      UUID notebookId, String question, int maxSources, double temperature, int maxTokens);

  QaAnswer askQuestion(UUID notebookId, String question);
}
