package com.flamingo.ai.discovery.service.rag.retrieval;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.exception.RetrievalException;
import com.flamingo.ai.discovery.provider.ChunkMatch;
import com.flamingo.ai.discovery.provider.ChunkRef;
import com.flamingo.ai.discovery.provider.EmbeddingIndex;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Similarity search over a notebook's chunks.
 *
 * <p>Embedding and nearest-neighbour lookup are delegated to the {@link EmbeddingIndex}. This
 * class shapes the raw hits: it normalizes scores, drops weak and disallowed hits, collapses
 * duplicates and applies {@link RetrievalResult#RANKING}, so equal inputs always give equal
 * result lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {

  private final EmbeddingIndex embeddingIndex;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public List<RetrievalResult> search(UUID notebookId, String query) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    return search(notebookId, query, retrieval.getDefaultLimit(), retrieval.getMinRelevance());
  }

  public List<RetrievalResult> search(
      UUID notebookId, String query, int limit, double minRelevance) {
    return search(notebookId, query, limit, minRelevance, null);
  }

  /**
   * Searches the notebook's chunks.
   *
   * @param notebookId notebook to search
   * @param query free-text query
   * @param limit maximum results; zero or less returns nothing without querying
   * @param minRelevance results scoring below this are dropped
   * @param allowedSourceIds when not null, only chunks of these sources are returned
   * @return ranked results, empty when nothing is indexed or nothing is relevant
   * @throws RetrievalException when the index cannot be queried
   */
  @Timed(value = "retrieval.search", description = "Time to search notebook chunks")
  public List<RetrievalResult> search(
      UUID notebookId,
      String query,
      int limit,
      double minRelevance,
      Set<UUID> allowedSourceIds) {
    if (limit <= 0 || query == null || query.isBlank()) {
      return List.of();
    }
    if (allowedSourceIds != null && allowedSourceIds.isEmpty()) {
      return List.of();
    }

    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    int candidates =
        (int)
            Math.min(
                (long) limit * Math.max(1, retrieval.getCandidatesMultiplier()),
                retrieval.getMaxCandidates());
    List<ChunkMatch> matches;
    try {
      matches = embeddingIndex.query(notebookId, query, candidates);
    } catch (RuntimeException e) {
      meterRegistry.counter("retrieval.search.errors").increment();
      log.error("Vector search failed for notebook {}: {}", notebookId, e.getMessage());
      throw new RetrievalException("Vector search failed for notebook " + notebookId, e);
    }
    meterRegistry.counter("retrieval.search").increment();

    Map<ChunkRef, RetrievalResult> best = new LinkedHashMap<>();
    for (ChunkMatch match : matches) {
      if (allowedSourceIds != null && !allowedSourceIds.contains(match.ref().sourceId())) {
        continue;
      }
      double score = relevance(match);
      if (score < minRelevance) {
        continue;
      }
      RetrievalResult result =
          new RetrievalResult(
              match.ref(), match.sourceName(), match.text(), match.distance(), score);
      best.merge(
          match.ref(),
          result,
          (kept, candidate) ->
              candidate.relevanceScore() > kept.relevanceScore() ? candidate : kept);
    }

    List<RetrievalResult> ranked = new ArrayList<>(best.values());
    ranked.sort(RetrievalResult.RANKING);
    List<RetrievalResult> results =
        ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    log.debug(
        "Search in notebook {} returned {} of {} candidates (limit={}, minRelevance={})",
        notebookId,
        results.size(),
        matches.size(),
        limit,
        minRelevance);
    return results;
  }

  /** Certainty when present, otherwise {@code 1 / (1 + distance)}, otherwise 0. */
  @VisibleForTesting
  static double relevance(ChunkMatch match) {
    if (match.certainty() != null && !match.certainty().isNaN()) {
      return clamp(match.certainty());
    }
    if (match.distance() != null && !match.distance().isNaN()) {
      return clamp(1.0 / (1.0 + Math.max(0.0, match.distance())));
    }
    return 0.0;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
