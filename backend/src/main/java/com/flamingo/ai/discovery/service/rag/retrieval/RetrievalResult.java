package com.flamingo.ai.discovery.service.rag.retrieval;

import com.flamingo.ai.discovery.provider.ChunkRef;
import java.util.Comparator;
import java.util.UUID;

/**
 * A retrieved chunk with its normalized relevance.
 *
 * @param ref the chunk address
 * @param sourceName display name of the source
 * @param text chunk text
 * @param distance raw provider distance, if the provider reported one
 * @param relevanceScore relevance in 0..1
 */
public record RetrievalResult(
    ChunkRef ref, String sourceName, String text, Double distance, double relevanceScore) {

  /** Descending relevance, then ascending chunk index, then ascending source id. */
  public static final Comparator<RetrievalResult> RANKING =
      Comparator.comparingDouble(RetrievalResult::relevanceScore)
          .reversed()
          .thenComparing(RetrievalResult::ref, ChunkRef.POSITION_ORDER);

  public UUID sourceId() {
    return ref.sourceId();
  }

  public int chunkIndex() {
    return ref.chunkIndex();
  }
}
