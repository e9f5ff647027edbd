package com.flamingo.ai.discovery.provider;

import java.util.List;
import java.util.UUID;

/**
 * Vector index of source chunks, partitioned by notebook. Implementations embed text themselves.
 *
 * <p>Chunks are keyed by (notebook, source, chunk index); upserting an existing key replaces it.
 */
public interface EmbeddingIndex {

  void upsert(UUID notebookId, List<SourceChunk> chunks);

  /**
   * Nearest chunks to {@code queryText}. May return the same chunk more than once and in any order.
   */
  List<ChunkMatch> query(UUID notebookId, String queryText, int limit);

  /** Removes every chunk of the notebook. */
  void delete(UUID notebookId);

  long count(UUID notebookId);

  /** Whether chunks built from this exact content hash of the source are present. */
  boolean hasChunks(UUID notebookId, UUID sourceId, String contentHash);

  /** Removes every chunk of one source. */
  void deleteSource(UUID notebookId, UUID sourceId);
}
