package com.flamingo.ai.discovery.service.rag.chunking;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of an indexing call.
 *
 * @param chunksIndexed chunks written to the index by this call
 * @param sourcesIndexed sources whose chunks were (re)built
 * @param sourcesSkipped sources already indexed for their current content hash
 * @param emptySourceIds sources with no text, which produce no chunks
 */
public record IndexReport(
    int chunksIndexed, int sourcesIndexed, int sourcesSkipped, List<UUID> emptySourceIds) {

  public IndexReport {
    emptySourceIds = List.copyOf(emptySourceIds);
  }

  public static IndexReport empty() {
    return new IndexReport(0, 0, 0, List.of());
  }
}
