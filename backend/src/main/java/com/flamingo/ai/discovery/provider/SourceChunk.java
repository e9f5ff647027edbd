package com.flamingo.ai.discovery.provider;

import java.util.UUID;

/**
 * A chunk handed to the index. Offsets are character positions in the source text, end exclusive.
 */
public record SourceChunk(
    UUID sourceId,
    String sourceName,
    String contentHash,
    int chunkIndex,
    String content,
    int startOffset,
    int endOffset) {

  public ChunkRef ref() {
    return new ChunkRef(sourceId, chunkIndex);
  }
}
