package com.flamingo.ai.discovery.provider;

import java.util.Comparator;
import java.util.UUID;

/** Stable address of a chunk within a notebook's index. */
public record ChunkRef(UUID sourceId, int chunkIndex) {

  /** Ascending chunk index, then ascending source id in its string form. */
  public static final Comparator<ChunkRef> POSITION_ORDER =
      Comparator.comparingInt(ChunkRef::chunkIndex)
          .thenComparing(ref -> ref.sourceId().toString());

  public ChunkRef {
    if (sourceId == null) {
      throw new IllegalArgumentException("sourceId is required");
    }
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must be >= 0");
    }
  }
}
