package com.flamingo.ai.discovery.service.rag.chunking;

import java.util.List;

/**
 * Splits extracted source text into overlapping chunks ready for embedding.
 *
 * <p>Implementations must be stateless, deterministic and safe for concurrent use.
 */
public interface TextChunker {

  /**
   * Produces chunks of at most {@code chunkSize} characters.
   *
   * @param text the source text
   * @param chunkSize maximum chunk length in characters, must be positive
   * @param overlap characters re-read from the tail of the previous chunk, must not be negative
   * @return ordered chunks, empty for blank text
   * @throws IllegalArgumentException for a non-positive size or a negative overlap
   */
  List<RawChunk> chunk(String text, int chunkSize, int overlap);
}
