package com.flamingo.ai.discovery.service.rag.chunking;

/**
 * A slice of source text produced by a {@link TextChunker}.
 *
 * @param content exact substring {@code text[startOffset, endOffset)}
 * @param chunkIndex zero-based position among the emitted chunks
 * @param startOffset inclusive character offset
 * @param endOffset exclusive character offset
 */
public record RawChunk(String content, int chunkIndex, int startOffset, int endOffset) {}
