package com.flamingo.ai.discovery.provider;

/**
 * Raw nearest-neighbour hit. Providers report a {@code certainty} in 0..1, a {@code distance}, or
 * both; the retrieval layer normalizes whichever is present.
 */
public record ChunkMatch(
    ChunkRef ref, String sourceName, String text, Double distance, Double certainty) {}
