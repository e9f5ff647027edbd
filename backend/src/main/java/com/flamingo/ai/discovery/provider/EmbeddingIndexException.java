package com.flamingo.ai.discovery.provider;

/** Raised by {@link EmbeddingIndex} implementations when the store or the embedder fails. */
public class EmbeddingIndexException extends RuntimeException {

  public EmbeddingIndexException(String message) {
    super(message);
  }

  public EmbeddingIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
