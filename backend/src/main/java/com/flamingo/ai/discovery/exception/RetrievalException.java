package com.flamingo.ai.discovery.exception;

/** Exception thrown when the vector store cannot be queried. */
public class RetrievalException extends SynthesisException {

  public RetrievalException(String message, Throwable cause) {
    super(
        ErrorCodes.SEARCH_FAILED,
        message,
        "Search is temporarily unavailable. Please try again.",
        true,
        cause);
  }
}
