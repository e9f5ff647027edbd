package com.flamingo.ai.discovery.exception;

/**
 * Exception thrown when a single LLM call fails.
 *
 * <p>Never leaves the pipeline: the generation retry policy consumes it and reports {@link
 * GenerationFailureException} once it gives up.
 */
public class LlmServiceException extends SynthesisException {

  private final boolean rateLimited;

  public LlmServiceException(String message, boolean transientFailure) {
    this(message, transientFailure, false, null);
  }

  public LlmServiceException(String message, boolean transientFailure, Throwable cause) {
    this(message, transientFailure, false, cause);
  }

  public LlmServiceException(
      String message, boolean transientFailure, boolean rateLimited, Throwable cause) {
    super(
        rateLimited ? ErrorCodes.LLM_RATE_LIMITED : ErrorCodes.LLM_UNAVAILABLE,
        message,
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.",
        transientFailure,
        cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  /** Whether another attempt of the same call may succeed. */
  public boolean isTransient() {
    return isRetryable();
  }
}
