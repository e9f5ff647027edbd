package com.flamingo.ai.discovery.exception;

/** Exception raised when the LLM call fails for good, after retries or on a non-transient error. */
public class GenerationFailureException extends SynthesisException {

  private final int attempts;

  public GenerationFailureException(String message, int attempts, Throwable cause) {
    super(
        ErrorCodes.LLM_ERROR,
        message,
        "Content generation failed. Please try again later.",
        false,
        cause);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }
}
