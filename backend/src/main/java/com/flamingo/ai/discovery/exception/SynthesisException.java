package com.flamingo.ai.discovery.exception;

/**
 * Base class for every error the synthesis pipeline reports to its callers.
 *
 * <p>Provider exceptions are translated into a subclass before they leave the pipeline.
 */
public abstract class SynthesisException extends RuntimeException {

  private final String code;
  private final String userMessage;
  private final boolean retryable;

  protected SynthesisException(
      String code, String message, String userMessage, boolean retryable, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = userMessage;
    this.retryable = retryable;
  }

  public String getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** Whether the caller may retry the same call later. */
  public boolean isRetryable() {
    return retryable;
  }
}
