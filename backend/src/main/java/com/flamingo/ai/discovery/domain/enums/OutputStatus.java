package com.flamingo.ai.discovery.domain.enums;

/** Lifecycle of a generated output. */
public enum OutputStatus {
  /** Output row exists, generation has not started. */
  DRAFT,

  /** An LLM call is in flight; at most one per output. */
  GENERATING,

  /** Content has been generated and persisted. */
  COMPLETED,

  /** Generation gave up; the error is recorded on the output. */
  FAILED;

  /** Whether regenerate may start from this status. */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
