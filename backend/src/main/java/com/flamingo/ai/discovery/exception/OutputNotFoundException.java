package com.flamingo.ai.discovery.exception;

import java.util.UUID;

/** Exception thrown when an output is not found. */
public class OutputNotFoundException extends SynthesisException {

  private final UUID outputId;

  public OutputNotFoundException(UUID outputId) {
    super(
        ErrorCodes.OUTPUT_NOT_FOUND,
        "Output not found: " + outputId,
        "The requested output was not found",
        false,
        null);
    this.outputId = outputId;
  }

  public UUID getOutputId() {
    return outputId;
  }
}
