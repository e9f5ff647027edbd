package com.flamingo.ai.discovery.exception;

import java.util.UUID;

/** Exception thrown when a generation is already in flight for an output. */
public class ConflictException extends SynthesisException {

  private final UUID outputId;

  public ConflictException(UUID outputId, String message) {
    super(
        ErrorCodes.GENERATION_CONFLICT,
        message,
        "This output is already being generated. Please wait for it to finish.",
        true,
        null);
    this.outputId = outputId;
  }

  public UUID getOutputId() {
    return outputId;
  }
}
