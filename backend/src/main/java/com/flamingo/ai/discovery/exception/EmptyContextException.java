package com.flamingo.ai.discovery.exception;

import java.util.UUID;

/** Exception thrown when there is no source material to ground a generation on. */
public class EmptyContextException extends SynthesisException {

  private final UUID notebookId;

  public EmptyContextException(UUID notebookId, String message) {
    super(
        ErrorCodes.EMPTY_CONTEXT,
        message,
        "The notebook's sources do not contain enough material for this request.",
        false,
        null);
    this.notebookId = notebookId;
  }

  public UUID getNotebookId() {
    return notebookId;
  }
}
