package com.flamingo.ai.discovery.exception;

import com.flamingo.ai.discovery.service.rag.chunking.IndexReport;
import java.util.UUID;

/**
 * Thrown when a source cannot be indexed. Sources indexed before the failing one stay indexed and
 * are described by {@link #getPartialReport()}.
 */
public class IndexingException extends SynthesisException {

  private final UUID sourceId;
  private final IndexReport partialReport;

  public IndexingException(
      UUID sourceId, IndexReport partialReport, String message, Throwable cause) {
    super(
        ErrorCodes.INDEXING_FAILED,
        message,
        "Failed to index source. Please try again later.",
        true,
        cause);
    this.sourceId = sourceId;
    this.partialReport = partialReport;
  }

  public UUID getSourceId() {
    return sourceId;
  }

  public IndexReport getPartialReport() {
    return partialReport;
  }
}
