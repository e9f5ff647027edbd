package com.flamingo.ai.discovery.service.qa;

import java.util.List;

/**
 * Answer to a question over a notebook's sources.
 *
 * @param question the question as asked
 * @param answer answer text
 * @param sources excerpts the answer was generated from, in relevance order
 * @param confidenceScore mean relevance of the cited excerpts in 0..1, or null when none is cited
 * @param processingTimeMs wall time spent answering
 */
public record QaAnswer(
    String question,
    String answer,
    List<QaSourceItem> sources,
    Double confidenceScore,
    long processingTimeMs) {

  public QaAnswer {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
