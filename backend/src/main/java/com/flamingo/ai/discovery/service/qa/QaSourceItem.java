package com.flamingo.ai.discovery.service.qa;

import java.util.UUID;

/**
 * An excerpt that was put in front of the model for a question.
 *
 * @param cited whether the answer cites this excerpt
 */
public record QaSourceItem(
    String text,
    UUID sourceId,
    String sourceName,
    int chunkIndex,
    double relevanceScore,
    boolean cited) {}
