package com.flamingo.ai.discovery.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A source chunk as stored in Elasticsearch, with its embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceChunkDocument implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private UUID notebookId;
  private UUID sourceId;
  private String sourceName;
  private String contentHash;
  private int chunkIndex;
  private String content;
  private int startOffset;
  private int endOffset;
  private List<Float> embedding;

  /** Search score of the hit, set on search results only. */
  private Double relevanceScore;

  public static String documentId(UUID notebookId, UUID sourceId, int chunkIndex) {
    return notebookId + "_" + sourceId + "_" + chunkIndex;
  }
}
