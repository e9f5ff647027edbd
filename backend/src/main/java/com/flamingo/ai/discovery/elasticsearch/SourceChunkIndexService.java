package com.flamingo.ai.discovery.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of source chunks, one document per (notebook, source, chunk index).
 *
 * <p>The notebook-scoped methods carry their own circuit breaker because they reach the base class
 * through {@code this}, bypassing the proxy.
 */
@Service
@Slf4j
public class SourceChunkIndexService
    extends AbstractElasticsearchIndexService<SourceChunkDocument> {

  static final String NOTEBOOK_ID = "notebookId";
  static final String SOURCE_ID = "sourceId";
  static final String CONTENT_HASH = "contentHash";

  @Value("${app.elasticsearch.index-name:discovery-source-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:standard}")
  private String textAnalyzer;

  @Autowired
  public SourceChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  SourceChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Ids and hashes are matched exactly by term filters.
    properties.put(NOTEBOOK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(SOURCE_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(CONTENT_HASH, Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceName", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("startOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("endOffset", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "content", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(SourceChunkDocument chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(NOTEBOOK_ID, chunk.getNotebookId().toString());
    document.put(SOURCE_ID, chunk.getSourceId().toString());
    document.put(CONTENT_HASH, chunk.getContentHash());
    document.put("sourceName", chunk.getSourceName());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("startOffset", chunk.getStartOffset());
    document.put("endOffset", chunk.getEndOffset());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected SourceChunkDocument convertFromDocument(Map<String, Object> source) {
    return SourceChunkDocument.builder()
        .id((String) source.get("id"))
        .notebookId(UUID.fromString((String) source.get(NOTEBOOK_ID)))
        .sourceId(UUID.fromString((String) source.get(SOURCE_ID)))
        .contentHash((String) source.get(CONTENT_HASH))
        .sourceName((String) source.get("sourceName"))
        .chunkIndex(intValue(source.get("chunkIndex")))
        .startOffset(intValue(source.get("startOffset")))
        .endOffset(intValue(source.get("endOffset")))
        .content((String) source.get("content"))
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(SourceChunkDocument entity) {
    return entity.getId();
  }

  @Override
  protected List<Float> getEmbedding(SourceChunkDocument entity) {
    return entity.getEmbedding();
  }

  @Override
  protected Query buildFilterQuery(Map<String, Object> criteria) {
    if (!criteria.containsKey(NOTEBOOK_ID)) {
      throw new IllegalArgumentException("notebookId filter is required");
    }
    List<Query> filters = new ArrayList<>();
    for (Map.Entry<String, Object> entry : criteria.entrySet()) {
      String value = String.valueOf(entry.getValue());
      filters.add(Query.of(q -> q.term(t -> t.field(entry.getKey()).value(value))));
    }
    return Query.of(q -> q.bool(b -> b.filter(filters)));
  }

  @Override
  protected String getMetricPrefix() {
    return "source_chunk";
  }

  @CircuitBreaker(name = "elasticsearch")
  public List<SourceChunkDocument> vectorSearch(
      UUID notebookId, List<Float> queryEmbedding, int topK) {
    return vectorSearch(Map.of(NOTEBOOK_ID, notebookId), queryEmbedding, topK);
  }

  @CircuitBreaker(name = "elasticsearch")
  public long countByNotebookId(UUID notebookId) {
    return countBy(Map.of(NOTEBOOK_ID, notebookId));
  }

  @CircuitBreaker(name = "elasticsearch")
  public long countBySourceAndHash(UUID notebookId, UUID sourceId, String contentHash) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put(NOTEBOOK_ID, notebookId);
    criteria.put(SOURCE_ID, sourceId);
    criteria.put(CONTENT_HASH, contentHash);
    return countBy(criteria);
  }

  @CircuitBreaker(name = "elasticsearch")
  public void deleteByNotebookId(UUID notebookId) {
    deleteBy(Map.of(NOTEBOOK_ID, notebookId));
  }

  @CircuitBreaker(name = "elasticsearch")
  public void deleteBySourceId(UUID notebookId, UUID sourceId) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put(NOTEBOOK_ID, notebookId);
    criteria.put(SOURCE_ID, sourceId);
    deleteBy(criteria);
  }
}
