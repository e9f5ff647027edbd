package com.flamingo.ai.discovery.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.discovery.provider.EmbeddingIndexException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch index services.
 *
 * <p>Owns index creation and mapping checks, bulk indexing, filtered kNN search, count and delete.
 * Subclasses define the schema and the document conversion. Store failures surface as {@link
 * EmbeddingIndexException}.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  /** Upper bound Elasticsearch accepts for kNN {@code k} and {@code num_candidates}. */
  static final int MAX_NUM_CANDIDATES = 10_000;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  protected abstract int getVectorDimensions();

  /** Field name to mapping for this document type. */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract List<Float> getEmbedding(T entity);

  /** Builds the filter applied to search, count and delete; criteria are ANDed. */
  protected abstract Query buildFilterQuery(Map<String, Object> criteria);

  /** Prefix of the metrics this index reports, e.g. "source_chunk". */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping initialization of {}", getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // Undeclared fields are stored but never mapped.
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and fails on type mismatches, which need the index to
   * be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s), delete it and restart: "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  @CircuitBreaker(name = "elasticsearch")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    for (T document : documents) {
      List<Float> embedding = getEmbedding(document);
      if (embedding == null || embedding.size() != getVectorDimensions()) {
        throw new EmbeddingIndexException(
            "Document "
                + getDocumentId(document)
                + " has an embedding of "
                + (embedding == null ? 0 : embedding.size())
                + " dimensions, index expects "
                + getVectorDimensions());
      }
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        String firstError =
            response.items().stream()
                .filter(item -> item.error() != null)
                .findFirst()
                .map(BulkResponseItem::error)
                .map(error -> error.reason())
                .orElse("unknown");
        throw new EmbeddingIndexException(
            "Bulk indexing into " + getIndexName() + " failed: " + firstError);
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage());
      throw new EmbeddingIndexException("Failed to index documents into " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    Query filter = buildFilterQuery(filterCriteria);
    int k = Math.min(topK, MAX_NUM_CANDIDATES);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(getIndexName())
                    .knn(
                        kb ->
                            kb.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(k)
                                .numCandidates(
                                    Math.min(MAX_NUM_CANDIDATES, Math.max(k * 2, k + 10)))
                                .filter(filter))
                    .size(k));
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.debug(
          "[vectorSearch] index={} criteria={} topK={} returned={}",
          getIndexName(),
          filterCriteria,
          topK,
          results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException | ElasticsearchException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage());
      throw new EmbeddingIndexException("Vector search failed on " + getIndexName(), e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public long countBy(Map<String, Object> criteria) {
    Query filter = buildFilterQuery(criteria);
    try {
      return elasticsearchClient
          .count(CountRequest.of(c -> c.index(getIndexName()).query(filter)))
          .count();
    } catch (IOException | ElasticsearchException e) {
      throw new EmbeddingIndexException("Count failed on " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  @CircuitBreaker(name = "elasticsearch")
  public void deleteBy(Map<String, Object> criteria) {
    if (criteria.isEmpty()) {
      throw new IllegalArgumentException("deleteBy requires at least one criterion");
    }
    Query deleteQuery = buildFilterQuery(criteria);
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
      Long deleted = elasticsearchClient.deleteByQuery(request).deleted();
      log.debug("Deleted {} documents from {} with criteria {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage());
      throw new EmbeddingIndexException("Failed to delete documents from " + getIndexName(), e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
    } catch (IOException | ElasticsearchException e) {
      throw new EmbeddingIndexException("Failed to refresh index " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata, not part of _source.
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Documents that carry the search score of the hit they were read from. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
