package com.flamingo.ai.discovery.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic operations over one Elasticsearch index.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index, or adds missing fields to an existing one. */
  void initIndex();

  /**
   * Indexes documents in one bulk request.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs filtered kNN search.
   *
   * @param filterCriteria field to value pairs every hit must match
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by similarity, with their score set
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Counts documents matching every criterion.
   *
   * @param criteria field to value pairs
   * @return number of matching documents
   */
  long countBy(Map<String, Object> criteria);

  /**
   * Deletes documents matching every criterion.
   *
   * @param criteria field to value pairs; must not be empty
   */
  void deleteBy(Map<String, Object> criteria);

  /** Makes recent writes visible to search and count. */
  void refresh();

  String getIndexName();
}
