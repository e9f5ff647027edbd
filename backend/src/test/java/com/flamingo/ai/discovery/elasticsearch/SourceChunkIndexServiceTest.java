package com.flamingo.ai.discovery.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.bulk.OperationType;
import com.flamingo.ai.discovery.provider.EmbeddingIndexException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SourceChunkIndexService Tests")
class SourceChunkIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private SourceChunkIndexService indexService;

  private final UUID notebookId = UUID.randomUUID();
  private final UUID sourceId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    indexService =
        new SourceChunkIndexService(elasticsearchClient, meterRegistry, "chunks-test", 3);
  }

  private SourceChunkDocument document(List<Float> embedding) {
    return SourceChunkDocument.builder()
        .id(SourceChunkDocument.documentId(notebookId, sourceId, 4))
        .notebookId(notebookId)
        .sourceId(sourceId)
        .sourceName("notes.md")
        .contentHash("hash-1")
        .chunkIndex(4)
        .content("Chunk text")
        .startOffset(100)
        .endOffset(110)
        .embedding(embedding)
        .build();
  }

  @Test
  @DisplayName("Should reject embeddings with the wrong dimension before calling the cluster")
  void shouldRejectWrongDimensions() {
    assertThatThrownBy(() -> indexService.indexDocuments(List.of(document(List.of(0.1f, 0.2f)))))
        .isInstanceOf(EmbeddingIndexException.class)
        .hasMessageContaining("2 dimensions, index expects 3");
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should surface bulk item errors")
  void shouldFailOnBulkErrors() throws Exception {
    BulkResponse response =
        BulkResponse.of(
            b ->
                b.errors(true)
                    .took(1)
                    .items(
                        List.of(
                            BulkResponseItem.of(
                                i ->
                                    i.operationType(OperationType.Index)
                                        .index("chunks-test")
                                        .status(400)
                                        .error(
                                            e ->
                                                e.type("mapper_parsing_exception")
                                                    .reason("bad embedding"))))));
    when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(response);

    assertThatThrownBy(
            () -> indexService.indexDocuments(List.of(document(List.of(0.1f, 0.2f, 0.3f)))))
        .isInstanceOf(EmbeddingIndexException.class)
        .hasMessageContaining("bad embedding");
    assertThat(meterRegistry.counter("source_chunk.index.errors").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should map documents to index fields and back")
  void shouldConvertDocuments() {
    Map<String, Object> stored =
        new LinkedHashMap<>(
            indexService.convertToDocument(document(List.of(0.1f, 0.2f, 0.3f))));
    assertThat(stored)
        .containsEntry("notebookId", notebookId.toString())
        .containsEntry("sourceId", sourceId.toString())
        .containsEntry("contentHash", "hash-1")
        .containsEntry("chunkIndex", 4);

    stored.put("id", "doc-1");
    SourceChunkDocument read = indexService.convertFromDocument(stored);

    assertThat(read.getId()).isEqualTo("doc-1");
    assertThat(read.getNotebookId()).isEqualTo(notebookId);
    assertThat(read.getSourceId()).isEqualTo(sourceId);
    assertThat(read.getChunkIndex()).isEqualTo(4);
    assertThat(read.getStartOffset()).isEqualTo(100);
    assertThat(read.getEndOffset()).isEqualTo(110);
    assertThat(read.getContent()).isEqualTo("Chunk text");
  }

  @Test
  @DisplayName("Should build term filters scoped to the notebook")
  void shouldBuildNotebookScopedFilter() {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put("notebookId", notebookId);
    criteria.put("sourceId", sourceId);

    Query query = indexService.buildFilterQuery(criteria);

    assertThat(query.isBool()).isTrue();
    List<Query> filters = query.bool().filter();
    assertThat(filters).hasSize(2);
    assertThat(filters.get(0).term().field()).isEqualTo("notebookId");
    assertThat(filters.get(0).term().value().stringValue()).isEqualTo(notebookId.toString());
    assertThat(filters.get(1).term().field()).isEqualTo("sourceId");
  }

  @Test
  @DisplayName("Should refuse queries that are not scoped to a notebook")
  void shouldRequireNotebookFilter() {
    assertThatThrownBy(() -> indexService.buildFilterQuery(Map.of("sourceId", sourceId)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> indexService.deleteBy(Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should keep kNN k and candidates within the cluster limit")
  void shouldClampKnnParameters() throws Exception {
    when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
        .thenThrow(new IOException("cluster unavailable"));

    assertThatThrownBy(
            () -> indexService.vectorSearch(notebookId, List.of(0.1f, 0.2f, 0.3f), 20_000))
        .isInstanceOf(EmbeddingIndexException.class);

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
    KnnSearch knn = captor.getValue().knn().get(0);
    assertThat(knn.k()).isEqualTo(10_000);
    assertThat(knn.numCandidates()).isEqualTo(10_000);
    assertThat(captor.getValue().size()).isEqualTo(10_000);
  }
}
