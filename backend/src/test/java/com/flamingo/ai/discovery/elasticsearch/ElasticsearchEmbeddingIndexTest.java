package com.flamingo.ai.discovery.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.discovery.provider.ChunkMatch;
import com.flamingo.ai.discovery.provider.ChunkRef;
import com.flamingo.ai.discovery.provider.EmbeddingIndexException;
import com.flamingo.ai.discovery.provider.SourceChunk;
import com.flamingo.ai.discovery.service.rag.embedding.EmbeddingService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchEmbeddingIndex Tests")
class ElasticsearchEmbeddingIndexTest {

  @Mock private SourceChunkIndexService indexService;
  @Mock private EmbeddingService embeddingService;

  private ElasticsearchEmbeddingIndex embeddingIndex;

  private final UUID notebookId = UUID.randomUUID();
  private final UUID sourceId = UUID.randomUUID();

  @BeforeEach
  void setUp() {
    embeddingIndex = new ElasticsearchEmbeddingIndex(indexService, embeddingService);
  }

  private SourceChunk chunk(int index, String content) {
    return new SourceChunk(
        sourceId, "notes.md", "hash-1", index, content, index * 10, index * 10 + 9);
  }

  @Test
  @DisplayName("Should embed and index chunks with deterministic ids")
  @SuppressWarnings("unchecked")
  void shouldUpsertChunks() {
    when(embeddingService.embedPassages(List.of("first", "second")))
        .thenReturn(List.of(List.of(0.1f), List.of(0.2f)));

    embeddingIndex.upsert(notebookId, List.of(chunk(0, "first"), chunk(1, "second")));

    ArgumentCaptor<List<SourceChunkDocument>> captor = ArgumentCaptor.forClass(List.class);
    verify(indexService).indexDocuments(captor.capture());
    verify(indexService).refresh();
    List<SourceChunkDocument> documents = captor.getValue();
    assertThat(documents).hasSize(2);
    SourceChunkDocument second = documents.get(1);
    assertThat(second.getId()).isEqualTo(notebookId + "_" + sourceId + "_1");
    assertThat(second.getNotebookId()).isEqualTo(notebookId);
    assertThat(second.getContentHash()).isEqualTo("hash-1");
    assertThat(second.getContent()).isEqualTo("second");
    assertThat(second.getStartOffset()).isEqualTo(10);
    assertThat(second.getEmbedding()).containsExactly(0.2f);
  }

  @Test
  @DisplayName("Should not index when the embedding count does not match")
  void shouldRejectEmbeddingCountMismatch() {
    when(embeddingService.embedPassages(anyList())).thenReturn(List.of(List.of(0.1f)));

    assertThatThrownBy(
            () -> embeddingIndex.upsert(notebookId, List.of(chunk(0, "a"), chunk(1, "b"))))
        .isInstanceOf(EmbeddingIndexException.class);
    verify(indexService, never()).indexDocuments(anyList());
  }

  @Test
  @DisplayName("Should skip empty upserts")
  void shouldSkipEmptyUpsert() {
    embeddingIndex.upsert(notebookId, List.of());

    verifyNoInteractions(indexService, embeddingService);
  }

  @Test
  @DisplayName("Should map hits to matches carrying the score as certainty")
  void shouldQueryByVector() {
    when(embeddingService.embedQuery("solar")).thenReturn(List.of(0.5f));
    when(indexService.vectorSearch(notebookId, List.of(0.5f), 4))
        .thenReturn(
            List.of(
                SourceChunkDocument.builder()
                    .sourceId(sourceId)
                    .sourceName("notes.md")
                    .chunkIndex(2)
                    .content("Solar text")
                    .relevanceScore(0.8)
                    .build()));

    List<ChunkMatch> matches = embeddingIndex.query(notebookId, "solar", 4);

    assertThat(matches)
        .containsExactly(
            new ChunkMatch(new ChunkRef(sourceId, 2), "notes.md", "Solar text", null, 0.8));
  }

  @Test
  @DisplayName("Should fail on an empty query vector")
  void shouldRejectEmptyQueryVector() {
    when(embeddingService.embedQuery("solar")).thenReturn(List.of());

    assertThatThrownBy(() -> embeddingIndex.query(notebookId, "solar", 4))
        .isInstanceOf(EmbeddingIndexException.class);
    verify(indexService, never()).vectorSearch(any(UUID.class), anyList(), anyInt());
  }

  @Test
  @DisplayName("Should wrap index failures")
  void shouldWrapFailures() {
    RuntimeException failure = new RuntimeException("cluster unavailable");
    when(indexService.countByNotebookId(notebookId)).thenThrow(failure);

    assertThatThrownBy(() -> embeddingIndex.count(notebookId))
        .isInstanceOf(EmbeddingIndexException.class)
        .hasCause(failure);
  }

  @Test
  @DisplayName("Should check chunks by source and content hash")
  void shouldCheckChunksByHash() {
    when(indexService.countBySourceAndHash(notebookId, sourceId, "hash-1")).thenReturn(3L);

    assertThat(embeddingIndex.hasChunks(notebookId, sourceId, "hash-1")).isTrue();
    assertThat(embeddingIndex.hasChunks(notebookId, sourceId, null)).isFalse();
  }

  @Test
  @DisplayName("Should delete by source and by notebook")
  void shouldDelete() {
    embeddingIndex.deleteSource(notebookId, sourceId);
    embeddingIndex.delete(notebookId);

    verify(indexService).deleteBySourceId(notebookId, sourceId);
    verify(indexService).deleteByNotebookId(notebookId);
  }
}
