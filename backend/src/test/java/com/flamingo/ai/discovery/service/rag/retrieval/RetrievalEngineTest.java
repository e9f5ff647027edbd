package com.flamingo.ai.discovery.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.exception.RetrievalException;
import com.flamingo.ai.discovery.provider.ChunkMatch;
import com.flamingo.ai.discovery.provider.ChunkRef;
import com.flamingo.ai.discovery.provider.EmbeddingIndex;
import com.flamingo.ai.discovery.provider.EmbeddingIndexException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalEngine Tests")
class RetrievalEngineTest {

  private static final UUID SOURCE_A = UUID.fromString("00000000-0000-0000-0000-00000000000a");
  private static final UUID SOURCE_B = UUID.fromString("00000000-0000-0000-0000-00000000000b");

  private final UUID notebookId = UUID.randomUUID();

  @Mock private EmbeddingIndex embeddingIndex;

  private RetrievalEngine retrievalEngine;

  @BeforeEach
  void setUp() {
    retrievalEngine =
        new RetrievalEngine(embeddingIndex, new RagConfig(), new SimpleMeterRegistry());
  }

  private static ChunkMatch match(UUID sourceId, int chunkIndex, Double certainty) {
    return new ChunkMatch(
        new ChunkRef(sourceId, chunkIndex), "source", "text " + chunkIndex, null, certainty);
  }

  @Test
  @DisplayName("Should rank by relevance, then chunk index, then source id")
  void shouldRankDeterministically() {
    when(embeddingIndex.query(eq(notebookId), anyString(), anyInt()))
        .thenReturn(
            List.of(
                match(SOURCE_B, 1, 0.8),
                match(SOURCE_A, 1, 0.8),
                match(SOURCE_B, 0, 0.8),
                match(SOURCE_A, 5, 0.9)));

    List<RetrievalResult> results = retrievalEngine.search(notebookId, "query", 10, 0.0);

    assertThat(results)
        .extracting(RetrievalResult::ref)
        .containsExactly(
            new ChunkRef(SOURCE_A, 5),
            new ChunkRef(SOURCE_B, 0),
            new ChunkRef(SOURCE_A, 1),
            new ChunkRef(SOURCE_B, 1));
  }

  @Test
  @DisplayName("Should collapse duplicate hits keeping the best score")
  void shouldDeduplicate() {
    when(embeddingIndex.query(eq(notebookId), anyString(), anyInt()))
        .thenReturn(List.of(match(SOURCE_A, 0, 0.4), match(SOURCE_A, 0, 0.7)));

    List<RetrievalResult> results = retrievalEngine.search(notebookId, "query", 10, 0.0);

    assertThat(results)
        .singleElement()
        .satisfies(r -> assertThat(r.relevanceScore()).isEqualTo(0.7));
  }

  @Test
  @DisplayName("Should cap the candidate count for very large limits")
  void shouldCapCandidatesForHugeLimit() {
    when(embeddingIndex.query(eq(notebookId), anyString(), eq(5000)))
        .thenReturn(List.of(match(SOURCE_A, 0, 0.9)));

    List<RetrievalResult> results =
        retrievalEngine.search(notebookId, "query", Integer.MAX_VALUE, 0.0);

    assertThat(results).extracting(RetrievalResult::ref).containsExactly(new ChunkRef(SOURCE_A, 0));
    verify(embeddingIndex).query(eq(notebookId), anyString(), eq(5000));
  }

  @Test
  @DisplayName("Should drop results below the minimum relevance and cap at the limit")
  void shouldFilterAndLimit() {
    when(embeddingIndex.query(eq(notebookId), anyString(), anyInt()))
        .thenReturn(
            List.of(
                match(SOURCE_A, 0, 0.9),
                match(SOURCE_A, 1, 0.6),
                match(SOURCE_A, 2, 0.5),
                match(SOURCE_A, 3, 0.2)));

    List<RetrievalResult> results = retrievalEngine.search(notebookId, "query", 2, 0.5);

    assertThat(results).extracting(RetrievalResult::chunkIndex).containsExactly(0, 1);
    verify(embeddingIndex).query(notebookId, "query", 4);
  }

  @Test
  @DisplayName("Should keep only allowed sources")
  void shouldFilterBySource() {
    when(embeddingIndex.query(eq(notebookId), anyString(), anyInt()))
        .thenReturn(List.of(match(SOURCE_A, 0, 0.9), match(SOURCE_B, 0, 0.8)));

    List<RetrievalResult> results =
        retrievalEngine.search(notebookId, "query", 10, 0.0, Set.of(SOURCE_B));

    assertThat(results).extracting(RetrievalResult::sourceId).containsExactly(SOURCE_B);
  }

  @Test
  @DisplayName("Should return nothing without querying for a zero limit, blank query or no sources")
  void shouldShortCircuit() {
    assertThat(retrievalEngine.search(notebookId, "query", 0, 0.0)).isEmpty();
    assertThat(retrievalEngine.search(notebookId, "  ", 5, 0.0)).isEmpty();
    assertThat(retrievalEngine.search(notebookId, "query", 5, 0.0, Set.of())).isEmpty();

    verifyNoInteractions(embeddingIndex);
  }

  @Test
  @DisplayName("Should normalize distance and missing scores")
  void shouldNormalizeScores() {
    ChunkRef ref = new ChunkRef(SOURCE_A, 0);

    assertThat(RetrievalEngine.relevance(new ChunkMatch(ref, "s", "t", 1.0, null)))
        .isCloseTo(0.5, within(1e-9));
    assertThat(RetrievalEngine.relevance(new ChunkMatch(ref, "s", "t", 0.25, 1.7))).isEqualTo(1.0);
    assertThat(RetrievalEngine.relevance(new ChunkMatch(ref, "s", "t", null, -0.2))).isZero();
    assertThat(RetrievalEngine.relevance(new ChunkMatch(ref, "s", "t", null, null))).isZero();
  }

  @Test
  @DisplayName("Should wrap index failures")
  void shouldWrapIndexFailures() {
    when(embeddingIndex.query(eq(notebookId), anyString(), anyInt()))
        .thenThrow(new EmbeddingIndexException("down"));

    assertThatThrownBy(() -> retrievalEngine.search(notebookId, "query", 5, 0.0))
        .isInstanceOf(RetrievalException.class)
        .hasCauseInstanceOf(EmbeddingIndexException.class);
  }
}
