package com.flamingo.ai.discovery.elasticsearch;

import com.flamingo.ai.discovery.provider.ChunkMatch;
import com.flamingo.ai.discovery.provider.ChunkRef;
import com.flamingo.ai.discovery.provider.EmbeddingIndex;
import com.flamingo.ai.discovery.provider.EmbeddingIndexException;
import com.flamingo.ai.discovery.provider.SourceChunk;
import com.flamingo.ai.discovery.service.rag.embedding.EmbeddingService;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link EmbeddingIndex} backed by {@link SourceChunkIndexService}, embedding text with {@link
 * EmbeddingService}.
 *
 * <p>Cosine kNN scores are already in 0..1 and are reported as certainty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchEmbeddingIndex implements EmbeddingIndex {

  private final SourceChunkIndexService indexService;
  private final EmbeddingService embeddingService;

  @Override
  public void upsert(UUID notebookId, List<SourceChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    run(
        "upsert " + chunks.size() + " chunks into notebook " + notebookId,
        () -> {
          List<List<Float>> embeddings =
              embeddingService.embedPassages(chunks.stream().map(SourceChunk::content).toList());
          if (embeddings.size() != chunks.size()) {
            throw new EmbeddingIndexException(
                "Got " + embeddings.size() + " embeddings for " + chunks.size() + " chunks");
          }
          List<SourceChunkDocument> documents = new ArrayList<>(chunks.size());
          for (int i = 0; i < chunks.size(); i++) {
            documents.add(toDocument(notebookId, chunks.get(i), embeddings.get(i)));
          }
          indexService.indexDocuments(documents);
          indexService.refresh();
          return null;
        });
  }

  @Override
  public List<ChunkMatch> query(UUID notebookId, String queryText, int limit) {
    return run(
        "query notebook " + notebookId,
        () -> {
          List<Float> embedding = embeddingService.embedQuery(queryText);
          if (embedding.isEmpty()) {
            throw new EmbeddingIndexException("Embedding model returned an empty query vector");
          }
          List<ChunkMatch> matches = new ArrayList<>();
          for (SourceChunkDocument hit : indexService.vectorSearch(notebookId, embedding, limit)) {
            matches.add(
                new ChunkMatch(
                    new ChunkRef(hit.getSourceId(), hit.getChunkIndex()),
                    hit.getSourceName(),
                    hit.getContent(),
                    null,
                    hit.getRelevanceScore()));
          }
          return matches;
        });
  }

  @Override
  public void delete(UUID notebookId) {
    run(
        "delete notebook " + notebookId,
        () -> {
          indexService.deleteByNotebookId(notebookId);
          return null;
        });
  }

  @Override
  public long count(UUID notebookId) {
    return run("count notebook " + notebookId, () -> indexService.countByNotebookId(notebookId));
  }

  @Override
  public boolean hasChunks(UUID notebookId, UUID sourceId, String contentHash) {
    if (contentHash == null) {
      return false;
    }
    return run(
        "check source " + sourceId,
        () -> indexService.countBySourceAndHash(notebookId, sourceId, contentHash) > 0);
  }

  @Override
  public void deleteSource(UUID notebookId, UUID sourceId) {
    run(
        "delete source " + sourceId,
        () -> {
          indexService.deleteBySourceId(notebookId, sourceId);
          return null;
        });
  }

  private static SourceChunkDocument toDocument(
      UUID notebookId, SourceChunk chunk, List<Float> embedding) {
    return SourceChunkDocument.builder()
        .id(SourceChunkDocument.documentId(notebookId, chunk.sourceId(), chunk.chunkIndex()))
        .notebookId(notebookId)
        .sourceId(chunk.sourceId())
        .sourceName(chunk.sourceName())
        .contentHash(chunk.contentHash())
        .chunkIndex(chunk.chunkIndex())
        .content(chunk.content())
        .startOffset(chunk.startOffset())
        .endOffset(chunk.endOffset())
        .embedding(embedding)
        .build();
  }

  private static <T> T run(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (EmbeddingIndexException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Embedding index failed to {}: {}", operation, e.getMessage());
      throw new EmbeddingIndexException("Failed to " + operation, e);
    }
  }
}
