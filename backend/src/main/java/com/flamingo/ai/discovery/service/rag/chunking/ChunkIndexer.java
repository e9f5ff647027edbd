package com.flamingo.ai.discovery.service.rag.chunking;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.domain.entity.Source;
import com.flamingo.ai.discovery.exception.IndexingException;
import com.flamingo.ai.discovery.exception.RetrievalException;
import com.flamingo.ai.discovery.provider.EmbeddingIndex;
import com.flamingo.ai.discovery.provider.SourceChunk;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Chunks sources and writes them to the {@link EmbeddingIndex}.
 *
 * <p>Indexing is atomic per source, not per call: when a source fails, its partial chunks are
 * removed and sources indexed earlier in the same call stay indexed. Re-indexing a source whose
 * content hash is already present is skipped unless forced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkIndexer {

  private static final int LOCK_STRIPES = 64;

  private final EmbeddingIndex embeddingIndex;
  private final TextChunker textChunker;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Serializes concurrent indexing of the same (notebook, source). */
  private final Striped<Lock> sourceLocks = Striped.lock(LOCK_STRIPES);

  /** Indexes with the configured chunk size and overlap, skipping unchanged sources. */
  public IndexReport index(UUID notebookId, List<Source> sources) {
    return index(notebookId, sources, false);
  }

  public IndexReport index(UUID notebookId, List<Source> sources, boolean force) {
    RagConfig.Chunking chunking = ragConfig.getChunking();
    return index(notebookId, sources, chunking.getSize(), chunking.getOverlap(), force);
  }

  /**
   * Indexes the given sources of a notebook.
   *
   * @param notebookId the notebook owning the sources
   * @param sources sources to index; deleted ones are ignored
   * @param chunkSize chunk size in characters
   * @param overlap chunk overlap in characters, clamped to half the chunk size
   * @param force rebuild chunks even when the content hash is already indexed
   * @return counts for this call
   * @throws IndexingException when a source cannot be indexed; carries the progress made so far
   */
  @Timed(value = "indexing.index", description = "Time to index notebook sources")
  public IndexReport index(
      UUID notebookId, List<Source> sources, int chunkSize, int overlap, boolean force) {
    if (chunkSize <= 0 || overlap < 0) {
      throw new IllegalArgumentException(
          "Invalid chunking parameters: size=" + chunkSize + ", overlap=" + overlap);
    }
    for (Source source : sources) {
      if (!notebookId.equals(source.getNotebookId())) {
        throw new IllegalArgumentException(
            "Source " + source.getId() + " does not belong to notebook " + notebookId);
      }
    }

    Tally tally = new Tally();
    for (Source source : sources) {
      if (source.isDeleted()) {
        log.debug("Skipping deleted source {}", source.getId());
        continue;
      }
      Lock lock = sourceLocks.get(notebookId + ":" + source.getId());
      lock.lock();
      try {
        indexSource(notebookId, source, chunkSize, overlap, force, tally);
      } finally {
        lock.unlock();
      }
    }

    IndexReport report = tally.toReport();
    log.info(
        "Indexed notebook {}: {} chunks from {} sources, {} skipped, {} empty",
        notebookId,
        report.chunksIndexed(),
        report.sourcesIndexed(),
        report.sourcesSkipped(),
        report.emptySourceIds().size());
    return report;
  }

  private void indexSource(
      UUID notebookId, Source source, int chunkSize, int overlap, boolean force, Tally tally) {
    UUID sourceId = source.getId();
    try {
      String text = source.getExtractedText();
      if (text == null || text.isBlank()) {
        // Stale chunks of an earlier, non-empty version must not stay searchable.
        embeddingIndex.deleteSource(notebookId, sourceId);
        log.info("Source {} has no text, nothing to index", sourceId);
        tally.emptySourceIds.add(sourceId);
        return;
      }

      if (!force && embeddingIndex.hasChunks(notebookId, sourceId, source.getContentHash())) {
        log.debug("Source {} already indexed for hash {}", sourceId, source.getContentHash());
        tally.sourcesSkipped++;
        meterRegistry.counter("indexing.sources.skipped").increment();
        return;
      }

      List<SourceChunk> chunks = new ArrayList<>();
      for (RawChunk raw : textChunker.chunk(text, chunkSize, overlap)) {
        chunks.add(
            new SourceChunk(
                sourceId,
                source.getName(),
                source.getContentHash(),
                raw.chunkIndex(),
                raw.content(),
                raw.startOffset(),
                raw.endOffset()));
      }

      embeddingIndex.deleteSource(notebookId, sourceId);
      embeddingIndex.upsert(notebookId, chunks);

      tally.chunksIndexed += chunks.size();
      tally.sourcesIndexed++;
      meterRegistry.counter("indexing.chunks").increment(chunks.size());
      log.debug("Indexed {} chunks for source {}", chunks.size(), sourceId);
    } catch (RuntimeException e) {
      meterRegistry.counter("indexing.failures").increment();
      removePartialChunks(notebookId, sourceId, e);
      log.error(
          "Failed to index source {} of notebook {}: {}", sourceId, notebookId, e.getMessage());
      throw new IndexingException(
          sourceId, tally.toReport(), "Failed to index source " + sourceId, e);
    }
  }

  private void removePartialChunks(UUID notebookId, UUID sourceId, RuntimeException failure) {
    try {
      embeddingIndex.deleteSource(notebookId, sourceId);
    } catch (RuntimeException cleanupFailure) {
      log.warn(
          "Could not remove partial chunks of source {}: {}",
          sourceId,
          cleanupFailure.getMessage());
      failure.addSuppressed(cleanupFailure);
    }
  }

  /** Removes every indexed chunk of the notebook. */
  public void deleteNotebook(UUID notebookId) {
    try {
      embeddingIndex.delete(notebookId);
      log.info("Deleted all vectors of notebook {}", notebookId);
    } catch (RuntimeException e) {
      throw new IndexingException(
          null, IndexReport.empty(), "Failed to delete vectors of notebook " + notebookId, e);
    }
  }

  /** Number of chunks currently indexed for the notebook. */
  public long countVectors(UUID notebookId) {
    try {
      return embeddingIndex.count(notebookId);
    } catch (RuntimeException e) {
      throw new RetrievalException("Failed to count vectors of notebook " + notebookId, e);
    }
  }

  private static final class Tally {
    private int chunksIndexed;
    private int sourcesIndexed;
    private int sourcesSkipped;
    private final List<UUID> emptySourceIds = new ArrayList<>();

    IndexReport toReport() {
      return new IndexReport(chunksIndexed, sourcesIndexed, sourcesSkipped, emptySourceIds);
    }
  }
}
