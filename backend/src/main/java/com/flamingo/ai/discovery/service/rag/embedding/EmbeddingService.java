package com.flamingo.ai.discovery.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds queries and source passages with the configured {@link EmbeddingModel}.
 *
 * <p>Failures propagate to the caller after the "openai" retry policy gives up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // Conservative for dense CJK text, where a token can be close to one character.
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private static final int BATCH_SIZE = 64;

  private static final String QUERY_PREFIX =
      "Represent this question for retrieving relevant document passages: ";
  private static final String PASSAGE_PREFIX = "Represent this document passage for retrieval: ";

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<Float> embedQuery(String query) {
    Response<Embedding> response = embeddingModel.embed(truncate(QUERY_PREFIX + query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds passages in batches.
   *
   * @param passages chunk texts
   * @return one vector per passage, in input order
   * @throws IllegalStateException when the model returns a different number of vectors
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<List<Float>> embedPassages(List<String> passages) {
    List<List<Float>> results = new ArrayList<>(passages.size());
    for (int from = 0; from < passages.size(); from += BATCH_SIZE) {
      List<TextSegment> batch = new ArrayList<>();
      for (String passage : passages.subList(from, Math.min(from + BATCH_SIZE, passages.size()))) {
        batch.add(TextSegment.from(truncate(PASSAGE_PREFIX + passage)));
      }
      List<Embedding> embeddings = embeddingModel.embedAll(batch).content();
      if (embeddings == null || embeddings.size() != batch.size()) {
        throw new IllegalStateException(
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for "
                + batch.size()
                + " passages");
      }
      for (Embedding embedding : embeddings) {
        results.add(toFloatList(embedding.vector()));
      }
    }
    meterRegistry
        .counter("embedding.requests.success", "type", "passage")
        .increment(passages.size());
    return results;
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
