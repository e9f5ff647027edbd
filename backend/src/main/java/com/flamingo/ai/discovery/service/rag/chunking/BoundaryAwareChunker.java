package com.flamingo.ai.discovery.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} using a sliding window that prefers semantic boundaries.
 *
 * <p>Each window spans at most {@code chunkSize} characters from its start. When the rest of the
 * text does not fit, the window is cut at the last paragraph break in its second half; failing
 * that, after the last sentence-ending punctuation there; failing that, exactly at the size limit.
 * The next window starts {@code overlap} characters before the previous end, with the overlap
 * clamped to half the chunk size so consecutive windows always advance.
 *
 * <p>Chunk text is the exact substring between the reported offsets. Whitespace-only windows are
 * dropped and do not consume a chunk index.
 */
@Component
@Slf4j
public class BoundaryAwareChunker implements TextChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern SENTENCE_END = Pattern.compile("[.!?](?=\\s)");

  @Override
  public List<RawChunk> chunk(String text, int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
    }
    if (overlap < 0) {
      throw new IllegalArgumentException("overlap must not be negative, got " + overlap);
    }
    if (text == null || text.isBlank()) {
      return List.of();
    }

    int effectiveOverlap = Math.min(overlap, chunkSize / 2);
    if (effectiveOverlap != overlap) {
      log.debug(
          "Clamped chunk overlap from {} to {} for chunk size {}",
          overlap,
          effectiveOverlap,
          chunkSize);
    }

    NavigableSet<Integer> paragraphBreaks = boundaries(PARAGRAPH_BREAK, text, 0);
    NavigableSet<Integer> sentenceBreaks = boundaries(SENTENCE_END, text, 1);

    List<RawChunk> chunks = new ArrayList<>();
    int length = text.length();
    int start = 0;
    while (start < length) {
      int limit = start + chunkSize;
      int end;
      if (limit >= length) {
        end = length;
      } else {
        int earliest = start + chunkSize / 2;
        end = lastBreak(paragraphBreaks, earliest, limit);
        if (end < 0) {
          end = lastBreak(sentenceBreaks, earliest, limit);
        }
        if (end < 0) {
          end = limit;
        }
      }

      String content = text.substring(start, end);
      if (!content.isBlank()) {
        chunks.add(new RawChunk(content, chunks.size(), start, end));
      }
      if (end >= length) {
        break;
      }
      start = end - effectiveOverlap;
    }
    return chunks;
  }

  /** Collects match positions, shifted by {@code offset} from the match start. */
  private static NavigableSet<Integer> boundaries(Pattern pattern, String text, int offset) {
    NavigableSet<Integer> positions = new TreeSet<>();
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      positions.add(matcher.start() + offset);
    }
    return positions;
  }

  /** Last boundary in {@code (earliest, limit]}, or -1. */
  private static int lastBreak(NavigableSet<Integer> breaks, int earliest, int limit) {
    Integer candidate = breaks.floor(limit);
    return candidate != null && candidate > earliest ? candidate : -1;
  }
}
