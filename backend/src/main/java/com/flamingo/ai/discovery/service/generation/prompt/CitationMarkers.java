package com.flamingo.ai.discovery.service.generation.prompt;

import com.flamingo.ai.discovery.provider.ChunkRef;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes and reads the {@code [S<source-id>:<chunk-index>]} markers that tag excerpts.
 *
 * <p>Markers in model output are matched exactly against the excerpts of the prompt. A marker that
 * names no included excerpt is counted as unmatched and never resolved to a nearby chunk.
 */
public final class CitationMarkers {

  private static final Pattern MARKER =
      Pattern.compile(
          "\\[S([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})"
              + ":(\\d{1,9})]");

  private CitationMarkers() {}

  public static String marker(ChunkRef ref) {
    return "[S" + ref.sourceId() + ":" + ref.chunkIndex() + "]";
  }

  /**
   * Finds the markers in {@code text} that refer to one of {@code included}.
   *
   * @param text model output
   * @param included refs of the excerpts that were in the prompt
   * @return cited refs in order of first appearance, plus the count of unmatched markers
   */
  public static Citations extract(String text, Collection<ChunkRef> included) {
    if (text == null || text.isEmpty()) {
      return new Citations(List.of(), 0);
    }
    Set<ChunkRef> allowed = new HashSet<>(included);
    Set<ChunkRef> cited = new LinkedHashSet<>();
    int unmatched = 0;
    Matcher matcher = MARKER.matcher(text);
    while (matcher.find()) {
      ChunkRef ref =
          new ChunkRef(UUID.fromString(matcher.group(1)), Integer.parseInt(matcher.group(2)));
      if (allowed.contains(ref)) {
        cited.add(ref);
      } else {
        unmatched++;
      }
    }
    return new Citations(new ArrayList<>(cited), unmatched);
  }

  /**
   * Citations found in a model answer.
   *
   * @param cited distinct matched refs in order of first appearance
   * @param unmatched markers that named no included excerpt
   */
  public record Citations(List<ChunkRef> cited, int unmatched) {

    public Citations {
      cited = List.copyOf(cited);
    }

    /** Distinct cited source ids, in order of first citation. */
    public List<UUID> sourceIds() {
      Set<UUID> ids = new LinkedHashSet<>();
      cited.forEach(ref -> ids.add(ref.sourceId()));
      return List.copyOf(ids);
    }

    public boolean contains(ChunkRef ref) {
      return cited.contains(ref);
    }
  }
}
