package com.flamingo.ai.discovery.service.generation.prompt;

import com.flamingo.ai.discovery.provider.ChunkRef;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An assembled, token-budgeted prompt.
 *
 * @param system system message
 * @param sections user message blocks in order
 * @param excerpts the retrieval results that made it into the prompt, in prompt order
 * @param estimatedTokens estimated prompt size, never above the prompt share of the budget
 * @param completionTokens tokens left for the model's answer
 */
public record Prompt(
    String system,
    List<PromptSection> sections,
    List<RetrievalResult> excerpts,
    int estimatedTokens,
    int completionTokens) {

  static final String SECTION_SEPARATOR = "\n\n";

  public Prompt {
    sections = List.copyOf(sections);
    excerpts = List.copyOf(excerpts);
  }

  /** User message: all sections joined by a blank line. */
  public String userMessage() {
    return sections.stream()
        .map(PromptSection::content)
        .collect(Collectors.joining(SECTION_SEPARATOR));
  }

  /** System and user message as a single text. */
  public String render() {
    return system + SECTION_SEPARATOR + userMessage();
  }

  public List<ChunkRef> excerptRefs() {
    return excerpts.stream().map(RetrievalResult::ref).toList();
  }
}
