package com.flamingo.ai.discovery.service.generation.prompt;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.exception.EmptyContextException;
import com.flamingo.ai.discovery.exception.TemplateValidationException;
import com.flamingo.ai.discovery.provider.LlmProvider;
import com.flamingo.ai.discovery.service.generation.GenerationRequest;
import com.flamingo.ai.discovery.service.generation.template.ResolvedTemplate;
import com.flamingo.ai.discovery.service.generation.template.TemplateSection;
import com.flamingo.ai.discovery.service.rag.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds token-budgeted prompts.
 *
 * <p>Block order is fixed: template system prompt, section instructions, generation parameters,
 * custom prompt, then source excerpts. Changing it changes model behavior.
 *
 * <p>The budget splits {@code maxTokens} into a completion share, {@code min(reserved, max / 2)},
 * an instruction share of at least the configured reserve, and the rest for excerpts. Excerpts go
 * in relevance order and are included whole or not at all; assembly stops at the first one that
 * does not fit. Each block is charged one extra token for its separator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptAssembler {

  private static final int SEPARATOR_TOKENS = 1;

  private final LlmProvider llmProvider;
  private final RagConfig ragConfig;

  /**
   * Assembles a prompt.
   *
   * @param request generation parameters, including the token budget
   * @param retrieved excerpts in relevance order
   * @param template validated template
   * @return the prompt, with {@code estimatedTokens <= maxTokens - completionTokens}
   * @throws EmptyContextException when no excerpt fits and there is no custom prompt
   * @throws TemplateValidationException when the instructions alone exceed the prompt budget
   */
  public Prompt assemble(
      GenerationRequest request, List<RetrievalResult> retrieved, ResolvedTemplate template) {
    int maxTokens = request.maxTokens();
    int completionTokens =
        Math.min(ragConfig.getPrompt().getReservedForCompletion(), maxTokens / 2);
    int promptBudget = maxTokens - completionTokens;

    String system = template.systemPrompt();
    List<PromptSection> sections = new ArrayList<>();
    sections.add(new PromptSection(PromptSection.Kind.INSTRUCTIONS, renderInstructions(template)));
    String parameters = renderParameters(request);
    if (parameters != null) {
      sections.add(new PromptSection(PromptSection.Kind.PARAMETERS, parameters));
    }
    if (request.hasCustomPrompt()) {
      sections.add(
          new PromptSection(
              PromptSection.Kind.CUSTOM_PROMPT,
              "Additional instructions:\n" + request.customPrompt().strip()));
    }

    // Nothing to ground on is reported as such, whatever the budget.
    if (retrieved.isEmpty() && !request.hasCustomPrompt()) {
      throw new EmptyContextException(
          request.notebookId(), "No relevant source excerpts were found");
    }

    int instructionTokens = cost(system);
    for (PromptSection section : sections) {
      instructionTokens += cost(section.content());
    }
    if (instructionTokens > promptBudget) {
      throw new TemplateValidationException(
          template.name(),
          "instructions need "
              + instructionTokens
              + " tokens but only "
              + promptBudget
              + " of maxTokens "
              + maxTokens
              + " are available for the prompt");
    }

    int excerptBudget =
        promptBudget
            - Math.max(ragConfig.getPrompt().getReservedForInstructions(), instructionTokens);
    int excerptTokens = 0;
    List<RetrievalResult> included = new ArrayList<>();
    for (RetrievalResult result : retrieved) {
      String excerpt = renderExcerpt(result);
      int tokens = cost(excerpt);
      if (excerptTokens + tokens > excerptBudget) {
        break;
      }
      sections.add(new PromptSection(PromptSection.Kind.EXCERPT, excerpt));
      included.add(result);
      excerptTokens += tokens;
    }

    if (included.isEmpty() && !request.hasCustomPrompt()) {
      throw new EmptyContextException(
          request.notebookId(), "No source excerpt fits within " + excerptBudget + " tokens");
    }

    log.debug(
        "Assembled prompt for notebook {}: {} of {} excerpts, {} prompt tokens, {} for completion",
        request.notebookId(),
        included.size(),
        retrieved.size(),
        instructionTokens + excerptTokens,
        completionTokens);
    return new Prompt(
        system, sections, included, instructionTokens + excerptTokens, completionTokens);
  }

  private int cost(String block) {
    return llmProvider.countTokens(block) + SEPARATOR_TOKENS;
  }

  private static String renderInstructions(ResolvedTemplate template) {
    StringBuilder sb = new StringBuilder();
    if (template.sections().size() == 1) {
      TemplateSection only = template.sections().get(0);
      sb.append("## ").append(only.name()).append('\n').append(only.instructions().strip());
      appendLengthHint(sb, only);
      return sb.toString();
    }
    sb.append("Write the output with the following sections, in this order.");
    for (TemplateSection section : template.sections()) {
      sb.append("\n\n## ").append(section.name()).append('\n');
      sb.append(section.instructions().strip());
      appendLengthHint(sb, section);
    }
    return sb.toString();
  }

  private static void appendLengthHint(StringBuilder sb, TemplateSection section) {
    String hint = section.lengthHint();
    if (hint != null) {
      sb.append('\n').append(hint);
    }
  }

  private static String renderParameters(GenerationRequest request) {
    List<String> lines = new ArrayList<>();
    if (request.title() != null && !request.title().isBlank()) {
      lines.add("Title: " + request.title().strip());
    }
    if (request.tone() != null) {
      lines.add("Tone: " + request.tone().promptValue());
    }
    if (request.targetLength() != null) {
      lines.add("Target length: about " + request.targetLength() + " words");
    }
    return lines.isEmpty() ? null : String.join("\n", lines);
  }

  private static String renderExcerpt(RetrievalResult result) {
    String name = result.sourceName();
    return CitationMarkers.marker(result.ref())
        + (name == null || name.isBlank() ? "" : " " + name.strip())
        + "\n"
        + result.text().strip();
  }
}
