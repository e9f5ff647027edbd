package com.flamingo.ai.discovery.service.generation.template;

import java.util.List;

/**
 * A template ready for prompt assembly: a base system prompt and its ordered sections.
 *
 * @param name template name, used in logs and output metadata
 * @param systemPrompt base instructions for the model
 * @param sections sections in output order
 */
public record ResolvedTemplate(String name, String systemPrompt, List<TemplateSection> sections) {

  public ResolvedTemplate {
    sections = sections == null ? List.of() : List.copyOf(sections);
  }
}
