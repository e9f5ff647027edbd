package com.flamingo.ai.discovery.service.generation.template;

import com.flamingo.ai.discovery.domain.enums.OutputType;
import com.flamingo.ai.discovery.exception.TemplateValidationException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the template a generation runs with.
 *
 * <p>A missing or unknown template id falls back to the built-in template of the output type.
 * Every resolved template is validated before use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateResolver {

  private final TemplateStore templateStore;

  /**
   * Resolves a template.
   *
   * @param templateId stored template id, may be null
   * @param outputType output type used for the built-in fallback
   * @return a validated template
   * @throws TemplateValidationException when the template is unusable
   */
  public ResolvedTemplate resolve(String templateId, OutputType outputType) {
    if (outputType == null) {
      throw new IllegalArgumentException("outputType is required");
    }
    ResolvedTemplate template = null;
    if (templateId != null && !templateId.isBlank()) {
      Optional<ResolvedTemplate> stored = templateStore.find(templateId);
      if (stored.isPresent()) {
        template = stored.get();
      } else {
        log.info("Template '{}' not found, using default for {}", templateId, outputType);
      }
    }
    if (template == null) {
      template = DefaultTemplates.forType(outputType);
    }
    validate(template);
    return template;
  }

  /** Single-section template that answers one question from the excerpts only. */
  public ResolvedTemplate forQuestion(String question) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("question is required");
    }
    ResolvedTemplate base = DefaultTemplates.forType(OutputType.QA_ANSWER);
    TemplateSection answer =
        TemplateSection.of(
            "Answer",
            "Answer the following question using only the provided source excerpts. If they do"
                + " not contain enough information to answer completely, say so.\n\nQuestion: "
                + question.strip());
    ResolvedTemplate template =
        new ResolvedTemplate(base.name(), base.systemPrompt(), List.of(answer));
    validate(template);
    return template;
  }

  /**
   * Checks that a template has a system prompt and at least one well formed section.
   *
   * @throws TemplateValidationException on the first violation found
   */
  public void validate(ResolvedTemplate template) {
    String name = template.name() == null ? "<unnamed>" : template.name();
    if (template.systemPrompt() == null || template.systemPrompt().isBlank()) {
      throw new TemplateValidationException(name, "system prompt is empty");
    }
    if (template.sections().isEmpty()) {
      throw new TemplateValidationException(name, "at least one section is required");
    }
    for (TemplateSection section : template.sections()) {
      if (section.name() == null || section.name().isBlank()) {
        throw new TemplateValidationException(name, "section without a name");
      }
      if (section.instructions() == null || section.instructions().isBlank()) {
        throw new TemplateValidationException(
            name, "section '" + section.name() + "' has no instructions");
      }
      Integer min = section.minLength();
      Integer max = section.maxLength();
      if ((min != null && min < 0) || (max != null && max < 0)) {
        throw new TemplateValidationException(
            name, "section '" + section.name() + "' has a negative length");
      }
      if (min != null && max != null && min > max) {
        throw new TemplateValidationException(
            name,
            "section '"
                + section.name()
                + "' has minLength "
                + min
                + " greater than maxLength "
                + max);
      }
    }
  }
}
