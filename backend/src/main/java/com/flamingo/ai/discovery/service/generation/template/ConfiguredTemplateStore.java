package com.flamingo.ai.discovery.service.generation.template;

import com.flamingo.ai.discovery.config.RagConfig;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** {@link TemplateStore} over the templates declared under {@code rag.templates.definitions}. */
@Component
@RequiredArgsConstructor
public class ConfiguredTemplateStore implements TemplateStore {

  private final RagConfig ragConfig;

  @Override
  public Optional<ResolvedTemplate> find(String templateId) {
    RagConfig.TemplateDefinition definition =
        ragConfig.getTemplates().getDefinitions().get(templateId);
    if (definition == null) {
      return Optional.empty();
    }
    List<TemplateSection> sections =
        definition.getSections().stream()
            .map(
                s ->
                    new TemplateSection(
                        s.getName(), s.getInstructions(), s.getMinLength(), s.getMaxLength()))
            .toList();
    String name = definition.getName() != null ? definition.getName() : templateId;
    return Optional.of(new ResolvedTemplate(name, definition.getSystemPrompt(), sections));
  }
}
