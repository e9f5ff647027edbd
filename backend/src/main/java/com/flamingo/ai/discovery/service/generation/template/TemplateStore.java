package com.flamingo.ai.discovery.service.generation.template;

import java.util.Optional;

/** Lookup of user-defined output templates. */
public interface TemplateStore {

  /** Returns the template stored under the id, unvalidated. */
  Optional<ResolvedTemplate> find(String templateId);
}
