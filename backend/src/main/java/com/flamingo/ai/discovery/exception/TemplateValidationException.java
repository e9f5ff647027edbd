package com.flamingo.ai.discovery.exception;

/** Exception thrown for a template that cannot produce a usable prompt. */
public class TemplateValidationException extends SynthesisException {

  private final String templateName;

  public TemplateValidationException(String templateName, String message) {
    super(
        ErrorCodes.TEMPLATE_INVALID,
        "Template '" + templateName + "': " + message,
        "The selected template is invalid: " + message,
        false,
        null);
    this.templateName = templateName;
  }

  public String getTemplateName() {
    return templateName;
  }
}
