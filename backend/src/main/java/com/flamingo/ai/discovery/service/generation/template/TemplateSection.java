package com.flamingo.ai.discovery.service.generation.template;

/**
 * One section the generated output must contain. Lengths are in words and optional.
 *
 * @param name section heading
 * @param instructions what the section must cover
 * @param minLength minimum words, or null
 * @param maxLength maximum words, or null
 */
public record TemplateSection(
    String name, String instructions, Integer minLength, Integer maxLength) {

  public static TemplateSection of(String name, String instructions) {
    return new TemplateSection(name, instructions, null, null);
  }

  /** Human readable length constraint, or null when unconstrained. */
  public String lengthHint() {
    if (minLength != null && maxLength != null) {
      return "Length: " + minLength + " to " + maxLength + " words.";
    }
    if (minLength != null) {
      return "Length: at least " + minLength + " words.";
    }
    if (maxLength != null) {
      return "Length: at most " + maxLength + " words.";
    }
    return null;
  }
}
