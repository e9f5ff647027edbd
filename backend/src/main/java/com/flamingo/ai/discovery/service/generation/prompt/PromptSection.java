package com.flamingo.ai.discovery.service.generation.prompt;

/** One block of the user message, in assembly order. */
public record PromptSection(Kind kind, String content) {

  /** Section kinds in the order they appear in a prompt. */
  public enum Kind {
    INSTRUCTIONS,
    PARAMETERS,
    CUSTOM_PROMPT,
    EXCERPT
  }
}
