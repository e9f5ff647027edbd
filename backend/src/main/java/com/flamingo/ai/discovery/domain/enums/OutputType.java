package com.flamingo.ai.discovery.domain.enums;

/** Kinds of output a notebook can synthesize from its sources. */
public enum OutputType {
  SUMMARY("Summary"),
  BLOG_POST("Blog Post"),
  BRIEFING("Briefing"),
  REPORT("Report"),
  ESSAY("Essay"),
  FAQ("FAQ"),
  MEETING_NOTES("Meeting Notes"),
  COMPARATIVE_ANALYSIS("Comparative Analysis"),
  MIND_MAP("Mind Map"),
  QA_ANSWER("Answer"),
  CUSTOM("Custom Output");

  private final String displayName;

  OutputType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
