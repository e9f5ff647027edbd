package com.flamingo.ai.discovery.domain.enums;

import java.util.Locale;

/** Writing tone requested for generated prose. */
public enum Tone {
  INFORMATIVE,
  CASUAL,
  FORMAL,
  TECHNICAL,
  PERSUASIVE;

  /** Lower-case form used inside prompts. */
  public String promptValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
