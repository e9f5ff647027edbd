package com.flamingo.ai.discovery.domain.enums;

/** Origin of a source's extracted text. */
public enum SourceType {
  FILE,
  URL,
  TEXT
}
