package com.flamingo.ai.discovery.exception;

/** Machine-readable error codes carried by {@link SynthesisException}. */
public final class ErrorCodes {

  public static final String INDEXING_FAILED = "INDEX_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String TEMPLATE_INVALID = "TEMPLATE_001";
  public static final String EMPTY_CONTEXT = "CONTEXT_001";
  public static final String OUTPUT_NOT_FOUND = "OUTPUT_001";
  public static final String GENERATION_CONFLICT = "OUTPUT_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String LLM_ERROR = "LLM_003";

  private ErrorCodes() {}
}
