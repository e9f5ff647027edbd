package com.flamingo.ai.discovery.provider;

import com.flamingo.ai.discovery.exception.LlmServiceException;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Large language model used for generation.
 *
 * <p>Implementations report failures as {@link LlmServiceException}, flagged transient when the
 * same call may succeed on a later attempt.
 */
public interface LlmProvider {

  /** Generates the complete answer in one call. */
  String complete(Prompt prompt, double temperature, int maxTokens);

  /**
   * Streams the answer as text deltas. Cancelling the subscription abandons the underlying call.
   */
  Flux<String> stream(Prompt prompt, double temperature, int maxTokens);

  /** Estimated size of {@code text} in the model's tokens. */
  int countTokens(String text);
}
