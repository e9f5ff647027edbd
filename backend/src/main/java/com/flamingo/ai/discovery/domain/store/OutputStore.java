package com.flamingo.ai.discovery.domain.store;

import com.flamingo.ai.discovery.domain.entity.GenerationSettings;
import com.flamingo.ai.discovery.domain.entity.Output;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence of outputs with atomic status transitions.
 *
 * <p>Every {@code boolean} method is a conditional update: it returns {@code false}, and changes
 * nothing, when the output is not in the state the transition starts from. This is the only
 * mutual exclusion between concurrent generations of the same output.
 */
public interface OutputStore {

  /** Persists a new output in DRAFT. */
  Output create(Output output);

  Optional<Output> findById(UUID outputId);

  /** DRAFT to GENERATING, stamping the start time. */
  boolean startGeneration(UUID outputId);

  /** COMPLETED or FAILED to GENERATING, incrementing the version. */
  boolean restartGeneration(UUID outputId);

  /** Stores the settings a regenerate runs with. Only valid while the output is GENERATING. */
  void updateSettings(UUID outputId, String title, GenerationSettings settings);

  /** GENERATING to COMPLETED with the generated content. */
  boolean complete(UUID outputId, GeneratedContent result);

  /** GENERATING to FAILED, recording the error and leaving content untouched. */
  boolean fail(UUID outputId, String error);

  /** Outputs in GENERATING whose generation started before the cutoff. */
  List<Output> findStaleGenerating(LocalDateTime startedBefore);
}
