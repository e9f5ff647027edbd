package com.flamingo.ai.discovery.service.generation;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.store.OutputStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fails outputs left in GENERATING by a crash or a cancelled call once they are older than {@code
 * rag.generation.stale-after}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationReconciler {

  static final String STALE_ERROR = "Generation did not finish in time and was abandoned";

  private final OutputStore outputStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs one sweep.
   *
   * @return the number of outputs moved to FAILED
   */
  @Scheduled(
      fixedDelayString = "${rag.generation.reconcile-interval-ms:60000}",
      initialDelayString = "${rag.generation.reconcile-interval-ms:60000}")
  public int reconcile() {
    LocalDateTime cutoff = LocalDateTime.now().minus(ragConfig.getGeneration().getStaleAfter());
    int failed = 0;
    for (Output output : outputStore.findStaleGenerating(cutoff)) {
      if (outputStore.fail(output.getId(), STALE_ERROR)) {
        failed++;
        log.warn(
            "Marked output {} FAILED: GENERATING since {}",
            output.getId(),
            output.getGenerationStartedAt());
      }
    }
    if (failed > 0) {
      meterRegistry.counter("generation.reconciled").increment(failed);
    }
    return failed;
  }
}
