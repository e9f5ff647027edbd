package com.flamingo.ai.discovery.service.generation;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.discovery.config.RagConfig;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.enums.OutputStatus;
import com.flamingo.ai.discovery.domain.enums.OutputType;
import com.flamingo.ai.discovery.support.InMemoryOutputStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GenerationReconciler Tests")
class GenerationReconcilerTest {

  private InMemoryOutputStore outputStore;
  private SimpleMeterRegistry meterRegistry;
  private GenerationReconciler reconciler;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getGeneration().setStaleAfter(Duration.ofMinutes(15));
    outputStore = new InMemoryOutputStore();
    meterRegistry = new SimpleMeterRegistry();
    reconciler = new GenerationReconciler(outputStore, ragConfig, meterRegistry);
  }

  private UUID generatingOutput(LocalDateTime startedAt) {
    Output output =
        outputStore.create(
            Output.builder()
                .notebookId(UUID.randomUUID())
                .title("Summary")
                .outputType(OutputType.SUMMARY)
                .build());
    outputStore.startGeneration(output.getId());
    outputStore.setGenerationStartedAt(output.getId(), startedAt);
    return output.getId();
  }

  @Test
  @DisplayName("Should fail outputs stuck in GENERATING past the cutoff")
  void shouldFailStaleOutputs() {
    UUID stale = generatingOutput(LocalDateTime.now().minusHours(1));

    assertThat(reconciler.reconcile()).isEqualTo(1);

    Output output = outputStore.findById(stale).orElseThrow();
    assertThat(output.getStatus()).isEqualTo(OutputStatus.FAILED);
    assertThat(output.getLastError()).isEqualTo(GenerationReconciler.STALE_ERROR);
    assertThat(meterRegistry.counter("generation.reconciled").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should leave recent generations alone")
  void shouldKeepRecentGenerations() {
    UUID recent = generatingOutput(LocalDateTime.now().minusMinutes(1));

    assertThat(reconciler.reconcile()).isZero();

    assertThat(outputStore.findById(recent).orElseThrow().getStatus())
        .isEqualTo(OutputStatus.GENERATING);
  }

  @Test
  @DisplayName("Should allow regenerating a reconciled output")
  void shouldMakeReconciledOutputRegenerable() {
    UUID stale = generatingOutput(LocalDateTime.now().minusHours(1));
    reconciler.reconcile();

    assertThat(outputStore.restartGeneration(stale)).isTrue();
    assertThat(outputStore.findById(stale).orElseThrow().getVersion()).isEqualTo(2);
  }
}
