package com.flamingo.ai.discovery.domain.store;

import com.flamingo.ai.discovery.domain.entity.GenerationSettings;
import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.enums.OutputStatus;
import com.flamingo.ai.discovery.domain.repository.OutputRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link OutputStore} on top of {@link OutputRepository}.
 *
 * <p>Terminal transitions run the status compare-and-set first and only then load the row to write
 * content, inside one transaction, so a lost race never touches the row.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaOutputStore implements OutputStore {

  private final OutputRepository outputRepository;

  @Override
  @Transactional
  public Output create(Output output) {
    output.setStatus(OutputStatus.DRAFT);
    return outputRepository.save(output);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Output> findById(UUID outputId) {
    return outputRepository.findById(outputId).filter(output -> output.getDeletedAt() == null);
  }

  @Override
  @Transactional
  public boolean startGeneration(UUID outputId) {
    return outputRepository.startGeneration(
            outputId,
            EnumSet.of(OutputStatus.DRAFT),
            OutputStatus.GENERATING,
            LocalDateTime.now())
        == 1;
  }

  @Override
  @Transactional
  public boolean restartGeneration(UUID outputId) {
    return outputRepository.restartGeneration(
            outputId,
            EnumSet.of(OutputStatus.COMPLETED, OutputStatus.FAILED),
            OutputStatus.GENERATING,
            LocalDateTime.now())
        == 1;
  }

  @Override
  @Transactional
  public void updateSettings(UUID outputId, String title, GenerationSettings settings) {
    Output output =
        outputRepository
            .findById(outputId)
            .orElseThrow(() -> new IllegalStateException("Output vanished: " + outputId));
    if (output.getStatus() != OutputStatus.GENERATING) {
      throw new IllegalStateException(
          "Settings of output " + outputId + " can only change while GENERATING");
    }
    output.setTitle(title);
    output.setSettings(settings);
    outputRepository.save(output);
  }

  @Override
  @Transactional
  public boolean complete(UUID outputId, GeneratedContent result) {
    LocalDateTime now = LocalDateTime.now();
    if (outputRepository.transition(
            outputId, OutputStatus.GENERATING, OutputStatus.COMPLETED, now)
        == 0) {
      log.warn("Output {} left GENERATING before completion could be recorded", outputId);
      return false;
    }
    Output output = outputRepository.findById(outputId).orElseThrow();
    output.setContent(result.content());
    output.setSourceReferences(new ArrayList<>(result.sourceReferences()));
    output.setWordCount(result.wordCount());
    output.setMetadata(new LinkedHashMap<>(result.metadata()));
    output.setGeneratedAt(now);
    output.setLastError(null);
    outputRepository.save(output);
    return true;
  }

  @Override
  @Transactional
  public boolean fail(UUID outputId, String error) {
    if (outputRepository.transition(
            outputId, OutputStatus.GENERATING, OutputStatus.FAILED, LocalDateTime.now())
        == 0) {
      return false;
    }
    Output output = outputRepository.findById(outputId).orElseThrow();
    output.setLastError(error);
    Map<String, String> metadata = new LinkedHashMap<>();
    if (output.getMetadata() != null) {
      metadata.putAll(output.getMetadata());
    }
    metadata.put("error", error == null ? "" : error);
    output.setMetadata(metadata);
    outputRepository.save(output);
    return true;
  }

  @Override
  @Transactional(readOnly = true)
  public List<Output> findStaleGenerating(LocalDateTime startedBefore) {
    return outputRepository.findByStatusAndGenerationStartedAtBefore(
        OutputStatus.GENERATING, startedBefore);
  }
}
