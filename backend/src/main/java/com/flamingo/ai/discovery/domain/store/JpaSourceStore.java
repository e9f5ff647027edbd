package com.flamingo.ai.discovery.domain.store;

import com.flamingo.ai.discovery.domain.entity.Source;
import com.flamingo.ai.discovery.domain.repository.SourceRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** {@link SourceStore} backed by the JPA source table. */
@Component
@RequiredArgsConstructor
public class JpaSourceStore implements SourceStore {

  private final SourceRepository sourceRepository;

  @Override
  @Transactional(readOnly = true)
  public List<Source> findActive(UUID notebookId) {
    return sourceRepository.findByNotebookIdAndDeletedAtIsNullOrderByCreatedAtAsc(notebookId);
  }
}
