package com.flamingo.ai.discovery.domain.repository;

import com.flamingo.ai.discovery.domain.entity.Source;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Source entities. */
@Repository
public interface SourceRepository extends JpaRepository<Source, UUID> {

  /** Finds the non-deleted sources of a notebook, oldest first. */
  List<Source> findByNotebookIdAndDeletedAtIsNullOrderByCreatedAtAsc(UUID notebookId);
}
