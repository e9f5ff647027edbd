package com.flamingo.ai.discovery.domain.store;

import com.flamingo.ai.discovery.domain.entity.Source;
import java.util.List;
import java.util.UUID;

/** Read access to the current sources of a notebook. */
public interface SourceStore {

  /** Returns the non-deleted sources of the notebook. */
  List<Source> findActive(UUID notebookId);
}
