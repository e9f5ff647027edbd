package com.flamingo.ai.discovery.domain.repository;

import com.flamingo.ai.discovery.domain.entity.Output;
import com.flamingo.ai.discovery.domain.enums.OutputStatus;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for Output entities.
 *
 * <p>The update queries are compare-and-set on {@code status}: they return 1 when the row was in
 * one of the expected states and 0 otherwise.
 */
@Repository
public interface OutputRepository extends JpaRepository<Output, UUID> {

  /** Finds outputs stuck in a status since before the cutoff. */
  List<Output> findByStatusAndGenerationStartedAtBefore(OutputStatus status, LocalDateTime cutoff);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Output o SET o.status = :target, o.generationStartedAt = :now, o.updatedAt = :now,"
          + " o.lastError = null"
          + " WHERE o.id = :id AND o.status IN :expected AND o.deletedAt IS NULL")
  int startGeneration(
      @Param("id") UUID id,
      @Param("expected") Collection<OutputStatus> expected,
      @Param("target") OutputStatus target,
      @Param("now") LocalDateTime now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Output o SET o.status = :target, o.version = o.version + 1,"
          + " o.generationStartedAt = :now, o.updatedAt = :now, o.lastError = null"
          + " WHERE o.id = :id AND o.status IN :expected AND o.deletedAt IS NULL")
  int restartGeneration(
      @Param("id") UUID id,
      @Param("expected") Collection<OutputStatus> expected,
      @Param("target") OutputStatus target,
      @Param("now") LocalDateTime now);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE Output o SET o.status = :target, o.updatedAt = :now"
          + " WHERE o.id = :id AND o.status = :expected")
  int transition(
      @Param("id") UUID id,
      @Param("expected") OutputStatus expected,
      @Param("target") OutputStatus target,
      @Param("now") LocalDateTime now);
}
