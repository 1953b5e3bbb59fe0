package com.flamingo.ai.kbsearch.domain.repository;

import com.flamingo.ai.kbsearch.domain.entity.IngestionRun;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for IngestionRun entities.
 *
 * <p>The worker and the API write to the same row concurrently, so every update touches only its
 * own columns instead of saving the whole entity.
 */
@Repository
public interface IngestionRunRepository extends JpaRepository<IngestionRun, String> {

  /** The current or most recently created run. */
  Optional<IngestionRun> findFirstByOrderByCreatedAtDesc();

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.stage = :stage, r.total = 0, r.done = 0, r.succeeded = 0, "
          + "r.skipped = 0, r.failed = 0, r.quarantined = 0, r.currentPath = NULL, "
          + "r.error = NULL, r.finishedAt = NULL, r.startedAt = :now, r.updatedAt = :now "
          + "WHERE r.jobId = :jobId AND (r.stage NOT IN :active OR r.updatedAt IS NULL "
          + "OR r.updatedAt < :staleBefore)")
  int start(
      @Param("jobId") String jobId,
      @Param("stage") IngestionStage stage,
      @Param("active") Collection<IngestionStage> active,
      @Param("staleBefore") LocalDateTime staleBefore,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query("UPDATE IngestionRun r SET r.updatedAt = :now WHERE r.jobId = :jobId")
  int touch(@Param("jobId") String jobId, @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.stage = :stage, r.updatedAt = :now WHERE r.jobId = :jobId")
  int updateStage(
      @Param("jobId") String jobId,
      @Param("stage") IngestionStage stage,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.total = :total, r.stage = :stage, r.updatedAt = :now "
          + "WHERE r.jobId = :jobId")
  int updateTotal(
      @Param("jobId") String jobId,
      @Param("total") int total,
      @Param("stage") IngestionStage stage,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.currentPath = :path, r.updatedAt = :now "
          + "WHERE r.jobId = :jobId")
  int updateCurrentPath(
      @Param("jobId") String jobId, @Param("path") String path, @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.done = r.done + 1, r.succeeded = r.succeeded + :succeeded, "
          + "r.skipped = r.skipped + :skipped, r.failed = r.failed + :failed, "
          + "r.quarantined = r.quarantined + :quarantined, r.updatedAt = :now "
          + "WHERE r.jobId = :jobId")
  int incrementCounters(
      @Param("jobId") String jobId,
      @Param("succeeded") int succeeded,
      @Param("skipped") int skipped,
      @Param("failed") int failed,
      @Param("quarantined") int quarantined,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.stage = :stage, r.error = :error, r.currentPath = NULL, "
          + "r.finishedAt = :now, r.updatedAt = :now WHERE r.jobId = :jobId")
  int finish(
      @Param("jobId") String jobId,
      @Param("stage") IngestionStage stage,
      @Param("error") String error,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.pauseRequested = :paused, r.updatedAt = :now "
          + "WHERE r.jobId = :jobId")
  int updatePauseRequested(
      @Param("jobId") String jobId,
      @Param("paused") boolean paused,
      @Param("now") LocalDateTime now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE IngestionRun r SET r.cancelRequested = true, r.pauseRequested = false, "
          + "r.updatedAt = :now WHERE r.jobId = :jobId")
  int requestCancel(@Param("jobId") String jobId, @Param("now") LocalDateTime now);
}
