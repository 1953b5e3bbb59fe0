package com.flamingo.ai.kbsearch.domain.repository;

import com.flamingo.ai.kbsearch.domain.entity.IngestionFailure;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for the bounded failure log. */
@Repository
public interface IngestionFailureRepository extends JpaRepository<IngestionFailure, Long> {

  List<IngestionFailure> findAllByOrderByIdDesc(Pageable pageable);

  List<IngestionFailure> findByJobIdOrderByIdDesc(String jobId, Pageable pageable);

  /** Deletes every entry older than the given id. */
  @Modifying
  @Query("DELETE FROM IngestionFailure f WHERE f.id < :minId")
  int deleteOlderThan(@Param("minId") long minId);
}
