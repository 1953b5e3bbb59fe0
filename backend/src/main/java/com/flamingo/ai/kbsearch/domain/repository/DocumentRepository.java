package com.flamingo.ai.kbsearch.domain.repository;

import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  Optional<Document> findByPath(String path);

  /** Finds documents by status, most recently updated first. */
  List<Document> findByStatusOrderByUpdatedAtDesc(DocumentStatus status, Pageable pageable);

  long countByStatus(DocumentStatus status);

  /** Per-status counts for the stats endpoint. */
  @Query("SELECT d.status, COUNT(d) FROM Document d GROUP BY d.status")
  List<Object[]> countGroupedByStatus();
}
