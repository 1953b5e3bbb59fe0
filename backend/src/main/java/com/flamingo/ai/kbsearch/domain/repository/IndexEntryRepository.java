package com.flamingo.ai.kbsearch.domain.repository;

import com.flamingo.ai.kbsearch.domain.entity.IndexEntry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for IndexEntry entities. */
@Repository
public interface IndexEntryRepository extends JpaRepository<IndexEntry, UUID> {

  boolean existsByPathAndContentHashAndModel(String path, String contentHash, String model);

  Optional<IndexEntry> findByPathAndContentHashAndModel(
      String path, String contentHash, String model);

  /** True when any path already carries this content for the model. */
  boolean existsByContentHashAndModel(String contentHash, String model);

  List<IndexEntry> findByDocumentId(UUID documentId);

  List<IndexEntry> findByPathAndModel(String path, String model);

  long countByModel(String model);

  @Modifying
  @Query(
      "UPDATE IndexEntry e SET e.lastSeenAt = :seenAt "
          + "WHERE e.path = :path AND e.contentHash = :contentHash AND e.model = :model")
  int touch(
      @Param("path") String path,
      @Param("contentHash") String contentHash,
      @Param("model") String model,
      @Param("seenAt") LocalDateTime seenAt);
}
