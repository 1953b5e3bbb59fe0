package com.flamingo.ai.kbsearch.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Records that a document's content has been written to the indexes for one embedding model. At
 * most one row exists per (path, content hash, model).
 */
@Entity
@Table(
    name = "index_entries",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_index_entries_path_hash_model",
            columnNames = {"path", "content_hash", "model"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private UUID documentId;

  @Column(nullable = false, length = 2048)
  private String path;

  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  @Column(nullable = false)
  private String model;

  private int chunkCount;

  @Column(nullable = false, updatable = false)
  private LocalDateTime indexedAt;

  private LocalDateTime lastSeenAt;

  @PrePersist
  protected void onCreate() {
    indexedAt = LocalDateTime.now();
    lastSeenAt = indexedAt;
  }
}
