package com.flamingo.ai.kbsearch.domain.entity;

import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A file of the corpus, keyed by a stable identifier derived from its path. */
@Entity
@Table(
    name = "documents",
    indexes = {
      @Index(name = "idx_documents_path", columnList = "path", unique = true),
      @Index(name = "idx_documents_status", columnList = "status"),
      @Index(name = "idx_documents_content_hash", columnList = "content_hash")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id private UUID id;

  @Column(nullable = false, length = 2048)
  private String path;

  @Column(nullable = false)
  private String fileName;

  private String extension;

  /** Name of the detected {@code DocumentFormat}, null when the extension is unknown. */
  @Column(name = "doc_format")
  private String format;

  private Long sizeBytes;

  /** SHA-256 of the raw bytes. */
  @Column(length = 64)
  private String fileHash;

  /** Fingerprint of the normalized extracted text. */
  @Column(name = "content_hash", length = 64)
  private String contentHash;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.DISCOVERED;

  /** Consecutive failures for the current {@link #fileHash}. */
  @Builder.Default private int failureCount = 0;

  private String lastErrorKind;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  // Metadata parsed from folder and file naming conventions
  private String area;
  @Column(name = "doc_year")
  private Integer year;
  private String client;
  private String subject;
  private String docType;
  private String category;
  private String lot;
  private String version;

  private Integer pageCount;
  private boolean ocrApplied;

  @Column(nullable = false, updatable = false)
  private LocalDateTime discoveredAt;

  private LocalDateTime updatedAt;
  private LocalDateTime extractedAt;
  private LocalDateTime indexedAt;

  /** Stable identifier for a path: the same file always maps to the same document. */
  public static UUID idForPath(String normalizedPath) {
    return UUID.nameUUIDFromBytes(normalizedPath.getBytes(StandardCharsets.UTF_8));
  }

  @PrePersist
  protected void onCreate() {
    discoveredAt = LocalDateTime.now();
    updatedAt = discoveredAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Resets the failure streak when the file bytes differ from the last attempt. */
  public void observeFileHash(String newFileHash) {
    if (fileHash != null && !fileHash.equals(newFileHash)) {
      failureCount = 0;
      if (status == DocumentStatus.QUARANTINED) {
        status = DocumentStatus.DISCOVERED;
      }
    }
    fileHash = newFileHash;
  }

  public void markIndexed() {
    this.status = DocumentStatus.INDEXED;
    this.failureCount = 0;
    this.lastErrorKind = null;
    this.lastError = null;
    this.indexedAt = LocalDateTime.now();
  }

  /**
   * Records a failure. Returns true when the streak reached {@code quarantineThreshold} and the
   * document is now quarantined.
   */
  public boolean markFailed(String errorKind, String errorMessage, int quarantineThreshold) {
    this.failureCount++;
    this.lastErrorKind = errorKind;
    this.lastError = errorMessage;
    if (failureCount >= quarantineThreshold) {
      this.status = DocumentStatus.QUARANTINED;
      return true;
    }
    this.status = DocumentStatus.FAILED;
    return false;
  }
}
