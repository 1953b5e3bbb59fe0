package com.flamingo.ai.kbsearch.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One entry of the bounded failure log. */
@Entity
@Table(name = "ingestion_failures")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionFailure {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  private String jobId;

  private UUID documentId;

  @Column(nullable = false, length = 2048)
  private String path;

  @Column(nullable = false)
  private String errorKind;

  @Column(columnDefinition = "TEXT")
  private String message;

  private boolean quarantined;

  @Column(nullable = false, updatable = false)
  private LocalDateTime occurredAt;

  @PrePersist
  protected void onCreate() {
    if (occurredAt == null) {
      occurredAt = LocalDateTime.now();
    }
  }
}
