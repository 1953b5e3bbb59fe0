package com.flamingo.ai.kbsearch.domain.entity;

import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Progress record of one ingestion job. Every counter and control flag lives here so that any
 * worker or API node reads the same state.
 */
@Entity
@Table(name = "ingestion_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IngestionRun {

  @Id private String jobId;

  @Column(nullable = false)
  private String model;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private IngestionMode mode;

  @Column(nullable = false, length = 2048)
  private String target;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private IngestionStage stage = IngestionStage.QUEUED;

  @Builder.Default private int total = 0;
  @Builder.Default private int done = 0;
  @Builder.Default private int succeeded = 0;
  @Builder.Default private int skipped = 0;
  @Builder.Default private int failed = 0;
  @Builder.Default private int quarantined = 0;

  @Column(length = 2048)
  private String currentPath;

  @Builder.Default private boolean pauseRequested = false;
  @Builder.Default private boolean cancelRequested = false;

  @Column(columnDefinition = "TEXT")
  private String error;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime startedAt;
  private LocalDateTime updatedAt;
  private LocalDateTime finishedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
