package com.flamingo.ai.kbsearch.service.health;

import com.flamingo.ai.kbsearch.api.dto.response.SystemStats;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.kbsearch.domain.repository.IndexEntryRepository;
import com.flamingo.ai.kbsearch.exception.QueueException;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelSpec;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import com.flamingo.ai.kbsearch.service.queue.QueueStats;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final DocumentRepository documentRepository;
  private final IndexEntryRepository indexEntryRepository;
  private final EmbeddingModelRegistry modelRegistry;
  private final JobQueue jobQueue;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    Map<String, Long> byStatus = new LinkedHashMap<>();
    for (DocumentStatus status : DocumentStatus.values()) {
      byStatus.put(status.name(), 0L);
    }
    for (Object[] row : documentRepository.countGroupedByStatus()) {
      byStatus.put(((DocumentStatus) row[0]).name(), ((Number) row[1]).longValue());
    }

    Map<String, Long> byModel = new LinkedHashMap<>();
    for (EmbeddingModelSpec spec : modelRegistry.specs()) {
      byModel.put(spec.name(), indexEntryRepository.countByModel(spec.name()));
    }

    QueueStats queue;
    try {
      queue = jobQueue.stats();
    } catch (QueueException e) {
      log.warn("Queue stats unavailable: {}", e.getMessage());
      queue = null;
    }

    return SystemStats.builder()
        .totalDocuments(documentRepository.count())
        .documentsByStatus(byStatus)
        .indexEntriesByModel(byModel)
        .queue(queue)
        .timestamp(LocalDateTime.now())
        .build();
  }
}
