package com.flamingo.ai.kbsearch.api.dto.response;

import com.flamingo.ai.kbsearch.service.queue.QueueStats;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalDocuments;
  private Map<String, Long> documentsByStatus;
  private Map<String, Long> indexEntriesByModel;
  private QueueStats queue;
  private LocalDateTime timestamp;
}
