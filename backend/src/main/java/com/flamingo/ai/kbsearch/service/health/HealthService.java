package com.flamingo.ai.kbsearch.service.health;

import com.flamingo.ai.kbsearch.api.dto.response.SystemStats;

/** Service for system health checks and statistics. */
public interface HealthService {

  SystemStats getSystemStats();
}
