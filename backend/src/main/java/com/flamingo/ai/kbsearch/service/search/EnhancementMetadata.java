package com.flamingo.ai.kbsearch.service.search;

import com.fasterxml.jackson.annotation.JsonInclude;

/** What the query engine did beyond plain retrieval. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EnhancementMetadata(
    String cleanedQuery,
    DateFilter dateFilter,
    boolean filteredByDate,
    int removedByDateFilter,
    boolean deduplicated,
    int removedDuplicates) {}
