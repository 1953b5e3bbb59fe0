package com.flamingo.ai.kbsearch.service.search;

/**
 * Per-query switches.
 *
 * @param topK maximum number of hits returned
 * @param deduplicate collapse versions of the same file
 * @param smartFilter apply a date filter recognized in the query
 * @param model embedding model for the vector side; blank selects the default
 */
public record SearchOptions(int topK, boolean deduplicate, boolean smartFilter, String model) {}
