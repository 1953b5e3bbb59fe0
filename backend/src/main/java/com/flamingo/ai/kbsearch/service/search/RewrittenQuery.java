package com.flamingo.ai.kbsearch.service.search;

import java.util.Optional;

/**
 * Output of the query rewriter.
 *
 * @param original the text as typed, used for the vector query
 * @param cleanedQuery text for the lexical backend: date phrase and stopwords removed
 * @param dateFilter the recognized date constraint, if any
 */
public record RewrittenQuery(String original, String cleanedQuery, Optional<DateFilter> dateFilter) {}
