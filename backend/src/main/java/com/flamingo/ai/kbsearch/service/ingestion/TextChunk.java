package com.flamingo.ai.kbsearch.service.ingestion;

/**
 * A slice of a document's text.
 *
 * @param ordinal position in the document, 0-based across all pages
 * @param page 1-based page the slice was cut from
 * @param text the slice
 */
public record TextChunk(int ordinal, int page, String text) {}
