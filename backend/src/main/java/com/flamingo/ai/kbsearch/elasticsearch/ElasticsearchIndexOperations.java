package com.flamingo.ai.kbsearch.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Upserts documents in bulk under their deterministic IDs.
   *
   * @throws com.flamingo.ai.kbsearch.exception.IndexWriteException when any write is not
   *     acknowledged
   */
  void indexDocuments(List<T> documents);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /** Refreshes the index to make recent changes visible for search. */
  void refresh();

  String getIndexName();
}
