package com.flamingo.ai.kbsearch.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk point in a model's vector index. The point ID is derived from document ID and ordinal;
 * identical text at several paths is stored once per path, each copy carrying its own path
 * metadata and sharing the same embeddings.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChunkVector implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String documentId;
  private String path;
  private String fileName;
  private int page;
  private int chunkIndex;
  private String contentHash;
  private String text;
  private List<Float> embedding;

  private String area;
  private Integer year;
  private String client;
  private String subject;
  private String docType;
  private String category;
  private String extension;
  private String lot;

  @Builder.Default private Double relevanceScore = 0.0;
}
