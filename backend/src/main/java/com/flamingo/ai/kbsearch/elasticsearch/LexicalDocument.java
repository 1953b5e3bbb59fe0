package com.flamingo.ai.kbsearch.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One document of the lexical index, keyed by the Document ID. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LexicalDocument implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private String path;
  private String fileName;
  private String extension;

  private String area;
  private Integer year;
  private String client;
  private String subject;
  private String docType;
  private String category;
  private String lot;
  private String version;

  private String contentHash;

  /** Leading slice of the extracted text. */
  private String content;

  @Builder.Default private Double relevanceScore = 0.0;
}
