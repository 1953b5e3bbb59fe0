package com.flamingo.ai.kbsearch.service.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One ranked document of a search result. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

  private String documentId;
  private String path;
  private String fileName;

  /** Fused score in [0, 1]. */
  private double score;

  /** Normalized lexical score, null when the document was not a lexical candidate. */
  private Double lexicalScore;

  /** Clamped vector score, null when the document was not a vector candidate. */
  private Double vectorScore;

  /** Page of the best matching chunk. */
  private Integer page;

  private String snippet;

  private String area;
  private Integer year;
  private String client;
  private String subject;
  private String docType;
  private String category;
  private String extension;
  private String lot;
  private String version;
}
