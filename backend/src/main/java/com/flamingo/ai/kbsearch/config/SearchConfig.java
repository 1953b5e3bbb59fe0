package com.flamingo.ai.kbsearch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the hybrid query engine. */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchConfig {

  private int defaultTopK = 10;
  private int maxTopK = 100;
  private int candidateMultiplier = 3;
  private int maxCandidates = 200;
  private String lexicalIndex = "kb_docs";
  private String textAnalyzer = "italian";
  private boolean deduplicateByDefault = true;
  private boolean smartFilterByDefault = true;
  private int snippetChars = 300;
}
