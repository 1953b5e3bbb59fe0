package com.flamingo.ai.kbsearch.service.ingestion;

/** Structured metadata parsed from a file's location in the corpus. Absent fields are null. */
public record PathMetadata(
    String area,
    Integer year,
    String client,
    String subject,
    String docType,
    String category,
    String lot,
    String version,
    String extension) {

  public static PathMetadata empty(String extension) {
    return new PathMetadata(null, null, null, null, null, null, null, null, extension);
  }

  public PathMetadata withVersion(String newVersion) {
    return new PathMetadata(
        area, year, client, subject, docType, category, lot, newVersion, extension);
  }
}
