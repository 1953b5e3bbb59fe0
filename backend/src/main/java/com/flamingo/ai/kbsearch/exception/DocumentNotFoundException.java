package com.flamingo.ai.kbsearch.exception;

import java.util.UUID;

/**
 * A document ID that no longer resolves to a tracked corpus file. Raised by the read API and by
 * ingestion when a row disappears between two state transitions of the same run.
 */
public class DocumentNotFoundException extends RuntimeException {

  private final UUID documentId;

  private DocumentNotFoundException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public static DocumentNotFoundException notTracked(UUID documentId) {
    return new DocumentNotFoundException(
        documentId, "No corpus file is tracked under document id " + documentId);
  }

  public static DocumentNotFoundException removedDuringIngestion(UUID documentId) {
    return new DocumentNotFoundException(
        documentId, "Document " + documentId + " was removed while it was being ingested");
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
