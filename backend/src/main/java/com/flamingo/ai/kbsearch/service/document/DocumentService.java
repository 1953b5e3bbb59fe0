package com.flamingo.ai.kbsearch.service.document;

import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import java.util.List;
import java.util.UUID;

/** Read access to tracked corpus documents. */
public interface DocumentService {

  /**
   * @throws com.flamingo.ai.kbsearch.exception.DocumentNotFoundException if absent
   */
  Document getDocument(UUID documentId);

  /** Documents in the given status, most recently updated first. */
  List<Document> getDocumentsByStatus(DocumentStatus status, int limit);
}
