package com.flamingo.ai.kbsearch.service.document;

import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.kbsearch.exception.DocumentNotFoundException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of DocumentService. */
@Service
@RequiredArgsConstructor
public class DocumentServiceImpl implements DocumentService {

  private static final int MAX_PAGE = 500;

  private final DocumentRepository documentRepository;

  @Override
  @Transactional(readOnly = true)
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> DocumentNotFoundException.notTracked(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> getDocumentsByStatus(DocumentStatus status, int limit) {
    int size = Math.max(1, Math.min(limit, MAX_PAGE));
    if (status == null) {
      return documentRepository
          .findAll(PageRequest.of(0, size, Sort.by(Sort.Direction.DESC, "updatedAt")))
          .getContent();
    }
    return documentRepository.findByStatusOrderByUpdatedAtDesc(status, PageRequest.of(0, size));
  }
}
