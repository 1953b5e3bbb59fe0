package com.flamingo.ai.kbsearch.api.rest;

import com.flamingo.ai.kbsearch.api.dto.response.DocumentResponse;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.service.document.DocumentService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for tracked documents. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Gets a document by ID. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(documentService.getDocument(documentId)));
  }

  /** Lists documents, optionally restricted to one status. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> getDocuments(
      @RequestParam(value = "status", required = false) DocumentStatus status,
      @RequestParam(value = "limit", defaultValue = "100") int limit) {
    return ResponseEntity.ok(
        documentService.getDocumentsByStatus(status, limit).stream()
            .map(DocumentResponse::fromEntity)
            .toList());
  }
}
