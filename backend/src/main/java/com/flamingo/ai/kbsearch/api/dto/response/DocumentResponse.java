package com.flamingo.ai.kbsearch.api.dto.response;

import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String path;
  private String fileName;
  private String extension;
  private String format;
  private Long sizeBytes;
  private DocumentStatus status;
  private int failureCount;
  private String lastErrorKind;
  private String lastError;
  private String area;
  private Integer year;
  private String client;
  private String subject;
  private String docType;
  private String category;
  private String lot;
  private String version;
  private Integer pageCount;
  private boolean ocrApplied;
  private LocalDateTime discoveredAt;
  private LocalDateTime indexedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .path(document.getPath())
        .fileName(document.getFileName())
        .extension(document.getExtension())
        .format(document.getFormat())
        .sizeBytes(document.getSizeBytes())
        .status(document.getStatus())
        .failureCount(document.getFailureCount())
        .lastErrorKind(document.getLastErrorKind())
        .lastError(document.getLastError())
        .area(document.getArea())
        .year(document.getYear())
        .client(document.getClient())
        .subject(document.getSubject())
        .docType(document.getDocType())
        .category(document.getCategory())
        .lot(document.getLot())
        .version(document.getVersion())
        .pageCount(document.getPageCount())
        .ocrApplied(document.isOcrApplied())
        .discoveredAt(document.getDiscoveredAt())
        .indexedAt(document.getIndexedAt())
        .build();
  }
}
