package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.entity.IndexEntry;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.kbsearch.domain.repository.IndexEntryRepository;
import com.flamingo.ai.kbsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.kbsearch.service.extraction.DocumentFormat;
import com.flamingo.ai.kbsearch.service.extraction.ExtractionResult;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-document state transitions. Each method commits on its own so that a crash leaves the
 * document in its last acknowledged state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStateService {

  private final DocumentRepository documentRepository;
  private final IndexEntryRepository indexEntryRepository;
  private final RetryingTransactions transactions;

  /**
   * Result of registering a scanned file.
   *
   * @param document the persisted document
   * @param fileUnchanged true when the raw bytes match the previous observation
   */
  public record Discovery(Document document, boolean fileUnchanged) {}

  public Discovery discover(Path file, String fileHash, long sizeBytes, PathMetadata metadata) {
    String path = file.toString();
    return transactions.execute(
        "discover " + path,
        () -> {
          Document document =
              documentRepository
                  .findByPath(path)
                  .orElseGet(
                      () ->
                          Document.builder()
                              .id(Document.idForPath(path))
                              .path(path)
                              .fileName(file.getFileName().toString())
                              .build());
          boolean unchanged = fileHash.equals(document.getFileHash());
          document.observeFileHash(fileHash);
          document.setSizeBytes(sizeBytes);
          document.setExtension(metadata.extension());
          document.setFormat(
              DocumentFormat.fromExtension(metadata.extension()).map(Enum::name).orElse(null));
          document.setArea(metadata.area());
          document.setYear(metadata.year());
          document.setClient(metadata.client());
          document.setSubject(metadata.subject());
          document.setDocType(metadata.docType());
          document.setCategory(metadata.category());
          document.setLot(metadata.lot());
          document.setVersion(metadata.version());
          return new Discovery(documentRepository.save(document), unchanged);
        });
  }

  public void transition(UUID documentId, DocumentStatus status) {
    transactions.run(
        "transition " + documentId + " to " + status,
        () -> {
          Document document = find(documentId);
          document.setStatus(status);
          documentRepository.save(document);
        });
  }

  public void markExtracted(UUID documentId, ExtractionResult extraction, String contentHash) {
    transactions.run(
        "mark extracted " + documentId,
        () -> {
          Document document = find(documentId);
          document.setStatus(DocumentStatus.EXTRACTED);
          document.setContentHash(contentHash);
          document.setPageCount(extraction.pageCount());
          document.setOcrApplied(extraction.ocrApplied());
          document.setExtractedAt(LocalDateTime.now());
          documentRepository.save(document);
        });
  }

  /** Refreshes timestamps of an entry that is already indexed and marks the document INDEXED. */
  public void touchKnown(UUID documentId, String path, String contentHash, String model) {
    transactions.run(
        "touch " + path,
        () -> {
          indexEntryRepository.touch(path, contentHash, model, LocalDateTime.now());
          Document document = find(documentId);
          if (document.getStatus() != DocumentStatus.INDEXED) {
            document.markIndexed();
            documentRepository.save(document);
          }
        });
  }

  /**
   * Records the acknowledged index writes: saves or refreshes the entry, marks the document
   * INDEXED and drops entries of older content at the same path.
   *
   * @return content hashes that no entry of the model references any more
   */
  public List<String> completeIndexing(
      UUID documentId, String path, String contentHash, String model, int chunkCount) {
    return transactions.execute(
        "complete indexing " + path,
        () -> {
          IndexEntry entry =
              indexEntryRepository
                  .findByPathAndContentHashAndModel(path, contentHash, model)
                  .orElseGet(
                      () ->
                          IndexEntry.builder()
                              .documentId(documentId)
                              .path(path)
                              .contentHash(contentHash)
                              .model(model)
                              .build());
          entry.setChunkCount(chunkCount);
          entry.setLastSeenAt(LocalDateTime.now());
          indexEntryRepository.save(entry);

          Document document = find(documentId);
          document.markIndexed();
          documentRepository.save(document);

          List<String> orphaned = new ArrayList<>();
          for (IndexEntry stale : indexEntryRepository.findByPathAndModel(path, model)) {
            if (stale.getContentHash().equals(contentHash)) {
              continue;
            }
            indexEntryRepository.delete(stale);
            indexEntryRepository.flush();
            if (!indexEntryRepository.existsByContentHashAndModel(stale.getContentHash(), model)) {
              orphaned.add(stale.getContentHash());
            }
          }
          return orphaned;
        });
  }

  /** Returns true when the failure quarantined the document. */
  public boolean markFailed(
      UUID documentId, String errorKind, String message, int quarantineThreshold) {
    return transactions.execute(
        "mark failed " + documentId,
        () -> {
          Document document = find(documentId);
          boolean quarantined = document.markFailed(errorKind, message, quarantineThreshold);
          documentRepository.save(document);
          if (quarantined) {
            log.warn(
                "[INGEST] Quarantined {} after {} consecutive failures",
                document.getPath(),
                document.getFailureCount());
          }
          return quarantined;
        });
  }

  private Document find(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> DocumentNotFoundException.removedDuringIngestion(documentId));
  }
}
