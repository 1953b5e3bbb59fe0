package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVector;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVectorIndexService;
import com.flamingo.ai.kbsearch.elasticsearch.LexicalDocument;
import com.flamingo.ai.kbsearch.elasticsearch.VectorIndexRegistry;
import com.flamingo.ai.kbsearch.exception.EmbeddingException;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import com.flamingo.ai.kbsearch.exception.IndexWriteException;
import com.flamingo.ai.kbsearch.exception.QueueException;
import com.flamingo.ai.kbsearch.exception.SearchException;
import com.flamingo.ai.kbsearch.service.dedup.ContentFingerprinter;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingDispatcher;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingModelRegistry;
import com.flamingo.ai.kbsearch.service.extraction.DocumentExtractor;
import com.flamingo.ai.kbsearch.service.extraction.ExtractionResult;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one ingestion job: scan, then per document extract, fingerprint, chunk, embed and index.
 *
 * <p>Documents are processed sequentially. Control flags are read between documents. A document
 * error is recorded and the run moves on; a transient index failure that outlasts its retries
 * fails the whole run so that the queue can redeliver the job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionOrchestrator {

  // Point lists kept in memory for copying onto duplicates later in the same run
  private static final int RECENT_CONTENT_CACHE = 32;

  private final CorpusScanner corpusScanner;
  private final PathMetadataExtractor metadataExtractor;
  private final DocumentExtractor documentExtractor;
  private final ContentFingerprinter fingerprinter;
  private final TextChunker textChunker;
  private final EmbeddingDispatcher embeddingDispatcher;
  private final EmbeddingModelRegistry modelRegistry;
  private final VectorIndexRegistry vectorIndexRegistry;
  private final IndexWriter indexWriter;
  private final DocumentStateService documentState;
  private final ProgressService progressService;
  private final JobQueue jobQueue;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  /** State shared by the documents of one run. */
  private static final class RunContext {
    final IngestionJob job;
    final String model;
    final ChunkVectorIndexService vectorIndex;
    final Set<String> embeddedThisRun = new HashSet<>();
    boolean leaseLost;
    final Map<String, List<ChunkVector>> recentPoints =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, List<ChunkVector>> eldest) {
            return size() > RECENT_CONTENT_CACHE;
          }
        };

    RunContext(IngestionJob job, String model, ChunkVectorIndexService vectorIndex) {
      this.job = job;
      this.model = model;
      this.vectorIndex = vectorIndex;
    }

    boolean incremental() {
      return job.mode() == IngestionMode.INCREMENTAL;
    }
  }

  /**
   * Executes the job to completion.
   *
   * @return the final stage: DONE or CANCELLED, or the current stage when another worker still
   *     holds the run
   * @throws IndexWriteException when transient index failures exhaust their retries
   */
  public IngestionStage run(IngestionJob job) {
    Timer.Sample sample = Timer.start(meterRegistry);
    String jobId = job.jobId();
    try {
      if (!progressService.startRun(job)) {
        return progressService.snapshot(jobId).stage();
      }
      embeddingDispatcher.beginRun();
      String model = modelRegistry.resolve(job.model());
      RunContext context = new RunContext(job, model, vectorIndexRegistry.forModel(model));

      if (progressService.control(jobId).cancelRequested()) {
        progressService.finish(jobId, IngestionStage.CANCELLED, null);
        return IngestionStage.CANCELLED;
      }

      Path target = corpusScanner.resolveTarget(job.target());
      List<Path> files = corpusScanner.scan(target);
      progressService.setTotal(jobId, files.size());
      log.info(
          "[INGEST] Run {} started: mode={}, model={}, {} files under {}",
          jobId,
          job.mode(),
          model,
          files.size(),
          target);

      for (Path file : files) {
        keepAlive(context);
        if (!awaitRunnable(context)) {
          progressService.finish(jobId, IngestionStage.CANCELLED, null);
          log.info("[INGEST] Run {} cancelled", jobId);
          return IngestionStage.CANCELLED;
        }
        progressService.documentStarted(jobId, file.toString());
        DocumentOutcome outcome = processDocument(context, file);
        progressService.documentFinished(jobId, outcome);
        meterRegistry
            .counter("ingestion.documents." + outcome.name().toLowerCase(Locale.ROOT))
            .increment();
      }

      progressService.finish(jobId, IngestionStage.DONE, null);
      return IngestionStage.DONE;
    } catch (IOException e) {
      progressService.finish(jobId, IngestionStage.FAILED, "Scan failed: " + e.getMessage());
      throw new UncheckedIOException("Failed to scan target of job " + jobId, e);
    } catch (RuntimeException e) {
      log.error("[INGEST] Run {} failed: {}", jobId, e.getMessage(), e);
      progressService.finish(jobId, IngestionStage.FAILED, e.getMessage());
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("ingestion.run.duration"));
    }
  }

  /**
   * Blocks while the run is paused.
   *
   * @return false when the run was cancelled
   */
  private boolean awaitRunnable(RunContext context) {
    String jobId = context.job.jobId();
    RunControl control = progressService.control(jobId);
    if (control.pauseRequested() && !control.cancelRequested()) {
      progressService.setStage(jobId, IngestionStage.PAUSED);
      log.info("[INGEST] Run {} paused", jobId);
      while (control.pauseRequested() && !control.cancelRequested()) {
        try {
          Thread.sleep(ingestionConfig.getOrchestrator().getPausePollInterval().toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while paused", e);
        }
        progressService.heartbeat(jobId);
        keepAlive(context);
        control = progressService.control(jobId);
      }
      if (!control.cancelRequested()) {
        progressService.setStage(jobId, IngestionStage.PROCESSING);
        log.info("[INGEST] Run {} resumed", jobId);
      }
    }
    return !control.cancelRequested();
  }

  /** Pushes the job's lease forward so the queue does not hand it to another worker. */
  private void keepAlive(RunContext context) {
    String jobId = context.job.jobId();
    try {
      if (!jobQueue.extendLease(jobId) && !context.leaseLost) {
        context.leaseLost = true;
        log.warn("[INGEST] Run {} no longer holds its queue lease", jobId);
      }
    } catch (QueueException e) {
      log.warn("[INGEST] Could not extend the lease of run {}: {}", jobId, e.getMessage());
    }
  }

  DocumentOutcome processDocument(RunContext context, Path file) {
    String path = file.toString();
    Document document;
    boolean fileUnchanged;
    try {
      String fileHash = fingerprinter.fileHash(file);
      DocumentStateService.Discovery discovery =
          documentState.discover(
              file, fileHash, Files.size(file), metadataExtractor.extract(file));
      document = discovery.document();
      fileUnchanged = discovery.fileUnchanged();
    } catch (IOException e) {
      log.warn("[INGEST] Cannot read {}: {}", path, e.getMessage());
      progressService.recordFailure(
          context.job.jobId(),
          Document.idForPath(path),
          path,
          "CORRUPT_FILE",
          "Unreadable file: " + e.getMessage(),
          false);
      return DocumentOutcome.FAILED;
    }

    if (document.getStatus() == DocumentStatus.QUARANTINED) {
      log.debug("[INGEST] Skipping quarantined {}", path);
      return DocumentOutcome.SKIPPED;
    }

    UUID documentId = document.getId();
    try {
      if (context.incremental()
          && fileUnchanged
          && document.getContentHash() != null
          && fingerprinter.isKnown(path, document.getContentHash(), context.model)) {
        documentState.touchKnown(documentId, path, document.getContentHash(), context.model);
        return DocumentOutcome.SKIPPED;
      }

      String previousContentHash = document.getContentHash();
      documentState.transition(documentId, DocumentStatus.EXTRACTING);
      ExtractionResult extraction = documentExtractor.extract(file);
      String contentHash = fingerprinter.fingerprint(extraction.text());
      documentState.markExtracted(documentId, extraction, contentHash);

      if (context.incremental() && fingerprinter.isKnown(path, contentHash, context.model)) {
        documentState.touchKnown(documentId, path, contentHash, context.model);
        return DocumentOutcome.SKIPPED;
      }

      List<ChunkVector> stored = reusablePoints(context, contentHash);
      List<ChunkVector> points;
      if (stored.isEmpty()) {
        List<TextChunk> chunks = textChunker.chunk(extraction);
        documentState.transition(documentId, DocumentStatus.EMBEDDING);
        List<List<Float>> vectors =
            embeddingDispatcher.embed(
                chunks.stream().map(TextChunk::text).toList(), context.model);
        points = toPoints(document, contentHash, chunks, vectors);
        context.embeddedThisRun.add(contentHash);
      } else {
        log.debug("[INGEST] Reusing vectors of content {} for {}", contentHash, path);
        points = copyPoints(stored, document);
      }
      indexWriter.writeVectors(context.vectorIndex, points);
      context.recentPoints.put(contentHash, points);
      if (previousContentHash != null && !previousContentHash.equals(contentHash)) {
        dropStalePoints(context, documentId, contentHash);
      }

      indexWriter.writeLexical(toLexical(document, contentHash, extraction.text()));
      List<String> orphaned =
          documentState.completeIndexing(
              documentId, path, contentHash, context.model, points.size());
      dropOrphanedVectors(context, orphaned);
      log.info("[INGEST] Indexed {} ({} chunks)", path, points.size());
      return DocumentOutcome.INDEXED;
    } catch (ExtractionException e) {
      return fail(context, document, e.getKind().name(), e.getMessage());
    } catch (EmbeddingException e) {
      return fail(context, document, e.getKind().name(), e.getMessage());
    } catch (IndexWriteException e) {
      if (e.isTransient()) {
        throw e;
      }
      return fail(context, document, "INDEX_WRITE_REJECTED", e.getMessage());
    } catch (RuntimeException e) {
      log.error("[INGEST] Unexpected error on {}", path, e);
      return fail(context, document, "INTERNAL_ERROR", e.getMessage());
    }
  }

  private DocumentOutcome fail(
      RunContext context, Document document, String errorKind, String message) {
    log.warn("[INGEST] {} failed with {}: {}", document.getPath(), errorKind, message);
    boolean quarantined =
        documentState.markFailed(
            document.getId(),
            errorKind,
            message,
            ingestionConfig.getOrchestrator().getQuarantineThreshold());
    progressService.recordFailure(
        context.job.jobId(), document.getId(), document.getPath(), errorKind, message, quarantined);
    return quarantined ? DocumentOutcome.QUARANTINED : DocumentOutcome.FAILED;
  }

  /**
   * Points already embedded for this content, taken from the run's recent documents or, when the
   * content is known from this run or an earlier one, read back from the vector index. Empty when
   * the content has to be embedded.
   */
  private List<ChunkVector> reusablePoints(RunContext context, String contentHash) {
    List<ChunkVector> recent = context.recentPoints.get(contentHash);
    if (recent != null) {
      return recent;
    }
    boolean known =
        context.embeddedThisRun.contains(contentHash)
            || (context.incremental()
                && fingerprinter.isContentIndexed(contentHash, context.model));
    if (!known) {
      return List.of();
    }
    try {
      return context.vectorIndex.findPointsOfContent(contentHash);
    } catch (SearchException e) {
      log.warn(
          "[INGEST] Could not read stored vectors of content {}, embedding again: {}",
          contentHash,
          e.getMessage());
      return List.of();
    }
  }

  private void dropStalePoints(RunContext context, UUID documentId, String contentHash) {
    try {
      context.vectorIndex.deleteStalePoints(documentId.toString(), contentHash);
    } catch (IndexWriteException e) {
      log.warn(
          "[INGEST] Could not delete previous vectors of document {}: {}",
          documentId,
          e.getMessage());
    }
  }

  private void dropOrphanedVectors(RunContext context, List<String> orphaned) {
    for (String contentHash : orphaned) {
      try {
        context.vectorIndex.deleteByContentHash(contentHash);
      } catch (IndexWriteException e) {
        log.warn(
            "[INGEST] Could not delete stale vectors of content {}: {}",
            contentHash,
            e.getMessage());
      }
    }
  }

  private static List<ChunkVector> toPoints(
      Document document, String contentHash, List<TextChunk> chunks, List<List<Float>> vectors) {
    List<ChunkVector> points = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      ChunkVector point =
          ChunkVector.builder()
              .id(ContentFingerprinter.pointId(document.getId(), chunk.ordinal()))
              .page(chunk.page())
              .chunkIndex(chunk.ordinal())
              .contentHash(contentHash)
              .text(chunk.text())
              .embedding(vectors.get(i))
              .build();
      points.add(withDocument(point, document));
    }
    return points;
  }

  /** Copies another document's points of the same content under this document's identity. */
  private static List<ChunkVector> copyPoints(List<ChunkVector> source, Document document) {
    List<ChunkVector> points = new ArrayList<>(source.size());
    for (ChunkVector point : source) {
      points.add(
          withDocument(
              point.toBuilder()
                  .id(ContentFingerprinter.pointId(document.getId(), point.getChunkIndex()))
                  .relevanceScore(0.0)
                  .build(),
              document));
    }
    return points;
  }

  private static ChunkVector withDocument(ChunkVector point, Document document) {
    return point.toBuilder()
        .documentId(document.getId().toString())
        .path(document.getPath())
        .fileName(document.getFileName())
        .area(document.getArea())
        .year(document.getYear())
        .client(document.getClient())
        .subject(document.getSubject())
        .docType(document.getDocType())
        .category(document.getCategory())
        .extension(document.getExtension())
        .lot(document.getLot())
        .build();
  }

  private LexicalDocument toLexical(Document document, String contentHash, String text) {
    int limit = ingestionConfig.getOrchestrator().getLexicalContentChars();
    return LexicalDocument.builder()
        .id(document.getId().toString())
        .path(document.getPath())
        .fileName(document.getFileName())
        .extension(document.getExtension())
        .area(document.getArea())
        .year(document.getYear())
        .client(document.getClient())
        .subject(document.getSubject())
        .docType(document.getDocType())
        .category(document.getCategory())
        .lot(document.getLot())
        .version(document.getVersion())
        .contentHash(contentHash)
        .content(text.length() > limit ? text.substring(0, limit) : text)
        .build();
  }
}
