package com.flamingo.ai.kbsearch.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import com.flamingo.ai.kbsearch.domain.entity.Document;
import com.flamingo.ai.kbsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.kbsearch.domain.enums.IngestionMode;
import com.flamingo.ai.kbsearch.domain.enums.IngestionStage;
import com.flamingo.ai.kbsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.kbsearch.domain.repository.IndexEntryRepository;
import com.flamingo.ai.kbsearch.domain.repository.IngestionFailureRepository;
import com.flamingo.ai.kbsearch.domain.repository.IngestionRunRepository;
import com.flamingo.ai.kbsearch.elasticsearch.ChunkVector;
import com.flamingo.ai.kbsearch.exception.IndexWriteException;
import com.flamingo.ai.kbsearch.service.dedup.ContentFingerprinter;
import com.flamingo.ai.kbsearch.service.embedding.EmbeddingDispatcher;
import com.flamingo.ai.kbsearch.service.queue.IngestionJob;
import com.flamingo.ai.kbsearch.service.queue.JobQueue;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Runs the orchestrator against real extraction, fingerprinting and state tracking on H2, with
 * the embedding backend and the index writes mocked out.
 */
@SpringBootTest
@ActiveProfiles("test")
class IngestionOrchestratorTest {

  private static final String MODEL = "sentence-transformer";
  private static final Path CORPUS_ROOT = createCorpusRoot();

  @MockitoBean private ElasticsearchClient elasticsearchClient;
  @MockitoBean private EmbeddingDispatcher embeddingDispatcher;
  @MockitoBean private IndexWriter indexWriter;
  @MockitoBean private JobQueue jobQueue;

  @Autowired private IngestionOrchestrator orchestrator;
  @Autowired private ProgressService progressService;
  @Autowired private DocumentRepository documentRepository;
  @Autowired private IndexEntryRepository indexEntryRepository;
  @Autowired private IngestionFailureRepository failureRepository;
  @Autowired private IngestionRunRepository runRepository;

  private Path target;

  private static Path createCorpusRoot() {
    try {
      return Files.createTempDirectory("kbsearch-orchestrator-");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @DynamicPropertySource
  static void corpusProperties(DynamicPropertyRegistry registry) {
    registry.add("ingestion.corpus.root", CORPUS_ROOT::toString);
    registry.add("ingestion.orchestrator.quarantine-threshold", () -> "1");
  }

  @BeforeEach
  void setUp() throws IOException {
    indexEntryRepository.deleteAll();
    documentRepository.deleteAll();
    failureRepository.deleteAll();
    runRepository.deleteAll();
    target = Files.createDirectories(CORPUS_ROOT.resolve("Tecnico_" + UUID.randomUUID()));

    when(embeddingDispatcher.embed(anyList(), anyString()))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              List<List<Float>> vectors = new ArrayList<>();
              texts.forEach(t -> vectors.add(List.of(0.1f, 0.2f, 0.3f)));
              return vectors;
            });
  }

  private Path write(String name, String content) throws IOException {
    Path file = target.resolve(name);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content, StandardCharsets.UTF_8);
  }

  private IngestionJob submit(IngestionMode mode) {
    IngestionJob job = IngestionJob.create(mode, MODEL, target.toString());
    progressService.createRun(job);
    return job;
  }

  @Test
  @DisplayName("should index valid files and quarantine a corrupt one without aborting the run")
  void shouldIsolateCorruptFile() throws IOException {
    for (int i = 1; i <= 9; i++) {
      write("relazione_" + i + ".txt", "Relazione tecnica numero " + i + " sul cantiere di Milano.");
    }
    Path corrupt = target.resolve("offerta_rotta.pdf");
    Files.write(corrupt, new byte[] {0x01, 0x02, 0x03, 0x04, 0x05});
    IngestionJob job = submit(IngestionMode.FULL);

    IngestionStage stage = orchestrator.run(job);

    assertThat(stage).isEqualTo(IngestionStage.DONE);
    ProgressSnapshot snapshot = progressService.snapshot(job.jobId());
    assertThat(snapshot.total()).isEqualTo(10);
    assertThat(snapshot.done()).isEqualTo(10);
    assertThat(snapshot.succeeded()).isEqualTo(9);
    assertThat(snapshot.quarantined()).isEqualTo(1);
    assertThat(snapshot.recentFailures())
        .singleElement()
        .satisfies(
            failure -> {
              assertThat(failure.errorKind()).isEqualTo("CORRUPT_FILE");
              assertThat(failure.quarantined()).isTrue();
            });
    assertThat(documentRepository.countByStatus(DocumentStatus.INDEXED)).isEqualTo(9);
    Document quarantined = documentRepository.findByPath(corrupt.toString()).orElseThrow();
    assertThat(quarantined.getStatus()).isEqualTo(DocumentStatus.QUARANTINED);
    assertThat(quarantined.getLastErrorKind()).isEqualTo("CORRUPT_FILE");
    assertThat(indexEntryRepository.countByModel(MODEL)).isEqualTo(9);
  }

  @Test
  @DisplayName("should extend the queue lease before every document")
  void shouldExtendLeaseBetweenDocuments() throws IOException {
    write("a.txt", "Primo documento.");
    write("b.txt", "Secondo documento.");
    write("c.txt", "Terzo documento.");
    IngestionJob job = submit(IngestionMode.FULL);
    when(jobQueue.extendLease(job.jobId())).thenReturn(true);

    assertThat(orchestrator.run(job)).isEqualTo(IngestionStage.DONE);

    verify(jobQueue, times(3)).extendLease(job.jobId());
  }

  @Test
  @DisplayName("should leave a run that another worker is still processing")
  void shouldNotRestartActiveRun() throws IOException {
    write("verbale.txt", "Verbale di consegna lavori.");
    IngestionJob job = submit(IngestionMode.FULL);
    progressService.startRun(job);
    progressService.setTotal(job.jobId(), 1);

    IngestionStage stage = orchestrator.run(job.nextAttempt());

    assertThat(stage).isEqualTo(IngestionStage.PROCESSING);
    verify(embeddingDispatcher, never()).embed(anyList(), anyString());
    verify(indexWriter, never()).writeLexical(any());
    assertThat(documentRepository.count()).isZero();
    assertThat(progressService.snapshot(job.jobId()).total()).isEqualTo(1);
  }

  @Test
  @DisplayName("should skip unchanged documents on an incremental re-run")
  void shouldBeIdempotent() throws IOException {
    write("verbale.txt", "Verbale di collaudo del lotto 3.");
    write("capitolato.txt", "Capitolato speciale d'appalto.");
    orchestrator.run(submit(IngestionMode.INCREMENTAL));
    long entriesAfterFirstRun = indexEntryRepository.count();

    IngestionJob second = submit(IngestionMode.INCREMENTAL);
    IngestionStage stage = orchestrator.run(second);

    assertThat(stage).isEqualTo(IngestionStage.DONE);
    ProgressSnapshot snapshot = progressService.snapshot(second.jobId());
    assertThat(snapshot.skipped()).isEqualTo(2);
    assertThat(snapshot.succeeded()).isZero();
    assertThat(indexEntryRepository.count()).isEqualTo(entriesAfterFirstRun);
    verify(embeddingDispatcher, times(2)).embed(anyList(), anyString());
    verify(indexWriter, times(2)).writeVectors(any(), anyList());
  }

  @Test
  @DisplayName("should embed identical text at two paths only once")
  void shouldEmbedDuplicateContentOnce() throws IOException {
    write("offerta.txt", "Offerta economica per la manutenzione.");
    write("copia/offerta.txt", "Offerta   economica per la MANUTENZIONE.");
    IngestionJob job = submit(IngestionMode.FULL);

    orchestrator.run(job);

    verify(embeddingDispatcher, times(1)).embed(anyList(), anyString());
    verify(indexWriter, times(2)).writeLexical(any());
    assertThat(documentRepository.countByStatus(DocumentStatus.INDEXED)).isEqualTo(2);
    assertThat(indexEntryRepository.count()).isEqualTo(2);
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  @DisplayName("should write the shared vectors once per path under each path's identity")
  void shouldWriteDuplicateContentPerDocument() throws IOException {
    Path original = write("offerta.txt", "Offerta economica per la manutenzione.");
    Path copy = write("copia/offerta.txt", "Offerta   economica per la MANUTENZIONE.");

    orchestrator.run(submit(IngestionMode.FULL));

    ArgumentCaptor<List<ChunkVector>> points = ArgumentCaptor.forClass((Class) List.class);
    verify(indexWriter, times(2)).writeVectors(any(), points.capture());
    Document originalDoc = documentRepository.findByPath(original.toString()).orElseThrow();
    Document copyDoc = documentRepository.findByPath(copy.toString()).orElseThrow();
    Map<String, List<ChunkVector>> byDocument = new HashMap<>();
    points.getAllValues().forEach(list -> byDocument.put(list.get(0).getDocumentId(), list));

    assertThat(byDocument).containsOnlyKeys(originalDoc.getId().toString(), copyDoc.getId().toString());
    List<ChunkVector> copyPoints = byDocument.get(copyDoc.getId().toString());
    List<ChunkVector> originalPoints = byDocument.get(originalDoc.getId().toString());
    assertThat(copyPoints).allSatisfy(
        point -> {
          assertThat(point.getPath()).isEqualTo(copy.toString());
          assertThat(point.getId())
              .isEqualTo(ContentFingerprinter.pointId(copyDoc.getId(), point.getChunkIndex()));
        });
    assertThat(originalPoints).allSatisfy(point -> assertThat(point.getPath()).isEqualTo(original.toString()));
    assertThat(copyPoints)
        .extracting(ChunkVector::getEmbedding)
        .containsExactlyElementsOf(originalPoints.stream().map(ChunkVector::getEmbedding).toList());
  }

  @Test
  @DisplayName("should drop a document's previous vectors when its content changes")
  void shouldDeleteStaleVectorsOnChange() throws IOException {
    Path file = write("relazione.txt", "Prima versione della relazione.");
    orchestrator.run(submit(IngestionMode.INCREMENTAL));
    clearInvocations(elasticsearchClient);

    Files.writeString(file, "Seconda versione, completamente riscritta.", StandardCharsets.UTF_8);
    orchestrator.run(submit(IngestionMode.INCREMENTAL));

    // One delete for the document's stale points, one for the orphaned content
    verify(elasticsearchClient, times(2)).deleteByQuery(any(DeleteByQueryRequest.class));
  }

  @Test
  @DisplayName("should re-embed a document whose content changed and report the orphaned content")
  void shouldReplaceChangedContent() throws IOException {
    Path file = write("relazione.txt", "Prima versione della relazione.");
    orchestrator.run(submit(IngestionMode.INCREMENTAL));
    String firstHash = documentRepository.findByPath(file.toString()).orElseThrow().getContentHash();

    Files.writeString(file, "Seconda versione della relazione, rivista.", StandardCharsets.UTF_8);
    orchestrator.run(submit(IngestionMode.INCREMENTAL));

    Document document = documentRepository.findByPath(file.toString()).orElseThrow();
    assertThat(document.getContentHash()).isNotEqualTo(firstHash);
    assertThat(indexEntryRepository.findByPathAndModel(file.toString(), MODEL))
        .singleElement()
        .satisfies(entry -> assertThat(entry.getContentHash()).isEqualTo(document.getContentHash()));
    verify(embeddingDispatcher, times(2)).embed(anyList(), anyString());
  }

  @Test
  @DisplayName("should stop between documents when cancellation is requested")
  void shouldCancelBetweenDocuments() throws IOException {
    write("a.txt", "Primo documento.");
    write("b.txt", "Secondo documento.");
    write("c.txt", "Terzo documento.");
    IngestionJob job = submit(IngestionMode.FULL);
    AtomicReference<String> jobId = new AtomicReference<>(job.jobId());
    when(embeddingDispatcher.embed(anyList(), anyString()))
        .thenAnswer(
            invocation -> {
              progressService.requestCancel(jobId.get());
              return List.of(List.of(0.1f, 0.2f, 0.3f));
            });

    IngestionStage stage = orchestrator.run(job);

    assertThat(stage).isEqualTo(IngestionStage.CANCELLED);
    ProgressSnapshot snapshot = progressService.snapshot(job.jobId());
    assertThat(snapshot.stage()).isEqualTo(IngestionStage.CANCELLED);
    assertThat(snapshot.done()).isEqualTo(1);
    assertThat(snapshot.finishedAt()).isNotNull();
  }

  @Test
  @DisplayName("should not start a run cancelled while queued")
  void shouldHonourCancelBeforeStart() throws IOException {
    write("a.txt", "Primo documento.");
    IngestionJob job = submit(IngestionMode.FULL);
    progressService.requestCancel(job.jobId());

    assertThat(orchestrator.run(job)).isEqualTo(IngestionStage.CANCELLED);
    verify(embeddingDispatcher, never()).embed(anyList(), anyString());
  }

  @Test
  @DisplayName("should fail the run when transient index failures outlast their retries")
  void shouldFailRunOnTransientIndexFailure() throws IOException {
    write("a.txt", "Primo documento.");
    IngestionJob job = submit(IngestionMode.FULL);
    doThrow(IndexWriteException.transientFailure("kb_docs", "cluster unavailable", null))
        .when(indexWriter)
        .writeLexical(any());

    assertThatThrownBy(() -> orchestrator.run(job)).isInstanceOf(IndexWriteException.class);
    ProgressSnapshot snapshot = progressService.snapshot(job.jobId());
    assertThat(snapshot.stage()).isEqualTo(IngestionStage.FAILED);
    assertThat(snapshot.error()).contains("cluster unavailable");
  }

  @Test
  @DisplayName("should record a permanent index rejection as a document failure")
  void shouldRecordPermanentIndexFailure() throws IOException {
    write("a.txt", "Primo documento.");
    IngestionJob job = submit(IngestionMode.FULL);
    doThrow(IndexWriteException.permanentFailure("kb_docs", "mapper_parsing_exception"))
        .when(indexWriter)
        .writeLexical(any());

    assertThat(orchestrator.run(job)).isEqualTo(IngestionStage.DONE);
    assertThat(progressService.snapshot(job.jobId()).recentFailures())
        .extracting(ProgressSnapshot.FailureView::errorKind)
        .containsExactly("INDEX_WRITE_REJECTED");
  }
}
