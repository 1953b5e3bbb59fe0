package com.flamingo.ai.kbsearch.service.dedup;

import com.flamingo.ai.kbsearch.domain.repository.IndexEntryRepository;
import com.google.common.hash.Hashing;
import com.google.common.io.Files;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Content identity for the ingestion pipeline.
 *
 * <p>The content fingerprint is a SHA-256 over the extracted text with whitespace collapsed and
 * case folded, so re-encodings of the same document share one fingerprint. The raw file hash is a
 * SHA-256 over the bytes and serves the cheap incremental skip.
 */
@Service
@RequiredArgsConstructor
public class ContentFingerprinter {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final IndexEntryRepository indexEntryRepository;

  public String fingerprint(String text) {
    String normalized = WHITESPACE.matcher(text.strip()).replaceAll(" ").toLowerCase(Locale.ROOT);
    return Hashing.sha256().hashString(normalized, StandardCharsets.UTF_8).toString();
  }

  public String fileHash(Path file) throws IOException {
    return Files.asByteSource(file.toFile()).hash(Hashing.sha256()).toString();
  }

  /** True when this exact (path, content, model) triple is already indexed. */
  @Transactional(readOnly = true)
  public boolean isKnown(String path, String contentHash, String model) {
    return indexEntryRepository.existsByPathAndContentHashAndModel(path, contentHash, model);
  }

  /** True when the content was already embedded for the model, under any path. */
  @Transactional(readOnly = true)
  public boolean isContentIndexed(String contentHash, String model) {
    return indexEntryRepository.existsByContentHashAndModel(contentHash, model);
  }

  /**
   * Deterministic vector point ID for the chunk at {@code ordinal} of a document. Re-indexing the
   * same document overwrites its points in place.
   */
  public static String pointId(UUID documentId, int ordinal) {
    return UUID.nameUUIDFromBytes((documentId + ":" + ordinal).getBytes(StandardCharsets.UTF_8))
        .toString();
  }
}
