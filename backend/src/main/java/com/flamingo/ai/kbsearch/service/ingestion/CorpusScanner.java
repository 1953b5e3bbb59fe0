package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.service.extraction.DocumentFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lists candidate files under an ingestion target in a stable order. Hidden files, office lock
 * files and configured archive or media extensions are left out. Files of unknown format are
 * kept so that they are reported rather than silently ignored.
 */
@Component
@Slf4j
public class CorpusScanner {

  private final Path corpusRoot;
  private final Set<String> skipExtensions;

  public CorpusScanner(IngestionConfig ingestionConfig) {
    this.corpusRoot = Path.of(ingestionConfig.getCorpus().getRoot()).toAbsolutePath().normalize();
    this.skipExtensions =
        ingestionConfig.getCorpus().getSkipExtensions().stream()
            .map(e -> e.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
  }

  /** Resolves a target against the corpus root; blank means the whole corpus. */
  public Path resolveTarget(String target) {
    if (target == null || target.isBlank()) {
      return corpusRoot;
    }
    Path path = Path.of(target);
    return (path.isAbsolute() ? path : corpusRoot.resolve(path)).normalize();
  }

  public List<Path> scan(Path target) throws IOException {
    if (Files.isRegularFile(target)) {
      return List.of(target.toAbsolutePath().normalize());
    }
    try (Stream<Path> walk = Files.walk(target)) {
      List<Path> files =
          walk.filter(Files::isRegularFile)
              .map(p -> p.toAbsolutePath().normalize())
              .filter(this::isCandidate)
              .sorted()
              .collect(Collectors.toList());
      log.info("[SCAN] {} candidate files under {}", files.size(), target);
      return files;
    }
  }

  boolean isCandidate(Path file) {
    String name = file.getFileName().toString();
    if (name.startsWith(".") || name.startsWith("~$")) {
      return false;
    }
    return !skipExtensions.contains(DocumentFormat.extensionOf(name));
  }
}
