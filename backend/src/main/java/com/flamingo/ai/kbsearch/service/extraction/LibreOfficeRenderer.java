package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Headless LibreOffice conversion to {@code txt:Text} in a throwaway output directory. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LibreOfficeRenderer implements DocumentRenderer {

  private final IngestionConfig ingestionConfig;
  private final ExternalProcessRunner processRunner;

  @Override
  public String renderToText(Path source) {
    IngestionConfig.Extraction config = ingestionConfig.getExtraction();
    Path outDir = null;
    try {
      outDir = Files.createTempDirectory("kbsearch-render-");
      List<String> command =
          List.of(
              config.getRendererCommand(),
              "--headless",
              "--norestore",
              "--convert-to",
              "txt:Text",
              "--outdir",
              outDir.toString(),
              source.toAbsolutePath().toString());

      ProcessResult result = processRunner.run(command, config.getRendererTimeout(), outDir);
      Path output = outDir.resolve(baseName(source) + ".txt");
      if (!result.succeeded() || !Files.exists(output)) {
        throw new ExtractionException(
            ExtractionErrorKind.CORRUPT_FILE,
            "Renderer produced no output (exit " + result.exitCode() + "): "
                + abbreviate(result.stderr()));
      }
      return Files.readString(output, StandardCharsets.UTF_8);
    } catch (ExternalProcessRunner.StartFailedException e) {
      throw new ExtractionException(ExtractionErrorKind.RENDERER_MISSING, e.getMessage(), e);
    } catch (ExternalProcessRunner.TimedOutException e) {
      throw new ExtractionException(ExtractionErrorKind.RENDERER_TIMEOUT, e.getMessage(), e);
    } catch (IOException e) {
      throw new ExtractionException(ExtractionErrorKind.CORRUPT_FILE, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException(
          ExtractionErrorKind.RENDERER_TIMEOUT, "Interrupted while rendering", e);
    } finally {
      deleteQuietly(outDir);
    }
  }

  private static String baseName(Path source) {
    String name = source.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static String abbreviate(String text) {
    String trimmed = text == null ? "" : text.strip();
    return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
  }

  private static void deleteQuietly(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> walk = Files.walk(dir)) {
      walk.sorted(Comparator.reverseOrder())
          .forEach(
              p -> {
                try {
                  Files.deleteIfExists(p);
                } catch (IOException e) {
                  log.debug("[RENDER] Could not delete {}: {}", p, e.getMessage());
                }
              });
    } catch (IOException e) {
      log.debug("[RENDER] Could not clean {}: {}", dir, e.getMessage());
    }
  }
}
