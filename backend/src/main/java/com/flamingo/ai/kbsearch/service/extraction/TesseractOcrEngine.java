package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Tesseract CLI, text written to stdout. */
@Component
@RequiredArgsConstructor
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

  private final IngestionConfig ingestionConfig;
  private final ExternalProcessRunner processRunner;

  @Override
  public String recognize(Path image) {
    IngestionConfig.Extraction config = ingestionConfig.getExtraction();
    List<String> command =
        List.of(
            config.getOcrCommand(),
            image.toAbsolutePath().toString(),
            "stdout",
            "-l",
            config.getOcrLanguages());
    try {
      ProcessResult result = processRunner.run(command, config.getOcrTimeout(), null);
      if (!result.succeeded()) {
        throw new ExtractionException(
            ExtractionErrorKind.OCR_FAILED,
            "OCR exited with " + result.exitCode() + ": " + result.stderr().strip());
      }
      return result.stdout();
    } catch (ExternalProcessRunner.StartFailedException e) {
      throw new ExtractionException(
          ExtractionErrorKind.OCR_FAILED, "OCR engine unavailable: " + e.getMessage(), e);
    } catch (ExternalProcessRunner.TimedOutException e) {
      throw new ExtractionException(
          ExtractionErrorKind.OCR_FAILED,
          "OCR gave up on " + image.getFileName() + ": " + e.getMessage(),
          e);
    } catch (IOException e) {
      throw new ExtractionException(ExtractionErrorKind.OCR_FAILED, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException(ExtractionErrorKind.OCR_FAILED, "Interrupted during OCR", e);
    }
  }
}
