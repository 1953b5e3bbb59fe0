package com.flamingo.ai.kbsearch.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OfficeDocumentExtractorTest {

  private static final String CONTENT_TYPES =
      "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
          + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
          + "<Default Extension=\"rels\" "
          + "ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
          + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
          + "<Override PartName=\"/word/document.xml\" ContentType=\"application/"
          + "vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>"
          + "</Types>";
  private static final String PACKAGE_RELS =
      "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
          + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
          + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/"
          + "2006/relationships/officeDocument\" Target=\"word/document.xml\"/>"
          + "</Relationships>";

  @Mock private DocumentRenderer renderer;

  @TempDir Path tempDir;

  private OfficeDocumentExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor =
        new OfficeDocumentExtractor(new OcrFallbackPolicy(new IngestionConfig()), renderer);
  }

  /** Writes a minimal WordprocessingML package holding one paragraph. */
  private Path docx(String name, String paragraph) throws IOException {
    Path file = tempDir.resolve(name);
    String document =
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<w:document xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">"
            + "<w:body><w:p><w:r><w:t>"
            + paragraph
            + "</w:t></w:r></w:p></w:body></w:document>";
    try (OutputStream out = Files.newOutputStream(file);
        ZipOutputStream zip = new ZipOutputStream(out)) {
      putEntry(zip, "[Content_Types].xml", CONTENT_TYPES);
      putEntry(zip, "_rels/.rels", PACKAGE_RELS);
      putEntry(zip, "word/document.xml", document);
    }
    return file;
  }

  private static void putEntry(ZipOutputStream zip, String name, String content)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(content.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }

  @Test
  @DisplayName("should return Tika text when it is substantial")
  void shouldUseTikaText() throws IOException {
    Path file =
        docx(
            "Relazione tecnica.docx",
            "Relazione tecnica sullo stato di avanzamento dei lavori del cantiere di Bergamo");

    ExtractionResult result = extractor.extract(file, DocumentFormat.OFFICE_OPEN_XML);

    assertThat(result.method()).isEqualTo(ExtractionMethod.OFFICE);
    assertThat(result.ocrApplied()).isFalse();
    assertThat(result.text()).contains("stato di avanzamento dei lavori");
    verifyNoInteractions(renderer);
  }

  @Nested
  @DisplayName("renderer fallback")
  class RendererFallback {

    @Test
    @DisplayName("should replace near-empty Tika output with the rendered text")
    void shouldFallBackToRenderer() throws IOException {
      Path file = docx("Modulo.docx", "Modulo");
      when(renderer.renderToText(file))
          .thenReturn("Modulo di partecipazione alla procedura aperta, lotto 2, compilato");

      ExtractionResult result = extractor.extract(file, DocumentFormat.OFFICE_OPEN_XML);

      assertThat(result.text()).startsWith("Modulo di partecipazione");
      assertThat(result.method()).isEqualTo(ExtractionMethod.OFFICE);
    }

    @Test
    @DisplayName("should keep the thin Tika text when the renderer fails")
    void shouldKeepTikaTextOnRendererFailure() throws IOException {
      Path file = docx("Modulo.docx", "Modulo firmato");
      when(renderer.renderToText(file))
          .thenThrow(
              new ExtractionException(ExtractionErrorKind.RENDERER_MISSING, "soffice missing"));

      ExtractionResult result = extractor.extract(file, DocumentFormat.OFFICE_OPEN_XML);

      assertThat(result.text()).isEqualTo("Modulo firmato");
    }

    @Test
    @DisplayName("should surface the renderer failure when Tika found nothing")
    void shouldPropagateRendererFailureOnBlankText() throws IOException {
      Path file = docx("Vuoto.docx", "");
      when(renderer.renderToText(file))
          .thenThrow(
              new ExtractionException(ExtractionErrorKind.RENDERER_TIMEOUT, "soffice timed out"));

      assertThatThrownBy(() -> extractor.extract(file, DocumentFormat.OFFICE_OPEN_XML))
          .isInstanceOfSatisfying(
              ExtractionException.class,
              e -> assertThat(e.getKind()).isEqualTo(ExtractionErrorKind.RENDERER_TIMEOUT));
    }
  }
}
