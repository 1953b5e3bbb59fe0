package com.flamingo.ai.kbsearch.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResultDeduplicatorTest {

  private final ResultDeduplicator deduplicator = new ResultDeduplicator();

  private static SearchHit hit(String id, String fileName, double score) {
    return SearchHit.builder()
        .documentId(id)
        .fileName(fileName)
        .path("/kb/Commerciale/" + fileName)
        .score(score)
        .build();
  }

  @Nested
  @DisplayName("version clusters")
  class VersionClusters {

    @Test
    @DisplayName("should collapse three version pairs among twenty hits")
    void shouldCollapseThreePairs() {
      List<String> distinct =
          List.of(
              "Verbale_sopralluogo.pdf", "Planimetria_piano_terra.pdf", "Computo_metrico.xlsx",
              "Elenco_prezzi.pdf", "Cronoprogramma.pdf", "DUVRI.docx", "Piano_sicurezza.pdf",
              "Organigramma.pdf", "Certificato_ISO.pdf", "Polizza_fideiussoria.pdf",
              "Dichiarazione_sostitutiva.docx", "Schema_contratto.pdf", "Disciplinare.pdf",
              "Bando_gara.pdf");
      List<SearchHit> hits = new ArrayList<>();
      hits.add(hit("a1", "Relazione_v1.docx", 0.8));
      hits.add(hit("b1", "Capitolato_bozza.docx", 0.7));
      hits.add(hit("c1", "Offerta tecnica (1).pdf", 0.9));
      for (int i = 0; i < distinct.size(); i++) {
        hits.add(hit("d" + i, distinct.get(i), 0.5 - i * 0.01));
      }
      hits.add(hit("a2", "Relazione_v2.pdf", 0.8));
      hits.add(hit("b2", "Capitolato_finale.pdf", 0.7));
      hits.add(hit("c2", "Offerta tecnica.pdf", 0.5));
      assertThat(hits).hasSize(20);

      ResultDeduplicator.Outcome outcome = deduplicator.deduplicate(hits);

      assertThat(outcome.hits()).hasSize(17);
      assertThat(outcome.removed()).isEqualTo(3);
      assertThat(outcome.hits())
          .extracting(SearchHit::getDocumentId)
          .contains("a2", "b2", "c1")
          .doesNotContain("a1", "b1", "c2");
    }

    @Test
    @DisplayName("should still collapse other clusters when one name has an overlong version")
    void shouldSurviveOverlongVersion() {
      List<SearchHit> hits =
          List.of(
              hit("v", "Verbale_v99999999999.pdf", 0.9),
              hit("a1", "Relazione_v1.docx", 0.8),
              hit("a2", "Relazione_v2.pdf", 0.8));

      ResultDeduplicator.Outcome outcome = deduplicator.deduplicate(hits);

      assertThat(outcome.removed()).isEqualTo(1);
      assertThat(outcome.hits()).extracting(SearchHit::getDocumentId).containsExactly("v", "a2");
    }

    @Test
    @DisplayName("should prefer the higher score over a final marker")
    void shouldPreferScore() {
      List<SearchHit> hits =
          List.of(hit("1", "Relazione_finale.pdf", 0.4), hit("2", "Relazione_v3.docx", 0.6));

      assertThat(deduplicator.deduplicate(hits).hits())
          .extracting(SearchHit::getDocumentId)
          .containsExactly("2");
    }

    @Test
    @DisplayName("should prefer a PDF when score and version tie")
    void shouldPreferPdf() {
      List<SearchHit> hits =
          List.of(hit("doc", "Relazione_v2.docx", 0.6), hit("pdf", "Relazione_v2.pdf", 0.6));

      assertThat(deduplicator.deduplicate(hits).hits())
          .extracting(SearchHit::getDocumentId)
          .containsExactly("pdf");
    }

    @Test
    @DisplayName("should keep the earlier hit on a full tie")
    void shouldKeepEarlierOnTie() {
      List<SearchHit> hits =
          List.of(hit("first", "Relazione.pdf", 0.6), hit("second", "Relazione.pdf", 0.6));

      assertThat(deduplicator.deduplicate(hits).hits())
          .extracting(SearchHit::getDocumentId)
          .containsExactly("first");
    }

    @Test
    @DisplayName("should keep survivors in input order")
    void shouldKeepInputOrder() {
      List<SearchHit> hits =
          List.of(
              hit("x", "Alpha.pdf", 0.9),
              hit("y1", "Beta_v1.pdf", 0.5),
              hit("z", "Gamma.pdf", 0.4),
              hit("y2", "Beta_v2.pdf", 0.5));

      assertThat(deduplicator.deduplicate(hits).hits())
          .extracting(SearchHit::getDocumentId)
          .containsExactly("x", "z", "y2");
    }

    @Test
    @DisplayName("should not merge hits whose base name is empty")
    void shouldNotMergeEmptyBaseNames() {
      List<SearchHit> hits = List.of(hit("1", "v1.pdf", 0.5), hit("2", "v2.pdf", 0.5));

      ResultDeduplicator.Outcome outcome = deduplicator.deduplicate(hits);

      assertThat(outcome.hits()).hasSize(2);
      assertThat(outcome.removed()).isZero();
    }
  }

  @Nested
  @DisplayName("VersionInfo")
  class VersionInfoParsing {

    @Test
    @DisplayName("should treat a final marker as the highest version")
    void shouldParseFinal() {
      VersionInfo info = VersionInfo.parse("Capitolato_definitivo.pdf");

      assertThat(info.isFinal()).isTrue();
      assertThat(info.version()).isEqualTo(999.0);
      assertThat(info.baseName()).isEqualTo("capitolato");
      assertThat(info.pdf()).isTrue();
    }

    @Test
    @DisplayName("should read dotted versions as comparable numbers")
    void shouldParseDottedVersion() {
      assertThat(VersionInfo.parse("Manuale_v1.10.docx").version())
          .isGreaterThan(VersionInfo.parse("Manuale_v1.9.docx").version());
      assertThat(VersionInfo.parse("Manuale_v2.0.1.docx").version()).isCloseTo(2.000001, within(1e-9));
    }

    @Test
    @DisplayName("should read revision, copy and numeric suffix markers")
    void shouldParseOtherMarkers() {
      assertThat(VersionInfo.parse("Capitolato_rev2.docx").version()).isEqualTo(2.0);
      assertThat(VersionInfo.parse("Capitolato_rev2.docx").baseName()).isEqualTo("capitolato");
      assertThat(VersionInfo.parse("Offerta (3).pdf").version()).isEqualTo(3.0);
      assertThat(VersionInfo.parse("Allegato_4.pdf").version()).isEqualTo(4.0);
      assertThat(VersionInfo.parse("Allegato_4.pdf").baseName()).isEqualTo("allegato");
    }

    @Test
    @DisplayName("should read an overlong digit run as unversioned")
    void shouldNotOverflowOnLongNumbers() {
      assertThat(VersionInfo.parse("Verbale_v99999999999.pdf").version()).isZero();
      assertThat(VersionInfo.parse("Verbale_rev123456789012.pdf").version()).isZero();
      assertThat(VersionInfo.parse("Verbale (99999999999).pdf").version()).isZero();
      assertThat(VersionInfo.parse("Verbale_v99999999999.2.pdf").version()).isZero();
    }

    @Test
    @DisplayName("should not read a v inside a word as a version")
    void shouldIgnoreEmbeddedV() {
      VersionInfo info = VersionInfo.parse("Lev2.pdf");

      assertThat(info.version()).isZero();
      assertThat(info.baseName()).isEqualTo("lev2");
    }

    @Test
    @DisplayName("should strip directories and status words from the base name")
    void shouldStripDirectoriesAndStatus() {
      assertThat(VersionInfo.parse("/kb/Area/Relazione tecnica_firmato.pdf").baseName())
          .isEqualTo("relazione_tecnica");
    }
  }
}
