package com.flamingo.ai.kbsearch.service.ingestion;

import com.flamingo.ai.kbsearch.config.IngestionConfig;
import com.flamingo.ai.kbsearch.service.extraction.DocumentFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses metadata out of the corpus folder conventions.
 *
 * <pre>
 * _AQ/SD{N}/.../AS{code}_{client}/NN_Type/file     framework agreements, SD1..SD6 = 2021..2026
 * _Gare/{YEAR}_{Client}-{Subject}/NN_Type/file     tenders
 * </pre>
 */
@Component
public class PathMetadataExtractor {

  private static final Pattern GARE_FOLDER = Pattern.compile("^(\\d{4})_(.+?)(?:-(.+))?$");
  private static final Pattern LOT_CODE = Pattern.compile("\\b(AS\\d{4}[_A-Z0-9]*)\\b");
  private static final Pattern DOC_TYPE_FOLDER = Pattern.compile("^\\d{2}_");
  private static final Pattern STRALCIO = Pattern.compile("^SD([1-6])$");
  private static final Pattern VERSION = Pattern.compile("[vV]\\.?\\d+\\.\\d+(?:\\.\\d+)?");

  private static final List<String> CLIENT_PREFIXES =
      List.of("AOU", "AORN", "AO", "ASL", "AUSL", "ASP", "ARNAS", "Regione", "Provincia");

  private static final Map<String, String> DOC_TYPE_ALIASES =
      Map.of(
          "01_Documentazione", "Documentazione",
          "02_Chiarimenti", "Chiarimenti",
          "03_Risposta tecnica", "Risposta Tecnica",
          "04_OffertaTecnica", "Offerta Tecnica",
          "04_Offerta Tecnica", "Offerta Tecnica",
          "05_OffertaTempo", "Offerta Tempi",
          "08_AccessoAgliAtti", "Accesso Atti",
          "98_ODA", "Ordine Acquisto",
          "99_AS", "Appalto Specifico");

  // Insertion order is match priority
  private static final Map<String, String> THEME_CATEGORIES = new LinkedHashMap<>();

  static {
    for (String theme : List.of("AMC", "HR", "Logistica", "Inventario")) {
      THEME_CATEGORIES.put(theme, "Gestionale");
    }
    for (String theme : List.of("SIO", "SIA", "CCE", "LIS", "RIS", "PACS", "AP", "PS", "CUP")) {
      THEME_CATEGORIES.put(theme, "Sanità");
    }
    THEME_CATEGORIES.put("118", "Emergenza");
    for (String theme : List.of("SIT", "FSE", "Telemedicina")) {
      THEME_CATEGORIES.put(theme, "Territoriale");
    }
    THEME_CATEGORIES.put("DWH", "Analytics");
    THEME_CATEGORIES.put("GDPR", "Compliance");
  }

  private static final Map<String, Pattern> THEME_PATTERNS = new LinkedHashMap<>();

  static {
    THEME_CATEGORIES.keySet()
        .forEach(
            theme ->
                THEME_PATTERNS.put(
                    theme,
                    Pattern.compile("\\b" + Pattern.quote(theme) + "\\b", Pattern.CASE_INSENSITIVE)));
  }

  private final Path corpusRoot;

  public PathMetadataExtractor(IngestionConfig ingestionConfig) {
    this.corpusRoot = Path.of(ingestionConfig.getCorpus().getRoot()).toAbsolutePath().normalize();
  }

  public PathMetadata extract(Path file) {
    Path absolute = file.toAbsolutePath().normalize();
    String fileName = absolute.getFileName().toString();
    String extension = DocumentFormat.extensionOf(fileName);
    if (!absolute.startsWith(corpusRoot)) {
      return PathMetadata.empty(extension).withVersion(version(fileName));
    }

    List<String> parts = new ArrayList<>();
    corpusRoot.relativize(absolute).forEach(p -> parts.add(p.toString()));
    if (parts.size() < 2) {
      return PathMetadata.empty(extension).withVersion(version(fileName));
    }

    Builder metadata = new Builder();
    String areaFolder = parts.get(0);
    if (areaFolder.startsWith("_")) {
      metadata.area = areaFolder.replaceFirst("^_+", "");
    }

    if ("AQ".equals(metadata.area)) {
      extractFrameworkAgreement(parts, metadata);
    } else if ("Gare".equals(metadata.area)) {
      extractTender(parts, metadata);
    }
    metadata.docType = docType(parts);
    metadata.version = version(fileName);
    return metadata.build(extension);
  }

  private void extractFrameworkAgreement(List<String> parts, Builder metadata) {
    Matcher stralcio = STRALCIO.matcher(parts.get(1));
    if (stralcio.matches()) {
      metadata.year = 2020 + Integer.parseInt(stralcio.group(1));
    }
    for (String part : parts) {
      Matcher lot = LOT_CODE.matcher(part);
      if (lot.find()) {
        metadata.lot = lot.group(1);
        int underscore = part.indexOf('_');
        if (underscore >= 0 && underscore < part.length() - 1) {
          metadata.client = part.substring(underscore + 1);
        }
        break;
      }
    }
    for (String part : parts) {
      String theme = findTheme(part);
      if (theme != null) {
        metadata.subject = theme;
        metadata.category = THEME_CATEGORIES.get(theme);
        break;
      }
    }
  }

  private void extractTender(List<String> parts, Builder metadata) {
    Matcher folder = GARE_FOLDER.matcher(parts.get(1));
    if (!folder.matches()) {
      return;
    }
    metadata.year = Integer.valueOf(folder.group(1));
    metadata.client = cleanClient(folder.group(2));
    String rawSubject = folder.group(3);
    if (rawSubject != null && !rawSubject.isBlank()) {
      String theme = findTheme(rawSubject);
      if (theme != null) {
        metadata.subject = theme;
        metadata.category = THEME_CATEGORIES.get(theme);
      } else {
        metadata.subject = rawSubject.replace('_', ' ').trim();
      }
    }
  }

  private static String findTheme(String text) {
    for (Map.Entry<String, Pattern> entry : THEME_PATTERNS.entrySet()) {
      if (entry.getValue().matcher(text).find()) {
        return entry.getKey();
      }
    }
    return null;
  }

  private static String docType(List<String> parts) {
    for (String part : parts) {
      if (DOC_TYPE_FOLDER.matcher(part).find()) {
        return DOC_TYPE_ALIASES.getOrDefault(part, part);
      }
    }
    return null;
  }

  /** Strips the first matching institutional prefix, e.g. {@code ASLRoma4 -> Roma4}. */
  static String cleanClient(String raw) {
    for (String prefix : CLIENT_PREFIXES) {
      if (raw.length() > prefix.length() && raw.startsWith(prefix)) {
        char next = raw.charAt(prefix.length());
        if (Character.isUpperCase(next) || Character.isDigit(next) || Character.isWhitespace(next)) {
          return raw.substring(prefix.length()).trim();
        }
      }
    }
    return raw.trim();
  }

  private static String version(String fileName) {
    Matcher matcher = VERSION.matcher(fileName);
    return matcher.find() ? matcher.group() : null;
  }

  private static final class Builder {
    private String area;
    private Integer year;
    private String client;
    private String subject;
    private String docType;
    private String category;
    private String lot;
    private String version;

    PathMetadata build(String extension) {
      return new PathMetadata(
          area, year, client, subject, docType, category, lot, version, extension);
    }
  }
}
