package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Supported document formats, each routed to exactly one {@link ExtractionMethod}. */
public enum DocumentFormat {
  PLAIN_TEXT(ExtractionMethod.TEXT, "txt", "md", "csv", "log", "ini", "conf", "xml", "json"),
  PDF(ExtractionMethod.PDF, "pdf"),
  OFFICE_OPEN_XML(ExtractionMethod.OFFICE, "docx", "xlsx", "pptx"),
  OPEN_DOCUMENT(ExtractionMethod.OFFICE, "odt", "ods", "odp"),
  LEGACY_OFFICE(ExtractionMethod.RENDERER, "doc", "xls", "ppt", "rtf"),
  IMAGE(ExtractionMethod.OCR, "jpg", "jpeg", "png", "bmp", "tif", "tiff");

  private static final Map<String, DocumentFormat> BY_EXTENSION = new HashMap<>();

  static {
    for (DocumentFormat format : values()) {
      for (String extension : format.extensions) {
        BY_EXTENSION.put(extension, format);
      }
    }
  }

  private final ExtractionMethod method;
  private final List<String> extensions;

  DocumentFormat(ExtractionMethod method, String... extensions) {
    this.method = method;
    this.extensions = List.of(extensions);
  }

  public ExtractionMethod getMethod() {
    return method;
  }

  public List<String> getExtensions() {
    return extensions;
  }

  public static Optional<DocumentFormat> fromExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT)));
  }

  /**
   * Detects the format of a file from its extension.
   *
   * @throws ExtractionException with {@link ExtractionErrorKind#UNSUPPORTED_FORMAT} when the
   *     extension is missing or unknown
   */
  public static DocumentFormat detect(Path path) {
    String extension = extensionOf(path.getFileName().toString());
    return fromExtension(extension)
        .orElseThrow(
            () ->
                new ExtractionException(
                    ExtractionErrorKind.UNSUPPORTED_FORMAT,
                    "No extraction strategy for extension '" + extension + "'"));
  }

  /** Lower-cased extension without the dot, or an empty string. */
  public static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
