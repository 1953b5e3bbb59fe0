package com.flamingo.ai.kbsearch.service.search;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version markers read from a file name, and the base name left once every marker is stripped.
 *
 * @param baseName lower-case name without extension, version, revision, copy or status markers
 * @param version comparable version number, 0 when the name carries none
 * @param isFinal the name says final, definitive or last
 * @param pdf the file is a PDF
 */
public record VersionInfo(String baseName, double version, boolean isFinal, boolean pdf) {

  // Numeric groups are bounded so a long digit run reads as unversioned instead of overflowing
  private static final Pattern FINAL_MARKER =
      Pattern.compile("[_\\s-](final[ei]?|definitiv\\w*|ultima)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DOTTED_VERSION =
      Pattern.compile("(?<![a-zA-Z])[vV](\\d{1,6})\\.(\\d{1,6})(?:\\.(\\d{1,6}))?");
  private static final Pattern SIMPLE_VERSION = Pattern.compile("(?<![a-zA-Z])[vV]0?(\\d{1,6})(?!\\d)");
  private static final Pattern COPY_MARKER = Pattern.compile("\\((\\d{1,6})\\)");
  private static final Pattern REVISION =
      Pattern.compile("[rR][eE][vV][\\s_-]?(\\d{1,6})(?!\\d)");
  private static final Pattern NUMBER_SUFFIX =
      Pattern.compile("_(\\d{1,2})\\.(?:pdf|docx?|xlsx?|pptx?|txt|odt)$", Pattern.CASE_INSENSITIVE);

  private static final Pattern EXTENSION =
      Pattern.compile("\\.(pdf|docx?|xlsx?|pptx?|txt|odt|ods|odp|rtf|mpp|dwg)$", Pattern.CASE_INSENSITIVE);
  private static final List<Pattern> STRIPPED_MARKERS =
      List.of(
          Pattern.compile("(?<![a-zA-Z])[vV]\\d+(?:\\.\\d+){0,2}"),
          Pattern.compile("[_\\s]?rev[\\s_-]?\\d+", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\(\\d+\\)"),
          FINAL_MARKER,
          Pattern.compile("_\\d{1,2}$"),
          Pattern.compile(
              "[_\\s-]+(with[_\\s]track[_\\s]changes?|firmato|signed?|approved|con[_\\s]modifiche"
                  + "|revisioni|draft|bozza|definitiv\\w*)",
              Pattern.CASE_INSENSITIVE));
  private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");

  public static VersionInfo parse(String fileName) {
    String name = fileName == null ? "" : fileName;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    boolean pdf = name.toLowerCase(Locale.ROOT).endsWith(".pdf");
    String baseName = baseName(name);

    if (FINAL_MARKER.matcher(name).find()) {
      return new VersionInfo(baseName, 999.0, true, pdf);
    }
    Matcher dotted = DOTTED_VERSION.matcher(name);
    if (dotted.find()) {
      double patch = dotted.group(3) == null ? 0 : Integer.parseInt(dotted.group(3));
      double version =
          Integer.parseInt(dotted.group(1)) + Integer.parseInt(dotted.group(2)) / 1_000.0
              + patch / 1_000_000.0;
      return new VersionInfo(baseName, version, false, pdf);
    }
    for (Pattern pattern : List.of(SIMPLE_VERSION, COPY_MARKER, REVISION, NUMBER_SUFFIX)) {
      Matcher matcher = pattern.matcher(name);
      if (matcher.find()) {
        return new VersionInfo(baseName, Integer.parseInt(matcher.group(1)), false, pdf);
      }
    }
    return new VersionInfo(baseName, 0.0, false, pdf);
  }

  static String baseName(String fileName) {
    String base = EXTENSION.matcher(fileName).replaceFirst("");
    for (Pattern marker : STRIPPED_MARKERS) {
      base = marker.matcher(base).replaceAll("");
    }
    base = SEPARATORS.matcher(base.strip()).replaceAll("_");
    int start = 0;
    int end = base.length();
    while (start < end && base.charAt(start) == '_') {
      start++;
    }
    while (end > start && base.charAt(end - 1) == '_') {
      end--;
    }
    return base.substring(start, end).toLowerCase(Locale.ROOT);
  }
}
