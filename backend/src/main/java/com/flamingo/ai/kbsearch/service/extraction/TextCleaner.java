package com.flamingo.ai.kbsearch.service.extraction;

import java.util.regex.Pattern;

/** Normalizes raw extracted text before chunking and fingerprinting. */
public final class TextCleaner {

  // Control characters other than tab and newline, NUL included
  private static final Pattern CONTROL_CHARS =
      Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\u00A0]+");
  private static final Pattern TRAILING_SPACES = Pattern.compile(" +\\n");
  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

  private TextCleaner() {}

  public static String clean(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "";
    }
    String text = raw.replace("\r\n", "\n").replace('\r', '\n');
    text = CONTROL_CHARS.matcher(text).replaceAll("");
    text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
    text = TRAILING_SPACES.matcher(text).replaceAll("\n");
    text = EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
    return text.strip();
  }

  public static int countNonWhitespace(String text) {
    if (text == null) {
      return 0;
    }
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isWhitespace(text.charAt(i))) {
        count++;
      }
    }
    return count;
  }
}
