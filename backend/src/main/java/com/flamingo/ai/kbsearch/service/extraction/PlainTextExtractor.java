package com.flamingo.ai.kbsearch.service.extraction;

import com.flamingo.ai.kbsearch.exception.ExtractionErrorKind;
import com.flamingo.ai.kbsearch.exception.ExtractionException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Decodes text files as UTF-8, falling back to Windows-1252 for legacy encodings. */
@Component
public class PlainTextExtractor implements FormatExtractor {

  private static final Charset LEGACY = Charset.forName("windows-1252");

  @Override
  public ExtractionMethod method() {
    return ExtractionMethod.TEXT;
  }

  @Override
  public ExtractionResult extract(Path path, DocumentFormat format) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new ExtractionException(ExtractionErrorKind.CORRUPT_FILE, e.getMessage(), e);
    }
    return ExtractionResult.singlePage(decode(bytes), ExtractionMethod.TEXT, false);
  }

  static String decode(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      return new String(bytes, LEGACY);
    }
  }
}
