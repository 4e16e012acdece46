package com.gentoro.onerag.ingestion.extract;

import com.gentoro.onerag.exception.ExtractionException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads text and markdown files as UTF-8, falling back to ISO-8859-1 for legacy encodings. */
public class PlainTextExtractor implements Extractor {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(PlainTextExtractor.class);

  @Override
  public String name() {
    return "text-direct";
  }

  @Override
  public String version() {
    return "1.0";
  }

  @Override
  public ExtractedText extract(Path path) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new ExtractionException("Failed to read text file", path.toString(), "text", e);
    }
    return new ExtractedText(decode(bytes, path), name(), version());
  }

  static String decode(byte[] bytes, Path path) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      log.debug("{} is not valid UTF-8, decoding as ISO-8859-1", path);
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }
  }
}
