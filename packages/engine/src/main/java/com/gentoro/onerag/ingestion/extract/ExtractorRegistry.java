package com.gentoro.onerag.ingestion.extract;

import com.gentoro.onerag.exception.ExtractionException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Maps MIME types onto {@link Extractor}s and resolves MIME types from file names. */
public class ExtractorRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(ExtractorRegistry.class);

  public static final String DOCX_MIME =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  private static final Map<String, String> EXTENSIONS =
      Map.of(
          "txt", "text/plain",
          "text", "text/plain",
          "md", "text/markdown",
          "markdown", "text/markdown",
          "pdf", "application/pdf",
          "docx", DOCX_MIME,
          "doc", "application/msword");

  /** Name/version pair recorded for audit, also reported for unsupported types. */
  public record ExtractorInfo(String name, String version) {
    public static final ExtractorInfo UNKNOWN = new ExtractorInfo("unknown", "0.0");
  }

  private final Map<String, Extractor> byMimeType = new ConcurrentHashMap<>();

  public ExtractorRegistry() {}

  /** Registry pre-populated with the text, PDF and Word extractors. */
  public static ExtractorRegistry withDefaults() {
    ExtractorRegistry registry = new ExtractorRegistry();
    PlainTextExtractor text = new PlainTextExtractor();
    registry.register("text/plain", text);
    registry.register("text/markdown", text);
    registry.register("text/x-markdown", text);
    registry.register("application/pdf", new PdfExtractor());
    DocxExtractor docx = new DocxExtractor();
    registry.register(DOCX_MIME, docx);
    registry.register("application/msword", docx);
    return registry;
  }

  public void register(String mimeType, Extractor extractor) {
    Objects.requireNonNull(extractor, "extractor");
    Extractor previous = byMimeType.put(normalize(mimeType), extractor);
    if (previous != null && previous != extractor) {
      log.info("Replaced extractor for {}: {} -> {}", mimeType, previous.name(), extractor.name());
    }
  }

  public Optional<Extractor> forMimeType(String mimeType) {
    if (mimeType == null) return Optional.empty();
    return Optional.ofNullable(byMimeType.get(normalize(mimeType)));
  }

  public boolean supports(String mimeType) {
    return forMimeType(mimeType).isPresent();
  }

  public ExtractorInfo info(String mimeType) {
    return forMimeType(mimeType)
        .map(e -> new ExtractorInfo(e.name(), e.version()))
        .orElse(ExtractorInfo.UNKNOWN);
  }

  /** MIME type implied by the file extension, or {@code application/octet-stream}. */
  public String detectMimeType(Path path) {
    String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) return "application/octet-stream";
    String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    return EXTENSIONS.getOrDefault(ext, "application/octet-stream");
  }

  /**
   * Extracts {@code path} with the extractor registered for {@code mimeType}.
   *
   * @throws ExtractionException when no extractor is registered or extraction fails
   */
  public ExtractedText extract(Path path, String mimeType) {
    Extractor extractor =
        forMimeType(mimeType)
            .orElseThrow(
                () ->
                    new ExtractionException(
                        "Unsupported MIME type: " + mimeType, path.toString(), mimeType, null));
    log.debug("Extracting {} with {} {}", path, extractor.name(), extractor.version());
    return extractor.extract(path);
  }

  /** Snapshot of the MIME type to extractor-name mapping. */
  public Map<String, String> supportedTypes() {
    Map<String, String> out = new LinkedHashMap<>();
    byMimeType.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> out.put(e.getKey(), e.getValue().name()));
    return Collections.unmodifiableMap(out);
  }

  private static String normalize(String mimeType) {
    String m = mimeType.trim().toLowerCase(Locale.ROOT);
    int semi = m.indexOf(';');
    return semi >= 0 ? m.substring(0, semi).trim() : m;
  }
}
