package com.gentoro.onerag.ingestion.extract;

import com.gentoro.onerag.exception.ExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Extracts PDF text page by page with PDFBox. Each non-empty page is emitted as {@code [Page N]}
 * followed by its text; pages are separated by a blank line.
 */
public class PdfExtractor implements Extractor {

  @Override
  public String name() {
    return "pdf-pdfbox";
  }

  @Override
  public String version() {
    return "1.0";
  }

  @Override
  public ExtractedText extract(Path path) {
    try (PDDocument document = Loader.loadPDF(path.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      List<String> pages = new ArrayList<>();
      for (int page = 1; page <= document.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(document).strip();
        if (!text.isEmpty()) {
          pages.add("[Page " + page + "]\n" + text);
        }
      }
      return new ExtractedText(String.join("\n\n", pages), name(), version());
    } catch (IOException e) {
      throw new ExtractionException(
          "Failed to extract PDF: " + e.getMessage(), path.toString(), "application/pdf", e);
    }
  }
}
