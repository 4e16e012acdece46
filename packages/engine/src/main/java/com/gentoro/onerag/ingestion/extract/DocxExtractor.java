package com.gentoro.onerag.ingestion.extract;

import com.gentoro.onerag.exception.ExtractionException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Extracts Word documents through Apache Tika. Paragraphs styled as headings arrive as XHTML
 * {@code h1}..{@code h6} elements and are rendered with the matching number of {@code #} so the
 * chunker can split on document structure.
 */
public class DocxExtractor implements Extractor {
  private final AutoDetectParser parser = new AutoDetectParser();

  @Override
  public String name() {
    return "docx-tika";
  }

  @Override
  public String version() {
    return "1.0";
  }

  @Override
  public ExtractedText extract(Path path) {
    MarkdownHeadingHandler handler = new MarkdownHeadingHandler();
    try (InputStream in = Files.newInputStream(path)) {
      parser.parse(in, handler, new Metadata(), new ParseContext());
    } catch (IOException | SAXException | TikaException e) {
      throw new ExtractionException(
          "Failed to extract Word document: " + e.getMessage(), path.toString(), "docx", e);
    }
    return new ExtractedText(handler.text(), name(), version());
  }

  /** Collects paragraph text, one paragraph per block, prefixing headings with markdown hashes. */
  static final class MarkdownHeadingHandler extends DefaultHandler {
    private final StringBuilder out = new StringBuilder();
    private final StringBuilder block = new StringBuilder();
    private int headingLevel;

    @Override
    public void startElement(String uri, String localName, String qName, Attributes atts) {
      String name = localName.isEmpty() ? qName : localName;
      if (isBlock(name)) {
        flush();
        headingLevel = headingLevel(name);
      }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
      String name = localName.isEmpty() ? qName : localName;
      if (isBlock(name)) {
        flush();
        headingLevel = 0;
      }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
      block.append(ch, start, length);
    }

    private void flush() {
      String text = block.toString().strip();
      block.setLength(0);
      if (text.isEmpty()) return;
      if (!out.isEmpty()) out.append("\n\n");
      if (headingLevel > 0) {
        out.append("#".repeat(headingLevel)).append(' ');
      }
      out.append(text);
    }

    String text() {
      flush();
      return out.toString();
    }

    private static boolean isBlock(String name) {
      return name.equals("p") || name.equals("li") || name.equals("td") || headingLevel(name) > 0;
    }

    private static int headingLevel(String name) {
      if (name.length() == 2 && name.charAt(0) == 'h' && Character.isDigit(name.charAt(1))) {
        int level = name.charAt(1) - '0';
        return level >= 1 && level <= 6 ? level : 0;
      }
      return 0;
    }
  }
}
