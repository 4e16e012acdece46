package com.gentoro.onerag.ingestion.chunk;

import com.gentoro.onerag.utility.StringUtility;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structure-aware chunker with deterministic output.
 *
 * <p>Text is first split on structure (markdown headings of level 1-3 for markdown, blank-line
 * paragraph breaks otherwise). A section that fits in {@code targetTokens} becomes one chunk;
 * longer sections are cut by a sliding window of {@code targetTokens} that advances by {@code
 * targetTokens - overlapTokens}. Chunks under {@code minTokens} are then merged into their
 * successor, and final indexes and hashes are assigned in document order.
 *
 * <p>Tokens are counted with the cl100k_base encoding. Instances are immutable and thread-safe.
 */
public class Chunker {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(Chunker.class);

  private static final Set<String> MARKDOWN_TYPES = Set.of("text/markdown", "text/x-markdown");
  private static final Pattern MARKDOWN_HEADING = Pattern.compile("(?m)(?=^#{1,3}\\s+)");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\n+");

  private final ChunkerSettings settings;
  private final Encoding encoding;

  public Chunker(ChunkerSettings settings) {
    this(settings, Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
  }

  public Chunker(ChunkerSettings settings, Encoding encoding) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.encoding = Objects.requireNonNull(encoding, "encoding");
  }

  public ChunkerSettings settings() {
    return settings;
  }

  public int countTokens(String text) {
    return text == null || text.isEmpty() ? 0 : encoding.countTokens(text);
  }

  /**
   * Splits {@code text} into chunks.
   *
   * @param mimeType MIME hint; markdown types split on headings
   * @return chunks in document order; empty for blank input
   */
  public List<Chunk> chunk(String text, String mimeType) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    List<Draft> drafts = new ArrayList<>();
    int charCursor = 0;
    long byteCursor = 0;
    for (String section : splitByStructure(text, mimeType)) {
      int pos = text.indexOf(section, charCursor);
      if (pos < 0) {
        pos = charCursor;
      }
      byteCursor += utf8Length(text, charCursor, pos);
      charCursor = pos;
      drafts.addAll(chunkByTokens(section, byteCursor));
    }

    List<Draft> merged = mergeSmall(drafts);
    List<Chunk> chunks = new ArrayList<>(merged.size());
    for (int i = 0; i < merged.size(); i++) {
      Draft d = merged.get(i);
      chunks.add(
          new Chunk(
              d.text,
              i,
              d.offsetStart,
              d.offsetEnd,
              StringUtility.sha256Hex(d.text),
              countTokens(d.text)));
    }
    log.debug("Created {} chunks from {} characters", chunks.size(), text.length());
    return chunks;
  }

  /** Number of chunks {@link #chunk} would produce for a single section of this size. */
  public int estimateChunkCount(String text) {
    int tokens = countTokens(text);
    if (tokens <= settings.targetTokens()) {
      return 1;
    }
    return Math.max(1, (tokens - settings.overlapTokens()) / settings.step() + 1);
  }

  List<String> splitByStructure(String text, String mimeType) {
    Pattern splitter =
        mimeType != null && MARKDOWN_TYPES.contains(mimeType.trim().toLowerCase(Locale.ROOT))
            ? MARKDOWN_HEADING
            : PARAGRAPH_BREAK;
    List<String> sections = new ArrayList<>();
    for (String raw : splitter.split(text)) {
      String s = raw.strip();
      if (!s.isEmpty()) {
        sections.add(s);
      }
    }
    return sections;
  }

  private List<Draft> chunkByTokens(String section, long baseOffset) {
    IntArrayList tokens = encoding.encode(section);
    if (tokens.size() <= settings.targetTokens()) {
      return List.of(
          new Draft(
              section,
              baseOffset,
              baseOffset + utf8Length(section, 0, section.length()),
              tokens.size()));
    }

    List<Draft> out = new ArrayList<>();
    int step = settings.step();
    long prefixBytes = 0;
    int prefixEnd = 0;
    for (int i = 0; i < tokens.size(); i += step) {
      int end = Math.min(i + settings.targetTokens(), tokens.size());
      prefixBytes += encoding.decodeBytes(slice(tokens, prefixEnd, i)).length;
      prefixEnd = i;

      IntArrayList window = slice(tokens, i, end);
      long start = baseOffset + prefixBytes;
      out.add(
          new Draft(
              encoding.decode(window),
              start,
              start + encoding.decodeBytes(window).length,
              window.size()));
    }
    return out;
  }

  private List<Draft> mergeSmall(List<Draft> drafts) {
    List<Draft> merged = new ArrayList<>();
    Draft current = null;
    for (Draft next : drafts) {
      if (current == null) {
        current = next;
        continue;
      }
      if (current.tokenCount < settings.minTokens()) {
        String joined = current.text + "\n\n" + next.text;
        int joinedTokens = countTokens(joined);
        if (joinedTokens <= settings.maxTokens()) {
          current = new Draft(joined, current.offsetStart, next.offsetEnd, joinedTokens);
          continue;
        }
      }
      merged.add(current);
      current = next;
    }
    if (current != null) {
      merged.add(current);
    }
    return merged;
  }

  private static IntArrayList slice(IntArrayList tokens, int from, int to) {
    IntArrayList out = new IntArrayList(Math.max(to - from, 0));
    for (int i = from; i < to; i++) {
      out.add(tokens.get(i));
    }
    return out;
  }

  private static long utf8Length(String s, int from, int to) {
    long bytes = 0;
    for (int i = from; i < to; i++) {
      char c = s.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < to
          && Character.isLowSurrogate(s.charAt(i + 1))) {
        bytes += 4;
        i++;
      } else {
        bytes += 3;
      }
    }
    return bytes;
  }

  private record Draft(String text, long offsetStart, long offsetEnd, int tokenCount) {}
}
