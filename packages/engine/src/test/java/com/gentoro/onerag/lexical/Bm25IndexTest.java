package com.gentoro.onerag.lexical;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class Bm25IndexTest {

  private static CorpusChunk chunk(String id, String text) {
    return new CorpusChunk(id, "doc-" + id, "/docs/" + id + ".md", "public", text, Map.of());
  }

  private static Bm25Index sampleIndex() {
    Bm25Index index = new Bm25Index();
    index.build(
        List.of(
            chunk("c1", "OAuth tokens expire after one hour"),
            chunk("c2", "Refresh tokens rotate daily and tokens are revoked on logout"),
            chunk("c3", "Deployment runbook for the billing service"),
            chunk("c4", "Database backups run nightly")));
    return index;
  }

  @Test
  @DisplayName("tokenize lowercases and keeps only multi-char tokens plus a and i")
  void tokenize() {
    assertEquals(
        List.of("a", "token", "i", "ok", "snake_case", "42"),
        Bm25Index.tokenize("A token, I x OK! snake_case 42 b"));
    assertTrue(Bm25Index.tokenize(null).isEmpty());
  }

  @Test
  @DisplayName("IDF matches the smoothed BM25 formula")
  void idf() {
    assertEquals(Math.log((10 - 2 + 0.5) / (2 + 0.5) + 1), Bm25Index.idf(10, 2), 1e-12);
    assertTrue(Bm25Index.idf(10, 10) > 0);
  }

  @Test
  @DisplayName("search ranks matching chunks and omits non-matching ones")
  void searchRanks() {
    Bm25Index index = sampleIndex();

    List<ScoredChunk> hits = index.search("tokens", 10);

    assertEquals(2, hits.size());
    assertEquals("c2", hits.get(0).chunkId(), "higher term frequency wins");
    assertEquals("c1", hits.get(1).chunkId());
    assertTrue(hits.get(0).score() > hits.get(1).score());
  }

  @Test
  @DisplayName("more occurrences of a query term never lower the score at equal length")
  void termFrequencyIsMonotonic() {
    Bm25Index index = new Bm25Index();
    index.build(
        List.of(
            chunk("more", "alpha alpha beta gamma"),
            chunk("less", "alpha beta gamma delta"),
            chunk("other", "epsilon zeta eta theta")));

    List<ScoredChunk> hits = index.search("alpha", 10);
    assertEquals("more", hits.get(0).chunkId());
    assertTrue(hits.get(0).score() >= hits.get(1).score());

    String[] texts = {
      "alpha beta gamma delta epsilon",
      "alpha alpha gamma delta epsilon",
      "alpha alpha alpha delta epsilon",
      "alpha alpha alpha alpha epsilon"
    };
    double previous = Double.NEGATIVE_INFINITY;
    for (String text : texts) {
      index.update("less", text);
      double score =
          index.search("alpha", 10).stream()
              .filter(h -> h.chunkId().equals("less"))
              .findFirst()
              .orElseThrow()
              .score();
      assertTrue(score >= previous, text);
      previous = score;
    }
  }

  @Test
  @DisplayName("search is empty for a blank query, zero topK or an unbuilt index")
  void emptyCases() {
    Bm25Index index = sampleIndex();
    assertTrue(index.search("", 5).isEmpty());
    assertTrue(index.search("!!!", 5).isEmpty());
    assertTrue(index.search("tokens", 0).isEmpty());
    assertTrue(new Bm25Index().search("tokens", 5).isEmpty());
  }

  @Test
  @DisplayName("topK truncates results")
  void topK() {
    assertEquals(1, sampleIndex().search("tokens backups", 1).size());
  }

  @Test
  @DisplayName("building an empty corpus marks the index built")
  void emptyBuild() {
    Bm25Index index = new Bm25Index();
    index.build(List.of());
    assertTrue(index.isBuilt());
    assertEquals(0, index.stats().totalDocuments());
    assertTrue(index.search("anything", 5).isEmpty());
  }

  @Test
  @DisplayName("update then remove restores the previous scores")
  void updateAndRemove() {
    Bm25Index index = sampleIndex();
    List<ScoredChunk> before = index.search("tokens", 10);

    index.update("c5", "tokens tokens tokens");
    assertEquals("c5", index.search("tokens", 10).get(0).chunkId());
    assertEquals(5, index.stats().totalDocuments());

    assertTrue(index.remove("c5"));
    assertFalse(index.remove("c5"));
    assertEquals(before, index.search("tokens", 10));
  }

  @Test
  @DisplayName("update with text that has no tokens only removes the chunk")
  void updateWithoutTokens() {
    Bm25Index index = sampleIndex();
    index.update("c1", "?!");
    assertEquals(3, index.stats().totalDocuments());
    List<String> ids = index.search("tokens", 10).stream().map(ScoredChunk::chunkId).toList();
    assertEquals(List.of("c2"), ids);
  }

  @Test
  @DisplayName("stats and clear")
  void statsAndClear() {
    Bm25Index index = sampleIndex();
    Bm25Index.Stats stats = index.stats();
    assertEquals(4, stats.totalDocuments());
    assertTrue(stats.built());
    assertTrue(stats.avgDocLength() > 0);
    assertEquals(1.5, stats.k1());
    assertEquals(0.75, stats.b());

    index.clear();
    assertFalse(index.isBuilt());
    assertEquals(0, index.stats().uniqueTerms());
  }

  @Test
  @DisplayName("chunks without an id are skipped")
  void skipsBlankIds() {
    Bm25Index index = new Bm25Index();
    index.build(List.of(chunk("", "tokens"), chunk("c1", "tokens")));
    assertEquals(1, index.stats().totalDocuments());
  }
}
