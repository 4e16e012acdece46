package com.gentoro.onerag.vector;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.VectorIndexException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryVectorIndexClientTest {

  private InMemoryVectorIndexClient index;

  private static Map<String, Object> payload(String docId, String scope, int chunkIndex) {
    return Map.of("doc_id", docId, "scope", scope, "chunk_index", chunkIndex);
  }

  @BeforeEach
  void seed() {
    index = new InMemoryVectorIndexClient(3);
    index.upsertBatch(
        List.of(
            new VectorPoint("p1", new float[] {1, 0, 0}, payload("d1", "public", 0)),
            new VectorPoint("p2", new float[] {0.8f, 0.2f, 0}, payload("d1", "public", 1)),
            new VectorPoint("p3", new float[] {0, 1, 0}, payload("d2", "public", 0)),
            new VectorPoint("p4", new float[] {1, 0, 0}, payload("d3", "internal", 0))),
        2);
  }

  @Test
  @DisplayName("cosine similarity")
  void cosine() {
    assertEquals(1.0, InMemoryVectorIndexClient.cosine(new float[] {2, 0}, new float[] {1, 0}));
    assertEquals(0.0, InMemoryVectorIndexClient.cosine(new float[] {1, 0}, new float[] {0, 1}));
    assertEquals(0.0, InMemoryVectorIndexClient.cosine(new float[] {0, 0}, new float[] {0, 1}));
  }

  @Test
  @DisplayName("search is restricted to the scope and ordered by similarity")
  void searchByScope() {
    List<VectorSearchHit> hits = index.search(new float[] {1, 0, 0}, "public", 10, null, null);

    assertEquals(List.of("p1", "p2", "p3"), hits.stream().map(VectorSearchHit::id).toList());
    assertEquals(1.0, hits.get(0).score(), 1e-9);
    assertEquals("d1", hits.get(0).payload().get("doc_id"));
  }

  @Test
  @DisplayName("filters, range conditions, thresholds and topK narrow the results")
  void filtersAndThreshold() {
    float[] q = {1, 0, 0};
    assertEquals(2, index.search(q, "public", 10, Map.of("doc_id", "d1"), null).size());
    assertEquals(
        List.of("p2"),
        index.search(q, "public", 10, Map.of("chunk_index", RangeCondition.atLeast(1)), null)
            .stream()
            .map(VectorSearchHit::id)
            .toList());
    assertEquals(2, index.search(q, "public", 10, null, 0.5).size());
    assertEquals(1, index.search(q, "public", 1, null, null).size());
    assertTrue(index.search(q, "public", 0, null, null).isEmpty());
  }

  @Test
  @DisplayName("dimension mismatches are rejected")
  void dimensionMismatch() {
    assertThrows(
        VectorIndexException.class, () -> index.upsert("bad", new float[] {1, 0}, Map.of()));
    assertThrows(
        VectorIndexException.class,
        () -> index.search(new float[] {1, 0}, "public", 5, null, null));
  }

  @Test
  @DisplayName("delete by id and by document, count with filters")
  void deleteAndCount() {
    assertEquals(4, index.count(null));
    assertEquals(3, index.count(Map.of("scope", "public")));

    assertEquals(2, index.deleteByDoc("d1"));
    assertTrue(index.delete("p3"));
    assertFalse(index.delete("p3"));
    assertEquals(1, index.count(null));
    assertTrue(index.getPoint("p4").isPresent());
    assertTrue(index.getPoint("p1").isEmpty());
  }

  @Test
  @DisplayName("snapshots restore the previous content")
  void snapshots() {
    String name = index.snapshot();
    index.deleteByDoc("d1");
    assertEquals(2, index.count(null));

    index.restore(name);

    assertEquals(4, index.count(null));
    assertEquals(1, index.listSnapshots().size());
    assertEquals(4, index.listSnapshots().get(0).size());
    assertThrows(NotFoundException.class, () -> index.restore("nope"));
    assertTrue(index.healthCheck().healthy());
  }

  @Test
  @DisplayName("dimension is taken from the first upsert when not configured")
  void inferredDimension() {
    InMemoryVectorIndexClient fresh = new InMemoryVectorIndexClient();
    fresh.upsert("a", new float[] {1, 2}, Map.of("scope", "s"));
    assertThrows(
        VectorIndexException.class, () -> fresh.upsert("b", new float[] {1, 2, 3}, Map.of()));
  }
}
