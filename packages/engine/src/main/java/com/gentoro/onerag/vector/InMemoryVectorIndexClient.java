package com.gentoro.onerag.vector;

import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.VectorIndexException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Exact cosine-similarity engine held in memory. Used for the embedded deployment and in tests;
 * snapshots are in-memory copies.
 */
public class InMemoryVectorIndexClient implements VectorIndexClient {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(InMemoryVectorIndexClient.class);

  private final Map<String, VectorPoint> points = new LinkedHashMap<>();
  private final Map<String, Snapshot> snapshots = new LinkedHashMap<>();
  private int dimension;
  private int snapshotSequence;

  private record Snapshot(SnapshotInfo info, Map<String, VectorPoint> points, int dimension) {}

  public InMemoryVectorIndexClient() {
    this(0);
  }

  /** @param dimension expected vector size, or 0 to take it from the first upsert */
  public InMemoryVectorIndexClient(int dimension) {
    this.dimension = dimension;
  }

  @Override
  public synchronized boolean upsert(String id, float[] vector, Map<String, Object> payload) {
    store(new VectorPoint(id, vector, payload));
    return true;
  }

  @Override
  public synchronized int upsertBatch(List<VectorPoint> batch, int batchSize) {
    for (VectorPoint p : batch) {
      checkDimension(p.vector());
    }
    batch.forEach(this::store);
    return batch.size();
  }

  @Override
  public synchronized List<VectorSearchHit> search(
      float[] vector, String scope, int topK, Map<String, Object> filters, Double scoreThreshold) {
    Objects.requireNonNull(scope, "scope");
    if (topK <= 0 || points.isEmpty()) return List.of();
    checkDimension(vector);
    List<VectorSearchHit> hits = new ArrayList<>();
    for (VectorPoint p : points.values()) {
      if (!scope.equals(p.payload().get("scope"))
          || !PayloadFilters.matches(p.payload(), filters)) {
        continue;
      }
      double score = cosine(vector, p.vector());
      if (scoreThreshold != null && score < scoreThreshold) continue;
      hits.add(new VectorSearchHit(p.id(), score, p.payload()));
    }
    return hits.stream()
        .sorted(
            Comparator.comparingDouble(VectorSearchHit::score)
                .reversed()
                .thenComparing(VectorSearchHit::id))
        .limit(topK)
        .toList();
  }

  @Override
  public synchronized Optional<VectorSearchHit> getPoint(String id) {
    VectorPoint p = points.get(id);
    return p == null ? Optional.empty() : Optional.of(new VectorSearchHit(id, 0.0, p.payload()));
  }

  @Override
  public synchronized boolean delete(String id) {
    return points.remove(id) != null;
  }

  @Override
  public synchronized int deleteByDoc(String docId) {
    int before = points.size();
    points.values().removeIf(p -> docId.equals(p.payload().get("doc_id")));
    return before - points.size();
  }

  @Override
  public synchronized long count(Map<String, Object> filters) {
    return points.values().stream()
        .filter(p -> PayloadFilters.matches(p.payload(), filters))
        .count();
  }

  @Override
  public synchronized String snapshot() {
    String name = "snapshot-%d-%d".formatted(++snapshotSequence, System.currentTimeMillis());
    SnapshotInfo info = new SnapshotInfo(name, Instant.now().toString(), points.size());
    snapshots.put(name, new Snapshot(info, new LinkedHashMap<>(points), dimension));
    log.info("Created snapshot: {}", name);
    return name;
  }

  @Override
  public synchronized List<SnapshotInfo> listSnapshots() {
    return snapshots.values().stream().map(Snapshot::info).toList();
  }

  @Override
  public synchronized void restore(String snapshotName) {
    Snapshot s = snapshots.get(snapshotName);
    if (s == null) {
      throw new NotFoundException("Snapshot not found: " + snapshotName);
    }
    points.clear();
    points.putAll(s.points());
    dimension = s.dimension();
    log.info("Restored snapshot: {}", snapshotName);
  }

  @Override
  public synchronized HealthStatus healthCheck() {
    return new HealthStatus(true, "Healthy: %d points".formatted(points.size()));
  }

  private void store(VectorPoint p) {
    checkDimension(p.vector());
    if (dimension == 0) {
      dimension = p.vector().length;
    }
    points.put(p.id(), p);
  }

  private void checkDimension(float[] vector) {
    if (vector.length == 0) {
      throw new VectorIndexException("Vector must not be empty");
    }
    if (dimension != 0 && vector.length != dimension) {
      throw new VectorIndexException(
          "Vector dimension mismatch: expected %d, got %d".formatted(dimension, vector.length));
    }
  }

  static double cosine(float[] a, float[] b) {
    double dot = 0;
    double na = 0;
    double nb = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      na += a[i] * a[i];
      nb += b[i] * b[i];
    }
    if (na == 0 || nb == 0) return 0.0;
    return dot / (Math.sqrt(na) * Math.sqrt(nb));
  }
}
