package com.gentoro.onerag.vector;

import com.gentoro.onerag.exception.VectorIndexException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the external vector-similarity engine.
 *
 * <p>Filters map a payload key to either an exact value or a {@link RangeCondition}; all conditions
 * must hold. Implementations throw {@link VectorIndexException} when the engine is unreachable or
 * rejects a request, except {@link #healthCheck()} which reports the failure instead.
 */
public interface VectorIndexClient extends AutoCloseable {

  boolean upsert(String id, float[] vector, Map<String, Object> payload);

  /** @return number of points stored */
  int upsertBatch(List<VectorPoint> points, int batchSize);

  /**
   * Nearest neighbours restricted to {@code scope}.
   *
   * @param filters additional payload conditions, may be null
   * @param scoreThreshold minimum similarity, may be null
   */
  List<VectorSearchHit> search(
      float[] vector, String scope, int topK, Map<String, Object> filters, Double scoreThreshold);

  Optional<VectorSearchHit> getPoint(String id);

  boolean delete(String id);

  /** @return number of points removed */
  int deleteByDoc(String docId);

  long count(Map<String, Object> filters);

  String snapshot();

  List<SnapshotInfo> listSnapshots();

  void restore(String snapshotName);

  HealthStatus healthCheck();

  @Override
  default void close() {}
}
