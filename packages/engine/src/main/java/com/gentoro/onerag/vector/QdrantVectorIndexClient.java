package com.gentoro.onerag.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.exception.VectorIndexException;
import com.gentoro.onerag.http.OkHttpFactory;
import com.gentoro.onerag.utility.JacksonUtility;
import com.gentoro.onerag.utility.StringUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link VectorIndexClient} over the Qdrant REST API.
 *
 * <p>Point ids are the chunk ids (UUIDs). Every search is restricted by a {@code scope} payload
 * match; extra filters become further {@code must} conditions.
 */
public class QdrantVectorIndexClient implements VectorIndexClient {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(QdrantVectorIndexClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final String collection;
  private final int dimension;
  private final String snapshotLocationBase;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  private record HttpResult(int code, String body) {
    boolean ok() {
      return code >= 200 && code < 300;
    }
  }

  public QdrantVectorIndexClient(
      String url, String apiKey, String collection, int dimension, Duration timeout) {
    this(
        OkHttpFactory.create(apiKey, timeout),
        url,
        collection,
        dimension,
        "file:///qdrant/snapshots");
  }

  public QdrantVectorIndexClient(
      OkHttpClient http,
      String url,
      String collection,
      int dimension,
      String snapshotLocationBase) {
    HttpUrl parsed = HttpUrl.parse(url);
    if (parsed == null) {
      throw new ValidationException("Invalid Qdrant url: " + url);
    }
    this.http = http;
    this.baseUrl = parsed;
    this.collection = collection;
    this.dimension = dimension;
    this.snapshotLocationBase = snapshotLocationBase;
  }

  public String collection() {
    return collection;
  }

  /**
   * Creates the collection (cosine distance) with keyword indexes on {@code scope} and {@code
   * doc_id} when it does not exist yet.
   *
   * @return true if the collection was created
   */
  public boolean ensureCollection() {
    HttpResult existing = execute("GET", collectionUrl(""), null);
    if (existing.ok()) return false;
    if (existing.code() != 404) {
      throw failure("GET", collectionUrl(""), existing);
    }
    if (dimension <= 0) {
      throw new ValidationException(
          "Vector dimension is required to create collection " + collection);
    }
    call(
        "PUT",
        collectionUrl(""),
        Map.of("vectors", Map.of("size", dimension, "distance", "Cosine")));
    for (String field : List.of("scope", "doc_id")) {
      call(
          "PUT",
          collectionUrl("index").newBuilder().addQueryParameter("wait", "true").build(),
          Map.of("field_name", field, "field_schema", "keyword"));
    }
    log.info("Created Qdrant collection {} (dimension {})", collection, dimension);
    return true;
  }

  @Override
  public boolean upsert(String id, float[] vector, Map<String, Object> payload) {
    return upsertChunk(List.of(new VectorPoint(id, vector, payload)));
  }

  @Override
  public int upsertBatch(List<VectorPoint> points, int batchSize) {
    int size = Math.max(batchSize, 1);
    int total = 0;
    for (int i = 0; i < points.size(); i += size) {
      List<VectorPoint> batch = points.subList(i, Math.min(i + size, points.size()));
      if (upsertChunk(batch)) {
        total += batch.size();
      }
    }
    return total;
  }

  private boolean upsertChunk(List<VectorPoint> batch) {
    List<Map<String, Object>> body = new ArrayList<>(batch.size());
    for (VectorPoint p : batch) {
      Map<String, Object> point = new LinkedHashMap<>();
      point.put("id", p.id());
      point.put("vector", p.vector());
      point.put("payload", p.payload());
      body.add(point);
    }
    JsonNode result = call("PUT", pointsUrl("", true), Map.of("points", body));
    return "completed".equals(result.path("result").path("status").asText());
  }

  @Override
  public List<VectorSearchHit> search(
      float[] vector, String scope, int topK, Map<String, Object> filters, Double scoreThreshold) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("vector", vector);
    body.put("limit", topK);
    body.put("with_payload", true);
    body.put("filter", filter(scope, filters));
    if (scoreThreshold != null) {
      body.put("score_threshold", scoreThreshold);
    }
    JsonNode result = call("POST", pointsUrl("search", false), body).path("result");
    List<VectorSearchHit> hits = new ArrayList<>();
    for (JsonNode hit : result) {
      hits.add(
          new VectorSearchHit(
              hit.path("id").asText(), hit.path("score").asDouble(), payload(hit)));
    }
    return hits;
  }

  @Override
  public Optional<VectorSearchHit> getPoint(String id) {
    Map<String, Object> body =
        Map.of("ids", List.of(id), "with_payload", true, "with_vector", false);
    JsonNode result = call("POST", pointsUrl("", false), body).path("result");
    if (!result.isArray() || result.isEmpty()) return Optional.empty();
    JsonNode point = result.get(0);
    return Optional.of(new VectorSearchHit(point.path("id").asText(), 0.0, payload(point)));
  }

  @Override
  public boolean delete(String id) {
    call("POST", pointsUrl("delete", true), Map.of("points", List.of(id)));
    return true;
  }

  @Override
  public int deleteByDoc(String docId) {
    long count = count(Map.of("doc_id", docId));
    if (count > 0) {
      call(
          "POST",
          pointsUrl("delete", true),
          Map.of("filter", filter(null, Map.of("doc_id", docId))));
    }
    return (int) count;
  }

  @Override
  public long count(Map<String, Object> filters) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("exact", true);
    if (filters != null && !filters.isEmpty()) {
      body.put("filter", filter(null, filters));
    }
    return call("POST", pointsUrl("count", false), body).path("result").path("count").asLong();
  }

  @Override
  public String snapshot() {
    String name =
        call("POST", collectionUrl("snapshots"), Map.of()).path("result").path("name").asText();
    log.info("Created snapshot: {}", name);
    return name;
  }

  @Override
  public List<SnapshotInfo> listSnapshots() {
    List<SnapshotInfo> out = new ArrayList<>();
    for (JsonNode s : call("GET", collectionUrl("snapshots"), null).path("result")) {
      out.add(
          new SnapshotInfo(
              s.path("name").asText(),
              s.path("creation_time").asText(null),
              s.path("size").asLong()));
    }
    return out;
  }

  @Override
  public void restore(String snapshotName) {
    String location = "%s/%s/%s".formatted(snapshotLocationBase, collection, snapshotName);
    call(
        "PUT",
        collectionUrl("snapshots/recover").newBuilder().addQueryParameter("wait", "true").build(),
        Map.of("location", location));
    log.info("Restored snapshot: {}", snapshotName);
  }

  @Override
  public HealthStatus healthCheck() {
    try {
      JsonNode info = call("GET", collectionUrl(""), null).path("result");
      String status = info.path("status").asText("unknown");
      if ("green".equals(status)) {
        return new HealthStatus(
            true, "Healthy: %d points".formatted(info.path("points_count").asLong()));
      }
      return new HealthStatus(false, "Status: " + status);
    } catch (VectorIndexException e) {
      log.warn("Qdrant health check failed: {}", e.getMessage());
      return new HealthStatus(false, "Connection error: " + e.getMessage());
    }
  }

  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }

  static Map<String, Object> filter(String scope, Map<String, Object> filters) {
    List<Map<String, Object>> must = new ArrayList<>();
    if (scope != null) {
      must.add(Map.of("key", "scope", "match", Map.of("value", scope)));
    }
    if (filters != null) {
      filters.forEach(
          (key, value) -> {
            if (value instanceof RangeCondition range) {
              must.add(Map.of("key", key, "range", range));
            } else {
              must.add(Map.of("key", key, "match", Map.of("value", value)));
            }
          });
    }
    return Map.of("must", must);
  }

  private Map<String, Object> payload(JsonNode point) {
    JsonNode node = point.path("payload");
    if (!node.isObject()) return Map.of();
    return mapper.convertValue(node, MAP_TYPE);
  }

  private HttpUrl collectionUrl(String subPath) {
    HttpUrl.Builder b =
        baseUrl.newBuilder().addPathSegment("collections").addPathSegment(collection);
    if (!subPath.isEmpty()) {
      b.addPathSegments(subPath);
    }
    return b.build();
  }

  private HttpUrl pointsUrl(String action, boolean wait) {
    HttpUrl.Builder b =
        collectionUrl(action.isEmpty() ? "points" : "points/" + action).newBuilder();
    if (wait) {
      b.addQueryParameter("wait", "true");
    }
    return b.build();
  }

  private JsonNode call(String method, HttpUrl url, Object body) {
    HttpResult result = execute(method, url, body);
    if (!result.ok()) {
      throw failure(method, url, result);
    }
    if (result.body().isBlank()) return MissingNode.getInstance();
    try {
      return mapper.readTree(result.body());
    } catch (IOException e) {
      throw new VectorIndexException("Malformed Qdrant response for " + url.encodedPath(), e);
    }
  }

  private HttpResult execute(String method, HttpUrl url, Object body) {
    RequestBody requestBody =
        body == null ? null : RequestBody.create(JacksonUtility.toJson(body), JSON);
    Request request = new Request.Builder().url(url).method(method, requestBody).build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      return new HttpResult(response.code(), responseBody == null ? "" : responseBody.string());
    } catch (IOException e) {
      throw new VectorIndexException(
          "Qdrant request %s %s failed: %s".formatted(method, url.encodedPath(), e.getMessage()),
          e);
    }
  }

  private static VectorIndexException failure(String method, HttpUrl url, HttpResult result) {
    return new VectorIndexException(
        "Qdrant %s %s returned HTTP %d: %s"
            .formatted(
                method,
                url.encodedPath(),
                result.code(),
                StringUtility.truncate(result.body(), 300)));
  }
}
