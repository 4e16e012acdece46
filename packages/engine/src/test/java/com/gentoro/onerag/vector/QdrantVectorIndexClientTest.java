package com.gentoro.onerag.vector;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onerag.exception.VectorIndexException;
import com.gentoro.onerag.utility.JacksonUtility;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QdrantVectorIndexClientTest {

  private MockWebServer server;
  private QdrantVectorIndexClient client;

  @BeforeEach
  void start() throws IOException {
    server = new MockWebServer();
    server.start();
    client =
        new QdrantVectorIndexClient(
            new OkHttpClient(),
            server.url("/").toString(),
            "chunks_v1",
            3,
            "file:///snapshots");
  }

  @AfterEach
  void stop() throws IOException {
    client.close();
    server.shutdown();
  }

  private void enqueueJson(String body) {
    server.enqueue(
        new MockResponse().setHeader("Content-Type", "application/json").setBody(body));
  }

  private static JsonNode body(RecordedRequest request) throws IOException {
    return JacksonUtility.getJsonMapper().readTree(request.getBody().readUtf8());
  }

  @Test
  @DisplayName("missing collection is created with cosine distance and payload indexes")
  void ensureCollectionCreates() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404).setBody("{}"));
    enqueueJson("{\"result\":true,\"status\":\"ok\"}");
    enqueueJson("{\"result\":{\"status\":\"completed\"}}");
    enqueueJson("{\"result\":{\"status\":\"completed\"}}");

    assertTrue(client.ensureCollection());

    assertEquals("GET", server.takeRequest().getMethod());
    RecordedRequest create = server.takeRequest();
    assertEquals("PUT", create.getMethod());
    assertEquals("/collections/chunks_v1", create.getPath());
    JsonNode vectors = body(create).path("vectors");
    assertEquals(3, vectors.path("size").asInt());
    assertEquals("Cosine", vectors.path("distance").asText());
    RecordedRequest scopeIndex = server.takeRequest();
    assertEquals("/collections/chunks_v1/index?wait=true", scopeIndex.getPath());
    assertEquals("scope", body(scopeIndex).path("field_name").asText());
    assertEquals("doc_id", body(server.takeRequest()).path("field_name").asText());
  }

  @Test
  @DisplayName("existing collection is left alone")
  void ensureCollectionExists() {
    enqueueJson("{\"result\":{\"status\":\"green\"}}");
    assertFalse(client.ensureCollection());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  @DisplayName("upsertBatch splits points into batches")
  void upsertBatch() throws Exception {
    enqueueJson("{\"result\":{\"status\":\"completed\"}}");
    enqueueJson("{\"result\":{\"status\":\"completed\"}}");
    List<VectorPoint> points =
        List.of(
            new VectorPoint("a", new float[] {1, 0, 0}, Map.of("scope", "public")),
            new VectorPoint("b", new float[] {0, 1, 0}, Map.of("scope", "public")),
            new VectorPoint("c", new float[] {0, 0, 1}, Map.of("scope", "public")));

    assertEquals(3, client.upsertBatch(points, 2));

    RecordedRequest first = server.takeRequest();
    assertEquals("PUT", first.getMethod());
    assertEquals("/collections/chunks_v1/points?wait=true", first.getPath());
    JsonNode sent = body(first).path("points");
    assertEquals(2, sent.size());
    assertEquals("a", sent.get(0).path("id").asText());
    assertEquals(1.0, sent.get(0).path("vector").get(0).asDouble());
    assertEquals(1, body(server.takeRequest()).path("points").size());
  }

  @Test
  @DisplayName("search sends the scope filter and parses hits")
  void search() throws Exception {
    enqueueJson(
        "{\"result\":[{\"id\":\"a\",\"score\":0.91,"
            + "\"payload\":{\"doc_id\":\"d1\",\"scope\":\"public\"}}]}");

    List<VectorSearchHit> hits =
        client.search(
            new float[] {1, 0, 0},
            "public",
            5,
            Map.of("chunk_index", RangeCondition.between(0, 3)),
            null);

    assertEquals(1, hits.size());
    assertEquals("a", hits.get(0).id());
    assertEquals(0.91, hits.get(0).score(), 1e-9);
    assertEquals("d1", hits.get(0).payload().get("doc_id"));

    RecordedRequest request = server.takeRequest();
    assertEquals("/collections/chunks_v1/points/search", request.getPath());
    JsonNode sent = body(request);
    assertEquals(5, sent.path("limit").asInt());
    assertTrue(sent.path("score_threshold").isMissingNode());
    JsonNode must = sent.path("filter").path("must");
    assertEquals("scope", must.get(0).path("key").asText());
    assertEquals("public", must.get(0).path("match").path("value").asText());
    assertEquals(3.0, must.get(1).path("range").path("lte").asDouble());
    assertTrue(must.get(1).path("range").path("gt").isMissingNode());
  }

  @Test
  @DisplayName("getPoint returns empty when the point is unknown")
  void getPoint() {
    enqueueJson("{\"result\":[]}");
    assertEquals(Optional.empty(), client.getPoint("missing"));
  }

  @Test
  @DisplayName("deleteByDoc counts matching points, then deletes them by filter")
  void deleteByDoc() throws Exception {
    enqueueJson("{\"result\":{\"count\":4}}");
    enqueueJson("{\"result\":{\"status\":\"completed\"}}");

    assertEquals(4, client.deleteByDoc("d1"));

    JsonNode count = body(server.takeRequest());
    assertTrue(count.path("exact").asBoolean());
    RecordedRequest delete = server.takeRequest();
    assertEquals("/collections/chunks_v1/points/delete?wait=true", delete.getPath());
    JsonNode cond = body(delete).path("filter").path("must").get(0);
    assertEquals("doc_id", cond.path("key").asText());
    assertEquals("d1", cond.path("match").path("value").asText());
  }

  @Test
  @DisplayName("deleteByDoc skips the delete call when nothing matches")
  void deleteByDocNothing() {
    enqueueJson("{\"result\":{\"count\":0}}");
    assertEquals(0, client.deleteByDoc("d1"));
    assertEquals(1, server.getRequestCount());
  }

  @Test
  @DisplayName("snapshots are created, listed and recovered from their location")
  void snapshots() throws Exception {
    enqueueJson("{\"result\":{\"name\":\"snap-1\"}}");
    enqueueJson(
        "{\"result\":[{\"name\":\"snap-1\",\"creation_time\":\"2024-01-01T00:00:00\","
            + "\"size\":1024}]}");
    enqueueJson("{\"result\":true}");

    assertEquals("snap-1", client.snapshot());
    List<SnapshotInfo> snapshots = client.listSnapshots();
    client.restore("snap-1");

    assertEquals(1024, snapshots.get(0).size());
    server.takeRequest();
    server.takeRequest();
    RecordedRequest recover = server.takeRequest();
    assertEquals("/collections/chunks_v1/snapshots/recover?wait=true", recover.getPath());
    assertEquals(
        "file:///snapshots/chunks_v1/snap-1", body(recover).path("location").asText());
  }

  @Test
  @DisplayName("HTTP errors become VectorIndexException, health check reports them")
  void errors() {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
    VectorIndexException e =
        assertThrows(VectorIndexException.class, () -> client.count(null));
    assertTrue(e.getMessage().contains("500"));

    server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
    HealthStatus health = client.healthCheck();
    assertFalse(health.healthy());
    assertTrue(health.message().startsWith("Connection error"));
  }

  @Test
  @DisplayName("health check is healthy on a green collection")
  void healthy() {
    enqueueJson("{\"result\":{\"status\":\"green\",\"points_count\":12}}");
    HealthStatus health = client.healthCheck();
    assertTrue(health.healthy());
    assertEquals("Healthy: 12 points", health.message());
  }
}
