package com.gentoro.onerag.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.onerag.exception.ConfigException;
import com.gentoro.onerag.exception.EmbeddingException;
import com.gentoro.onerag.utility.JacksonUtility;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OpenAiEmbeddingProviderTest {

  private MockWebServer server;
  private EmbeddingProvider provider;

  @BeforeEach
  void start() throws IOException {
    server = new MockWebServer();
    server.start();
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("provider", "openai");
    cfg.setProperty("apiKey", "sk-test");
    cfg.setProperty("baseUrl", server.url("/v1").toString());
    cfg.setProperty("model", "text-embedding-3-small");
    cfg.setProperty("model-version", "2024-01");
    cfg.setProperty("dimensions", 2);
    provider = EmbeddingProviderFactory.create(cfg);
  }

  @AfterEach
  void stop() throws IOException {
    server.shutdown();
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse()
        .setResponseCode(status)
        .setHeader("Content-Type", "application/json")
        .setBody(body);
  }

  @Test
  @DisplayName("batch results are ordered by the response index")
  void embedBatch() throws Exception {
    server.enqueue(
        json(
            200,
            """
            {"object": "list", "model": "text-embedding-3-small",
             "data": [
               {"object": "embedding", "index": 1, "embedding": [0.3, 0.4]},
               {"object": "embedding", "index": 0, "embedding": [0.1, 0.2]}
             ],
             "usage": {"prompt_tokens": 5, "total_tokens": 5}}
            """));

    List<EmbeddingResult> results = provider.embedBatch(List.of("first text", "second one here"));

    assertEquals(2, results.size());
    assertArrayEquals(new float[] {0.1f, 0.2f}, results.get(0).vector());
    assertArrayEquals(new float[] {0.3f, 0.4f}, results.get(1).vector());
    assertEquals(3, results.get(1).tokenCount());
    assertEquals("2024-01", results.get(0).modelVersion());

    RecordedRequest request = server.takeRequest();
    assertTrue(request.getPath().endsWith("/embeddings"));
    assertEquals("Bearer sk-test", request.getHeader("Authorization"));
    JsonNode body = JacksonUtility.getJsonMapper().readTree(request.getBody().readUtf8());
    assertEquals("text-embedding-3-small", body.get("model").asText());
    assertEquals(2, body.get("dimensions").asInt());
    assertEquals("second one here", body.get("input").get(1).asText());
  }

  @Test
  @DisplayName("client errors are classified as fatal")
  void badRequest() {
    server.enqueue(json(400, "{\"error\": {\"message\": \"bad input\"}}"));

    EmbeddingException e =
        assertThrows(EmbeddingException.class, () -> provider.embedQuery("query"));
    assertEquals(EmbeddingException.Kind.FATAL, e.kind());
    assertFalse(e.isRetryable());
  }

  @Test
  @DisplayName("authorization errors stay retryable")
  void unauthorizedIsTransient() {
    server.enqueue(json(401, "{\"error\": {\"message\": \"no such key\"}}"));

    EmbeddingException e =
        assertThrows(EmbeddingException.class, () -> provider.embedQuery("query"));
    assertEquals(EmbeddingException.Kind.TRANSIENT, e.kind());
    assertEquals(401, e.statusCode().getAsInt());
  }

  @Test
  @DisplayName("factory rejects missing keys and unknown providers")
  void factoryValidation() {
    BaseConfiguration cfg = new BaseConfiguration();
    assertThrows(ConfigException.class, () -> EmbeddingProviderFactory.create(cfg));
    cfg.setProperty("provider", "openai");
    assertThrows(ConfigException.class, () -> EmbeddingProviderFactory.create(cfg));
    cfg.setProperty("provider", "word2vec");
    assertThrows(ConfigException.class, () -> EmbeddingProviderFactory.create(cfg));
  }
}
