package com.gentoro.onerag.vector;

import com.gentoro.onerag.exception.ConfigException;
import java.time.Duration;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/** Builds the vector engine client selected by {@code vector.engine}. */
public final class VectorIndexClientFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(VectorIndexClientFactory.class);

  private VectorIndexClientFactory() {}

  public static VectorIndexClient create(Configuration vectorConfig) {
    String engine = vectorConfig.getString("engine", "memory").trim().toLowerCase(Locale.ROOT);
    int dimension = vectorConfig.getInt("dimension", 0);
    switch (engine) {
      case "memory":
        log.info("Using in-memory vector index");
        return new InMemoryVectorIndexClient(dimension);
      case "qdrant":
        QdrantVectorIndexClient client =
            new QdrantVectorIndexClient(
                vectorConfig.getString("url", "http://localhost:6333"),
                vectorConfig.getString("api-key", null),
                vectorConfig.getString("collection", "chunks_v1"),
                dimension,
                Duration.ofMillis(vectorConfig.getLong("timeout-ms", 30_000L)));
        if (vectorConfig.getBoolean("create-collection", true)) {
          client.ensureCollection();
        }
        log.info("Using Qdrant vector index, collection {}", client.collection());
        return client;
      default:
        throw new ConfigException("Unknown vector engine: " + engine);
    }
  }
}
