package com.gentoro.onerag;

import com.gentoro.onerag.embedding.EmbeddingAdapter;
import com.gentoro.onerag.embedding.EmbeddingProvider;
import com.gentoro.onerag.embedding.EmbeddingProviderFactory;
import com.gentoro.onerag.embedding.EmbeddingSettings;
import com.gentoro.onerag.exception.StateException;
import com.gentoro.onerag.explainer.ExplainerSettings;
import com.gentoro.onerag.explainer.RetrievalExplainer;
import com.gentoro.onerag.ingestion.IngestionService;
import com.gentoro.onerag.ingestion.chunk.Chunker;
import com.gentoro.onerag.ingestion.chunk.ChunkerSettings;
import com.gentoro.onerag.ingestion.extract.ExtractorRegistry;
import com.gentoro.onerag.manifest.ManifestStore;
import com.gentoro.onerag.model.ChatProvider;
import com.gentoro.onerag.model.ChatProviderFactory;
import com.gentoro.onerag.prompt.PromptRepository;
import com.gentoro.onerag.prompt.PromptRepositoryFactory;
import com.gentoro.onerag.retrieval.HybridRetriever;
import com.gentoro.onerag.retrieval.RetrieverSettings;
import com.gentoro.onerag.vector.VectorIndexClient;
import com.gentoro.onerag.vector.VectorIndexClientFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Composition root: loads the configuration once and wires every component by constructor.
 *
 * <pre>
 *   try (OneRag rag = new OneRag("classpath:application.yaml")) {
 *     rag.ingestion().ingestDirectory(docs, "public", Map.of());
 *     List&lt;RetrievalCandidate&gt; hits = rag.retriever().search("token refresh", "public");
 *     ExplainerOutput selection = rag.explainer().selectChunks("token refresh", hits);
 *   }
 * </pre>
 */
public class OneRag implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(OneRag.class);

  private final Configuration configuration;
  private final ManifestStore manifest;
  private final VectorIndexClient vectorIndex;
  private final EmbeddingAdapter embedder;
  private final HybridRetriever retriever;
  private final IngestionService ingestion;
  private final RetrievalExplainer explainer;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Builds every component from the YAML at {@code configLocation}, providers included. */
  public OneRag(String configLocation) {
    this(new ConfigurationProvider(configLocation).config());
  }

  public OneRag(Configuration configuration) {
    this(
        configuration,
        EmbeddingProviderFactory.create(configuration.subset("embedding")),
        ChatProviderFactory.createProvider(configuration));
  }

  /** Builds the components around the given providers; used when the providers are not SPI-made. */
  public OneRag(
      Configuration configuration,
      EmbeddingProvider embeddingProvider,
      ChatProvider chatProvider) {
    this.configuration = configuration;
    com.gentoro.onerag.logging.LoggingService.applyConfiguration(configuration);

    PromptRepository prompts = PromptRepositoryFactory.create(configuration.subset("prompt"));
    this.manifest = ManifestStore.fromConfiguration(configuration.subset("manifest"));
    this.vectorIndex = VectorIndexClientFactory.create(configuration.subset("vector"));
    this.embedder =
        new EmbeddingAdapter(
            embeddingProvider, EmbeddingSettings.from(configuration.subset("embedding")));
    this.retriever =
        new HybridRetriever(
            vectorIndex,
            embedder,
            manifest,
            RetrieverSettings.from(configuration.subset("retrieval")));
    this.ingestion =
        new IngestionService(
            manifest,
            ExtractorRegistry.withDefaults(),
            new Chunker(ChunkerSettings.from(configuration.subset("chunker"))),
            embedder,
            vectorIndex,
            retriever);
    this.explainer =
        new RetrievalExplainer(
            chatProvider, prompts, ExplainerSettings.from(configuration.subset("explainer")));
    log.info(
        "OneRag initialized: manifest={}, embedding_model={}",
        manifest.databasePath(),
        embedder.model());
  }

  public Configuration configuration() {
    return configuration;
  }

  public ManifestStore manifest() {
    return requireOpen(manifest);
  }

  public VectorIndexClient vectorIndex() {
    return requireOpen(vectorIndex);
  }

  public EmbeddingAdapter embedder() {
    return requireOpen(embedder);
  }

  public HybridRetriever retriever() {
    return requireOpen(retriever);
  }

  public IngestionService ingestion() {
    return requireOpen(ingestion);
  }

  public RetrievalExplainer explainer() {
    return requireOpen(explainer);
  }

  private <T> T requireOpen(T component) {
    if (closed.get()) {
      throw new StateException("OneRag is closed");
    }
    return component;
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      closeLogged("embedder", embedder);
      closeLogged("vector index", vectorIndex);
      closeLogged("manifest", manifest);
    }
  }

  private static void closeLogged(String name, AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Failed to close {}", name, e);
    }
  }
}
