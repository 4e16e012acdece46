package com.gentoro.onerag.ingestion;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onerag.embedding.EmbeddingAdapter;
import com.gentoro.onerag.embedding.EmbeddingRateLimiter;
import com.gentoro.onerag.embedding.EmbeddingResult;
import com.gentoro.onerag.embedding.EmbeddingSettings;
import com.gentoro.onerag.embedding.FakeEmbeddingProvider;
import com.gentoro.onerag.exception.EmbeddingException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.ingestion.chunk.Chunker;
import com.gentoro.onerag.ingestion.chunk.ChunkerSettings;
import com.gentoro.onerag.ingestion.extract.ExtractorRegistry;
import com.gentoro.onerag.manifest.ChunkRecord;
import com.gentoro.onerag.manifest.DocumentRecord;
import com.gentoro.onerag.manifest.DocumentStatus;
import com.gentoro.onerag.manifest.IngestJob;
import com.gentoro.onerag.manifest.JobStatus;
import com.gentoro.onerag.manifest.ManifestStore;
import com.gentoro.onerag.retrieval.AllowedStatus;
import com.gentoro.onerag.retrieval.GovernanceMode;
import com.gentoro.onerag.retrieval.HybridRetriever;
import com.gentoro.onerag.retrieval.RetrievalCandidate;
import com.gentoro.onerag.retrieval.RetrieverSettings;
import com.gentoro.onerag.vector.InMemoryVectorIndexClient;
import com.gentoro.onerag.vector.VectorSearchHit;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IngestionServiceTest {

  @TempDir Path dir;

  /** Embedder that rejects every batch while {@code failing} is set. */
  private static final class SwitchableProvider extends FakeEmbeddingProvider {
    final AtomicBoolean failing = new AtomicBoolean();

    @Override
    public List<EmbeddingResult> embedBatch(List<String> texts) {
      if (failing.get()) {
        throw new EmbeddingException(EmbeddingException.Kind.FATAL, "invalid api key");
      }
      return super.embedBatch(texts);
    }
  }

  private ManifestStore manifest;
  private InMemoryVectorIndexClient vectors;
  private SwitchableProvider provider;
  private EmbeddingAdapter embedder;
  private HybridRetriever retriever;
  private IngestionService service;

  @BeforeEach
  void setUp() {
    manifest = new ManifestStore(ManifestStore.IN_MEMORY);
    vectors = new InMemoryVectorIndexClient();
    provider = new SwitchableProvider();
    embedder =
        new EmbeddingAdapter(
            provider,
            new EmbeddingSettings(16, 0, Duration.ZERO, Duration.ZERO, 0, Duration.ZERO),
            new EmbeddingRateLimiter(0),
            d -> {});
    retriever = new HybridRetriever(vectors, embedder, manifest, RetrieverSettings.defaults());
    service =
        new IngestionService(
            manifest,
            ExtractorRegistry.withDefaults(),
            new Chunker(new ChunkerSettings(40, 8, 5, 80)),
            embedder,
            vectors,
            retriever);
  }

  @AfterEach
  void tearDown() {
    embedder.close();
    manifest.close();
  }

  private Path write(String name, String content) throws IOException {
    Path file = dir.resolve(name);
    Files.createDirectories(file.getParent());
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  private DocumentRecord document(Path file) {
    return manifest.getDocumentByPath(file.toAbsolutePath().normalize().toString()).orElseThrow();
  }

  @Test
  @DisplayName("directory ingest records documents, chunks, embeddings and vectors")
  void ingestDirectory() throws IOException {
    Path auth = write("auth.md", "# Auth\n\nAccess tokens expire after one hour.");
    write("guides/billing.txt", "Invoices are generated on the first day of each month.");
    write("image.png", "not text");

    IngestReport report = service.ingestDirectory(dir, "public", Map.of("team", "platform"));

    assertEquals(JobStatus.COMPLETED, report.status());
    assertEquals(2, report.documentsProcessed());
    assertEquals(2, report.documentsIngested());
    assertEquals(0, report.documentsFailed());
    assertTrue(report.chunksCreated() >= 2);
    assertEquals(report.chunksCreated(), report.embeddingsCreated());
    assertEquals(report.chunksCreated(), vectors.count(Map.of("scope", "public")));

    DocumentRecord doc = document(auth);
    assertEquals(DocumentStatus.INGESTED, doc.status());
    assertEquals("text/markdown", doc.mimeType());
    assertEquals("platform", doc.metadata().get("team"));
    assertNotNull(doc.ingestedAt());

    ChunkRecord chunk = manifest.listChunksForDocument(doc.docId()).get(0);
    assertTrue(manifest.hasEmbedding(chunk.chunkId(), "fake-embedding", "1"));
    VectorSearchHit point = vectors.getPoint(chunk.chunkId()).orElseThrow();
    assertEquals(doc.docId(), point.payload().get("doc_id"));
    assertEquals("safe", point.payload().get("risk_level"));
    assertEquals("platform", point.payload().get("team"));

    IngestJob job = manifest.getIngestJob(report.jobId()).orElseThrow();
    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(2, job.docsProcessed());
    assertEquals(report.embeddingsCreated(), job.embeddingsCreated());
    assertNotNull(job.completedAt());
  }

  @Test
  @DisplayName("unchanged files are skipped without new embeddings")
  void skipsUnchanged() throws IOException {
    Path file = write("a.md", "Refresh tokens rotate daily.");
    service.ingest(List.of(file), "public");
    int calls = provider.batchCalls();
    long embeddings = manifest.statistics().embeddings();

    IngestReport again = service.ingest(List.of(file), "public");

    assertEquals(1, again.documentsSkipped());
    assertEquals(0, again.documentsIngested());
    assertEquals(0, again.embeddingsCreated());
    assertEquals(calls, provider.batchCalls());
    assertEquals(embeddings, manifest.statistics().embeddings());
  }

  @Test
  @DisplayName("changed files replace their chunks and vectors")
  void reingestsChanged() throws IOException {
    Path file = write("a.md", "Refresh tokens rotate daily.");
    service.ingest(List.of(file), "public");
    DocumentRecord before = document(file);
    String oldChunk = manifest.listChunksForDocument(before.docId()).get(0).chunkId();

    write("a.md", "Refresh tokens rotate weekly since the policy change.");
    IngestReport report = service.ingest(List.of(file), "public");

    DocumentRecord after = document(file);
    assertEquals(before.docId(), after.docId());
    assertNotEquals(before.fileHash(), after.fileHash());
    assertEquals(DocumentStatus.INGESTED, after.status());
    assertEquals(0, report.documentsSkipped());
    assertTrue(vectors.getPoint(oldChunk).isEmpty());
    assertTrue(manifest.getChunk(oldChunk).isEmpty());
    assertEquals(
        manifest.listChunksForDocument(after.docId()).size(),
        vectors.count(Map.of("doc_id", after.docId())));
  }

  @Test
  @DisplayName("a failing file is marked failed while the batch continues")
  void partialFailure() throws IOException {
    Path good = write("good.md", "Backups run nightly.");
    Path bad = write("bad.pdf", "this is not a pdf");

    IngestReport report = service.ingest(List.of(bad, good), "public");

    assertEquals(JobStatus.COMPLETED, report.status());
    assertEquals(1, report.documentsFailed());
    assertEquals(1, report.documentsIngested());
    assertEquals(DocumentStatus.FAILED, document(bad).status());
    assertEquals(DocumentStatus.INGESTED, document(good).status());
    String error = manifest.getIngestJob(report.jobId()).orElseThrow().errorMessage();
    assertTrue(error.startsWith("1 of 2 documents failed"));
  }

  @Test
  @DisplayName("the job fails when every file fails")
  void allFailed() throws IOException {
    Path bad = write("bad.pdf", "this is not a pdf");
    Path missing = dir.resolve("missing.md");

    IngestReport report = service.ingest(List.of(bad, missing), "public");

    assertEquals(JobStatus.FAILED, report.status());
    assertEquals(2, report.errors().size());
    assertEquals(JobStatus.FAILED, manifest.getIngestJob(report.jobId()).orElseThrow().status());
  }

  @Test
  @DisplayName("a document whose embedding failed is rebuilt on the next run")
  void retriesAfterEmbeddingFailure() throws IOException {
    Path file = write("a.md", "Rotate signing keys quarterly.");
    provider.failing.set(true);
    IngestReport failed = service.ingest(List.of(file), "public");
    assertEquals(JobStatus.FAILED, failed.status());
    assertEquals(DocumentStatus.FAILED, document(file).status());
    assertEquals(0, vectors.count(null));

    provider.failing.set(false);
    IngestReport report = service.ingest(List.of(file), "public");

    assertEquals(JobStatus.COMPLETED, report.status());
    assertEquals(DocumentStatus.INGESTED, document(file).status());
    assertEquals(report.chunksCreated(), vectors.count(null));
  }

  @Test
  @DisplayName("a pending document resumes with its recorded chunks")
  void resumesPending() throws IOException {
    Path file = write("a.md", "Rotate signing keys quarterly.");
    provider.failing.set(true);
    service.ingest(List.of(file), "public");
    DocumentRecord doc = document(file);
    int recorded = manifest.listChunksForDocument(doc.docId()).size();
    manifest.updateDocumentStatus(doc.docId(), DocumentStatus.PENDING);

    provider.failing.set(false);
    IngestReport report = service.ingest(List.of(file), "public");

    assertEquals(0, report.chunksCreated());
    assertEquals(recorded, report.embeddingsCreated());
    assertEquals(recorded, manifest.listChunksForDocument(doc.docId()).size());
    assertEquals(DocumentStatus.INGESTED, document(file).status());
  }

  @Test
  @DisplayName("ingested content is searchable with governance applied")
  void searchAfterIngest() throws IOException {
    Path safe = write("auth.md", "OAuth access tokens expire after one hour.");
    Path risky = write("rotate.md", "Rotate refresh tokens daily with the admin console.");
    Path billing = write("billing.md", "Invoices are generated monthly.");
    service.ingest(List.of(safe, billing), "public");
    service.ingest(List.of(risky), "public", Map.of("risk_level", "dangerous", "path", "/spoof"));

    List<RetrievalCandidate> bypass =
        retriever.search("refresh tokens", "public", 5, GovernanceMode.BYPASS, null);
    assertEquals(risky.toAbsolutePath().normalize().toString(), bypass.get(0).path());
    assertEquals(AllowedStatus.ALLOWED, bypass.get(0).allowedInMode());

    List<RetrievalCandidate> readOnly =
        retriever.search("refresh tokens", "public", 5, GovernanceMode.READ_ONLY, null);
    assertEquals(safe.toAbsolutePath().normalize().toString(), readOnly.get(0).path());
    RetrievalCandidate blocked =
        readOnly.stream().filter(c -> c.path().endsWith("rotate.md")).findFirst().orElseThrow();
    assertEquals(AllowedStatus.BLOCKED, blocked.allowedInMode());
    assertEquals(0.0, blocked.score());
  }

  @Test
  @DisplayName("deleting a document removes its vectors and manifest rows")
  void deleteDocument() throws IOException {
    Path file = write("a.md", "Rotate signing keys quarterly.");
    service.ingest(List.of(file), "public");
    String docId = document(file).docId();

    assertTrue(service.deleteDocument(docId));

    assertEquals(0, vectors.count(Map.of("doc_id", docId)));
    assertTrue(manifest.getDocument(docId).isEmpty());
    assertTrue(manifest.listChunkTextsByScope("public").isEmpty());
    assertFalse(service.deleteDocument(docId));
  }

  @Test
  @DisplayName("invalid arguments are rejected before a job starts")
  void rejectsInvalidArguments() throws IOException {
    Path file = write("a.md", "text");
    assertThrows(ValidationException.class, () -> service.ingest(List.of(file), " "));
    assertThrows(ValidationException.class, () -> service.ingestDirectory(file, "public", null));
    assertEquals(0, manifest.statistics().jobsTotal());
  }
}
