package com.gentoro.onerag.manifest;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onerag.exception.ManifestIntegrityException;
import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.StateException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.lexical.CorpusChunk;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestStoreTest {

  private ManifestStore store;

  @BeforeEach
  void open() {
    store = new ManifestStore(ManifestStore.IN_MEMORY);
  }

  @AfterEach
  void close() {
    store.close();
  }

  private static DocumentRef doc(String path, String scope) {
    return new DocumentRef(
        path, "text/markdown", scope, Instant.parse("2024-01-01T00:00:00Z"), "hash-" + path,
        Map.of("risk_level", "review", "owner", "docs"));
  }

  private static ChunkRef chunk(String docId, int index, String text) {
    return new ChunkRef(
        docId, index, index * 10L, index * 10L + 10, "h" + index, 5, "text-direct", "1.0",
        "public", text);
  }

  @Test
  @DisplayName("schema is migrated to the latest version")
  void schemaVersion() {
    assertEquals(ManifestSchema.latestVersion(), store.schemaVersion());
  }

  @Test
  @DisplayName("documents are added as pending and can be read back by id and path")
  void addAndGetDocument() {
    String id = store.addDocument(doc("/docs/auth.md", "public"));

    DocumentRecord record = store.getDocument(id).orElseThrow();
    assertEquals("/docs/auth.md", record.path());
    assertEquals(DocumentStatus.PENDING, record.status());
    assertEquals("review", record.metadata().get("risk_level"));
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), record.sourceMtime());
    assertEquals(id, store.getDocumentByPath("/docs/auth.md").orElseThrow().docId());
    assertTrue(store.getDocument("missing").isEmpty());
  }

  @Test
  @DisplayName("a second document with the same path violates integrity")
  void duplicatePath() {
    store.addDocument(doc("/docs/auth.md", "public"));
    ManifestIntegrityException e =
        assertThrows(
            ManifestIntegrityException.class,
            () -> store.addDocument(doc("/docs/auth.md", "internal")));
    assertNotNull(e.getContext().get("operation"));
    assertEquals(1, store.listDocuments().size());
  }

  @Test
  @DisplayName("status updates, stale marking and filtered listing")
  void statusAndListing() {
    String a = store.addDocument(doc("/a.md", "public"));
    String b = store.addDocument(doc("/b.md", "internal"));
    store.addDocument(doc("/c.md", "public"));

    assertTrue(store.updateDocumentStatus(a, DocumentStatus.INGESTED));
    assertTrue(store.markDocumentStale(b));
    assertFalse(store.updateDocumentStatus("missing", DocumentStatus.FAILED));

    assertEquals(2, store.listDocuments("public", null).size());
    assertEquals(List.of(a), ids(store.listDocuments("public", DocumentStatus.INGESTED)));
    assertEquals(List.of(b), ids(store.getStaleDocuments()));
    assertEquals(3, store.listDocuments().size());
  }

  @Test
  @DisplayName("updating the source of a document resets it to pending")
  void updateSource() {
    String id = store.addDocument(doc("/a.md", "public"));
    store.updateDocumentStatus(id, DocumentStatus.INGESTED);

    store.updateDocumentSource(
        id, new DocumentRef("/a.md", "text/plain", "internal", Instant.EPOCH, "new-hash", null));

    DocumentRecord record = store.getDocument(id).orElseThrow();
    assertEquals(DocumentStatus.PENDING, record.status());
    assertEquals("new-hash", record.fileHash());
    assertEquals("internal", record.scope());
    assertThrows(
        NotFoundException.class,
        () -> store.updateDocumentSource("missing", doc("/x.md", "public")));
  }

  @Test
  @DisplayName("chunks are stored in order with their text")
  void chunks() {
    String docId = store.addDocument(doc("/a.md", "public"));
    List<String> ids =
        store.addChunks(List.of(chunk(docId, 0, "first"), chunk(docId, 1, "second")));

    assertEquals(2, ids.size());
    List<ChunkRecord> records = store.listChunksForDocument(docId);
    assertEquals(List.of("first", "second"), records.stream().map(ChunkRecord::text).toList());
    assertEquals(ids.get(1), records.get(1).chunkId());
    assertEquals(10, store.getChunk(ids.get(1)).orElseThrow().offsetStart());
    assertEquals("text-direct", records.get(0).extractor());
  }

  @Test
  @DisplayName("chunks of an unknown document and duplicate chunk indexes are rejected")
  void chunkIntegrity() {
    assertThrows(
        ManifestIntegrityException.class, () -> store.addChunk(chunk("missing", 0, "x")));

    String docId = store.addDocument(doc("/a.md", "public"));
    store.addChunk(chunk(docId, 0, "x"));
    assertThrows(
        ManifestIntegrityException.class,
        () -> store.addChunks(List.of(chunk(docId, 1, "y"), chunk(docId, 0, "dup"))));
    assertEquals(1, store.listChunksForDocument(docId).size(), "batch rolled back as a whole");
  }

  @Test
  @DisplayName("embeddings are unique per chunk, model and version")
  void embeddings() {
    String docId = store.addDocument(doc("/a.md", "public"));
    String chunkId = store.addChunk(chunk(docId, 0, "x"));

    store.addEmbedding(new EmbeddingRef(chunkId, "model-a", "1", chunkId));
    assertTrue(store.hasEmbedding(chunkId, "model-a", "1"));
    assertFalse(store.hasEmbedding(chunkId, "model-a", "2"));
    assertThrows(
        ManifestIntegrityException.class,
        () -> store.addEmbedding(new EmbeddingRef(chunkId, "model-a", "1", chunkId)));

    store.addEmbedding(new EmbeddingRef(chunkId, "model-a", "2", chunkId));
    EmbeddingRecord latest = store.getEmbeddingForChunk(chunkId).orElseThrow();
    assertEquals(chunkId, latest.vectorRef());

    assertEquals(2, store.deleteEmbeddingsForDocument(docId));
    assertTrue(store.getEmbeddingForChunk(chunkId).isEmpty());
  }

  @Test
  @DisplayName("deleting a document cascades to chunks and embeddings")
  void cascadeDelete() {
    String docId = store.addDocument(doc("/a.md", "public"));
    List<String> chunkIds =
        store.addChunks(List.of(chunk(docId, 0, "x"), chunk(docId, 1, "y")));
    for (String id : chunkIds) {
      store.addEmbedding(new EmbeddingRef(id, "m", "1", id));
    }

    assertTrue(store.deleteDocument(docId));
    assertFalse(store.deleteDocument(docId));

    ManifestStatistics stats = store.statistics();
    assertEquals(0, stats.chunks());
    assertEquals(0, stats.embeddings());
    assertTrue(store.getChunk(chunkIds.get(0)).isEmpty());
  }

  @Test
  @DisplayName("deleting chunks of a document removes their embeddings")
  void deleteChunks() {
    String docId = store.addDocument(doc("/a.md", "public"));
    String chunkId = store.addChunk(chunk(docId, 0, "x"));
    store.addEmbedding(new EmbeddingRef(chunkId, "m", "1", chunkId));

    assertEquals(1, store.deleteChunksForDocument(docId));
    assertEquals(0, store.statistics().embeddings());
    assertTrue(store.getDocument(docId).isPresent());
  }

  @Test
  @DisplayName("ingest job counters only grow while running")
  void ingestJobLifecycle() {
    String jobId = store.startIngestJob();
    store.updateIngestJob(jobId, 1, 4, 4);
    store.updateIngestJob(jobId, 2, 4, 6);

    assertThrows(ValidationException.class, () -> store.updateIngestJob(jobId, 1, 4, 6));

    store.completeIngestJob(jobId, JobStatus.COMPLETED, null);
    IngestJob job = store.getIngestJob(jobId).orElseThrow();
    assertEquals(JobStatus.COMPLETED, job.status());
    assertEquals(2, job.docsProcessed());
    assertEquals(6, job.embeddingsCreated());
    assertNotNull(job.completedAt());

    assertThrows(StateException.class, () -> store.updateIngestJob(jobId, 3, 4, 6));
    assertThrows(
        StateException.class, () -> store.completeIngestJob(jobId, JobStatus.FAILED, "late"));
    assertThrows(NotFoundException.class, () -> store.updateIngestJob("missing", 1, 1, 1));
    assertThrows(
        ValidationException.class, () -> store.completeIngestJob(jobId, JobStatus.RUNNING, null));
  }

  @Test
  @DisplayName("statistics count documents by status and scope, plus jobs")
  void statistics() {
    String a = store.addDocument(doc("/a.md", "public"));
    store.addDocument(doc("/b.md", "internal"));
    store.updateDocumentStatus(a, DocumentStatus.INGESTED);
    store.addChunk(chunk(a, 0, "x"));
    store.completeIngestJob(store.startIngestJob(), JobStatus.FAILED, "boom");

    ManifestStatistics stats = store.statistics();
    assertEquals(2, stats.documentsTotal());
    assertEquals(1L, stats.documentsByStatus().get("ingested"));
    assertEquals(1L, stats.documentsByStatus().get("pending"));
    assertEquals(1L, stats.documentsByScope().get("internal"));
    assertEquals(1, stats.chunks());
    assertEquals(1, stats.jobsTotal());
    assertEquals(1L, stats.jobsByStatus().get("failed"));
  }

  @Test
  @DisplayName("lexical corpus lists chunk texts of non-failed documents in the scope")
  void corpusByScope() {
    String a = store.addDocument(doc("/a.md", "public"));
    String b = store.addDocument(doc("/b.md", "public"));
    store.addChunks(List.of(chunk(a, 0, "alpha"), chunk(a, 1, "beta")));
    store.addChunk(chunk(b, 0, "gamma"));
    store.updateDocumentStatus(b, DocumentStatus.FAILED);

    List<CorpusChunk> corpus = store.listChunkTextsByScope("public");

    assertEquals(List.of("alpha", "beta"), corpus.stream().map(CorpusChunk::text).toList());
    CorpusChunk first = corpus.get(0);
    assertEquals("/a.md", first.path());
    assertEquals(a, first.docId());
    assertEquals("review", first.metadata().get("risk_level"));
    assertEquals(0, first.metadata().get("chunk_index"));
    assertTrue(store.listChunkTextsByScope("internal").isEmpty());
  }

  @Test
  @DisplayName("a file database keeps its content across reopen and migrates once")
  void fileDatabase(@TempDir Path dir) {
    String path = dir.resolve("nested/manifest.db").toString();
    String docId;
    try (ManifestStore file = new ManifestStore(path)) {
      docId = file.addDocument(doc("/a.md", "public"));
      file.vacuum();
    }
    try (ManifestStore reopened = new ManifestStore(path)) {
      assertEquals(ManifestSchema.latestVersion(), reopened.schemaVersion());
      assertTrue(reopened.getDocument(docId).isPresent());
    }
  }

  private static List<String> ids(List<DocumentRecord> records) {
    return records.stream().map(DocumentRecord::docId).toList();
  }
}
