package com.gentoro.onerag.ingestion;

import com.gentoro.onerag.embedding.EmbeddingAdapter;
import com.gentoro.onerag.embedding.EmbeddingResult;
import com.gentoro.onerag.exception.ExceptionUtil;
import com.gentoro.onerag.exception.ExtractionException;
import com.gentoro.onerag.exception.OneRagErrorCode;
import com.gentoro.onerag.exception.OneRagException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.ingestion.chunk.Chunk;
import com.gentoro.onerag.ingestion.chunk.Chunker;
import com.gentoro.onerag.ingestion.extract.ExtractedText;
import com.gentoro.onerag.ingestion.extract.ExtractorRegistry;
import com.gentoro.onerag.manifest.ChunkRecord;
import com.gentoro.onerag.manifest.ChunkRef;
import com.gentoro.onerag.manifest.DocumentRecord;
import com.gentoro.onerag.manifest.DocumentRef;
import com.gentoro.onerag.manifest.DocumentStatus;
import com.gentoro.onerag.manifest.EmbeddingRef;
import com.gentoro.onerag.manifest.JobStatus;
import com.gentoro.onerag.manifest.ManifestStore;
import com.gentoro.onerag.retrieval.HybridRetriever;
import com.gentoro.onerag.retrieval.RiskLevel;
import com.gentoro.onerag.utility.StringUtility;
import com.gentoro.onerag.vector.VectorIndexClient;
import com.gentoro.onerag.vector.VectorPoint;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Drives documents from disk into the manifest, the vector index and the lexical corpus.
 *
 * <p>Each call to {@link #ingest} is recorded as one ingest job. Per file:
 *
 * <ol>
 *   <li>hash the content; an already ingested document with the same hash is skipped
 *   <li>a changed document is marked stale and its chunks and vectors are dropped
 *   <li>extract, chunk and record the chunks (with their text)
 *   <li>embed every chunk not yet embedded for the adapter's model and version
 *   <li>upsert the vectors with their payload and record the embeddings
 * </ol>
 *
 * A failing file is marked {@code failed} and the batch moves on. The job ends {@code failed} only
 * when every file failed.
 */
public class IngestionService {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(IngestionService.class);

  static final int VECTOR_BATCH_SIZE = 100;

  /** Payload keys written by the pipeline; document metadata cannot override them. */
  private static final Set<String> RESERVED_PAYLOAD_KEYS =
      Set.of("chunk_id", "doc_id", "path", "scope", "text", "chunk_index", "risk_level");

  private final ManifestStore manifest;
  private final ExtractorRegistry extractors;
  private final Chunker chunker;
  private final EmbeddingAdapter embedder;
  private final VectorIndexClient vectorIndex;
  private final HybridRetriever retriever;

  private record FileOutcome(boolean skipped, int chunks, int embeddings) {
    static final FileOutcome SKIPPED = new FileOutcome(true, 0, 0);
  }

  public IngestionService(
      ManifestStore manifest,
      ExtractorRegistry extractors,
      Chunker chunker,
      EmbeddingAdapter embedder,
      VectorIndexClient vectorIndex,
      HybridRetriever retriever) {
    this.manifest = Objects.requireNonNull(manifest, "manifest");
    this.extractors = Objects.requireNonNull(extractors, "extractors");
    this.chunker = Objects.requireNonNull(chunker, "chunker");
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex");
    this.retriever = Objects.requireNonNull(retriever, "retriever");
  }

  public IngestReport ingest(Collection<Path> files, String scope) {
    return ingest(files, scope, Map.of());
  }

  /**
   * Ingests {@code files} into {@code scope} as a single job. {@code metadata} is stored on every
   * document and copied into each vector payload; a {@code risk_level} entry sets the governance
   * risk of the chunks.
   */
  public IngestReport ingest(Collection<Path> files, String scope, Map<String, Object> metadata) {
    if (scope == null || scope.isBlank()) {
      throw new ValidationException("Scope cannot be empty");
    }
    Map<String, Object> docMetadata = metadata == null ? Map.of() : metadata;
    String jobId = manifest.startIngestJob();
    log.info("Ingest job {} started: files={}, scope={}", jobId, files.size(), scope);

    int processed = 0;
    int skipped = 0;
    int chunks = 0;
    int embeddings = 0;
    List<String> errors = new ArrayList<>();
    try {
      for (Path file : files) {
        Path path = file.toAbsolutePath().normalize();
        try {
          FileOutcome outcome = ingestFile(path, scope, docMetadata);
          if (outcome.skipped()) skipped++;
          chunks += outcome.chunks();
          embeddings += outcome.embeddings();
        } catch (RuntimeException e) {
          errors.add(path + ": " + ExceptionUtil.rootMessage(e));
          log.error("Failed to ingest {}: {}", path, ExceptionUtil.toErrorDetails(e), e);
        }
        processed++;
        manifest.updateIngestJob(jobId, processed, chunks, embeddings);
      }
    } catch (RuntimeException e) {
      log.error("Ingest job {} aborted", jobId, e);
      manifest.completeIngestJob(jobId, JobStatus.FAILED, e.getMessage());
      retriever.invalidateLexicalIndex();
      throw e;
    }

    JobStatus status =
        !errors.isEmpty() && errors.size() == processed ? JobStatus.FAILED : JobStatus.COMPLETED;
    String errorMessage =
        errors.isEmpty()
            ? null
            : "%d of %d documents failed: %s"
                .formatted(errors.size(), processed, String.join("; ", errors));
    manifest.completeIngestJob(jobId, status, errorMessage);
    retriever.invalidateLexicalIndex();

    IngestReport report =
        new IngestReport(
            jobId, status, processed, skipped, errors.size(), chunks, embeddings, errors);
    log.info(
        "Ingest job {} {}: ingested={}, skipped={}, failed={}, chunks={}, embeddings={}",
        jobId,
        status.dbValue(),
        report.documentsIngested(),
        skipped,
        errors.size(),
        chunks,
        embeddings);
    return report;
  }

  /** Ingests every regular file under {@code root} that has a registered extractor. */
  public IngestReport ingestDirectory(Path root, String scope, Map<String, Object> metadata) {
    if (!Files.isDirectory(root)) {
      throw new ValidationException("Not a directory: " + root);
    }
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(p -> extractors.supports(extractors.detectMimeType(p)))
              .sorted()
              .toList();
    } catch (IOException e) {
      throw new OneRagException(OneRagErrorCode.IO_ERROR, "Failed to list " + root, e);
    }
    log.debug("Found {} ingestible files under {}", files.size(), root);
    return ingest(files, scope, metadata);
  }

  /** Removes a document's vectors and its manifest rows. */
  public boolean deleteDocument(String docId) {
    Optional<DocumentRecord> doc = manifest.getDocument(docId);
    if (doc.isEmpty()) {
      return false;
    }
    int vectors = vectorIndex.deleteByDoc(docId);
    boolean deleted = manifest.deleteDocument(docId);
    retriever.invalidateLexicalIndex();
    log.info("Deleted document {} ({}), vectors removed={}", docId, doc.get().path(), vectors);
    return deleted;
  }

  private FileOutcome ingestFile(Path path, String scope, Map<String, Object> metadata) {
    String mimeType = extractors.detectMimeType(path);
    DocumentRef ref = describe(path, mimeType, scope, metadata);

    Optional<DocumentRecord> existing = manifest.getDocumentByPath(ref.path());
    String docId;
    boolean resume = false;
    if (existing.isPresent()) {
      DocumentRecord doc = existing.get();
      docId = doc.docId();
      boolean sameContent = doc.fileHash().equals(ref.fileHash()) && doc.scope().equals(scope);
      if (sameContent && doc.status() == DocumentStatus.INGESTED) {
        log.debug("Unchanged, skipping: {}", ref.path());
        return FileOutcome.SKIPPED;
      }
      if (sameContent && doc.status() == DocumentStatus.PENDING) {
        resume = true;
      } else {
        if (doc.status() == DocumentStatus.INGESTED) {
          manifest.markDocumentStale(docId);
          log.info("Source changed, re-ingesting: {}", ref.path());
        }
        vectorIndex.deleteByDoc(docId);
        manifest.deleteChunksForDocument(docId);
        manifest.updateDocumentSource(docId, ref);
      }
    } else {
      docId = manifest.addDocument(ref);
    }

    try {
      int created = 0;
      List<ChunkRecord> records = resume ? manifest.listChunksForDocument(docId) : List.of();
      if (records.isEmpty()) {
        created = recordChunks(docId, path, mimeType, scope);
        records = manifest.listChunksForDocument(docId);
      } else {
        log.info("Resuming {} with {} recorded chunks", ref.path(), records.size());
      }
      int embedded = embedAndIndex(ref, docId, records, metadata);
      manifest.updateDocumentStatus(docId, DocumentStatus.INGESTED);
      log.info("Ingested {}: chunks={}, embeddings={}", ref.path(), created, embedded);
      return new FileOutcome(false, created, embedded);
    } catch (RuntimeException e) {
      manifest.updateDocumentStatus(docId, DocumentStatus.FAILED);
      throw e;
    }
  }

  private DocumentRef describe(
      Path path, String mimeType, String scope, Map<String, Object> metadata) {
    try {
      byte[] content = Files.readAllBytes(path);
      Instant mtime = Files.getLastModifiedTime(path).toInstant();
      return new DocumentRef(
          path.toString(), mimeType, scope, mtime, StringUtility.sha256Hex(content), metadata);
    } catch (IOException e) {
      throw new ExtractionException(
          "Cannot read file: " + e.getMessage(), path.toString(), mimeType, e);
    }
  }

  private int recordChunks(String docId, Path path, String mimeType, String scope) {
    ExtractedText extracted = extractors.extract(path, mimeType);
    List<Chunk> chunks = chunker.chunk(extracted.text(), mimeType);
    List<ChunkRef> refs = new ArrayList<>(chunks.size());
    for (Chunk c : chunks) {
      refs.add(
          new ChunkRef(
              docId,
              c.index(),
              c.offsetStart(),
              c.offsetEnd(),
              c.chunkHash(),
              c.tokenCount(),
              extracted.extractor(),
              extracted.extractorVersion(),
              scope,
              c.text()));
    }
    return manifest.addChunks(refs).size();
  }

  private int embedAndIndex(
      DocumentRef doc, String docId, List<ChunkRecord> records, Map<String, Object> metadata) {
    String model = embedder.model();
    String version = embedder.modelVersion();
    List<ChunkRecord> pending =
        records.stream()
            .filter(r -> !manifest.hasEmbedding(r.chunkId(), model, version))
            .toList();
    if (pending.isEmpty()) {
      return 0;
    }

    List<EmbeddingResult> vectors =
        embedder.embedDocuments(pending.stream().map(r -> nullToEmpty(r.text())).toList());
    String riskLevel = RiskLevel.fromValue(metadata.get("risk_level")).value();
    List<VectorPoint> points = new ArrayList<>(pending.size());
    for (int i = 0; i < pending.size(); i++) {
      ChunkRecord r = pending.get(i);
      Map<String, Object> payload = new LinkedHashMap<>();
      metadata.forEach(
          (k, v) -> {
            if (!RESERVED_PAYLOAD_KEYS.contains(k)) payload.put(k, v);
          });
      payload.put("chunk_id", r.chunkId());
      payload.put("doc_id", docId);
      payload.put("path", doc.path());
      payload.put("scope", r.scope());
      payload.put("text", nullToEmpty(r.text()));
      payload.put("chunk_index", r.chunkIndex());
      payload.put("risk_level", riskLevel);
      points.add(new VectorPoint(r.chunkId(), vectors.get(i).vector(), payload));
    }
    vectorIndex.upsertBatch(points, VECTOR_BATCH_SIZE);

    for (ChunkRecord r : pending) {
      String chunkId = r.chunkId();
      manifest.addEmbedding(new EmbeddingRef(chunkId, model, version, chunkId));
    }
    return pending.size();
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
