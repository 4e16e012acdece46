package com.gentoro.onerag.manifest;

import com.gentoro.onerag.exception.ManifestException;
import com.gentoro.onerag.exception.ManifestIntegrityException;
import com.gentoro.onerag.exception.NotFoundException;
import com.gentoro.onerag.exception.StateException;
import com.gentoro.onerag.exception.ValidationException;
import com.gentoro.onerag.lexical.CorpusChunk;
import com.gentoro.onerag.lexical.LexicalCorpus;
import com.gentoro.onerag.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.commons.configuration2.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteException;

/**
 * SQLite-backed system of record for documents, chunks, embeddings and ingest jobs.
 *
 * <p>Every mutating call runs in one transaction: commit on success, rollback on any exception.
 * File databases open a connection per call (WAL journal). The {@code :memory:} database keeps one
 * connection for the life of the store, serialized by a lock, since a second connection would see
 * an empty database.
 *
 * <p>Uniqueness and foreign-key violations surface as {@link ManifestIntegrityException}.
 */
public class ManifestStore implements LexicalCorpus, AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(ManifestStore.class);

  public static final String IN_MEMORY = ":memory:";

  /** Primary SQLite result code for constraint violations. */
  private static final int SQLITE_CONSTRAINT = 19;

  private final String databasePath;
  private final String url;
  private final SQLiteConfig sqliteConfig;
  private final ReentrantLock persistentLock = new ReentrantLock();
  private Connection persistent;

  @FunctionalInterface
  private interface SqlWork<T> {
    T run(Connection connection) throws SQLException;
  }

  public ManifestStore(String databasePath) {
    if (databasePath == null || databasePath.isBlank()) {
      throw new ValidationException("Manifest database path must not be blank");
    }
    this.databasePath = databasePath;
    this.url = "jdbc:sqlite:" + databasePath;
    this.sqliteConfig = new SQLiteConfig();
    this.sqliteConfig.enforceForeignKeys(true);

    if (IN_MEMORY.equals(databasePath)) {
      try {
        this.persistent = DriverManager.getConnection(url, sqliteConfig.toProperties());
      } catch (SQLException e) {
        throw new ManifestException("Failed to open in-memory manifest database", e);
      }
    } else {
      this.sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
      this.sqliteConfig.setBusyTimeout(5000);
      createParentDirectory(Path.of(databasePath));
    }
    migrate();
    log.info("Manifest store initialized at {}", databasePath);
  }

  /** Reads {@code database} from the {@code manifest} configuration subset. */
  public static ManifestStore fromConfiguration(Configuration manifestConfig) {
    return new ManifestStore(manifestConfig.getString("database", IN_MEMORY));
  }

  public String databasePath() {
    return databasePath;
  }

  public int schemaVersion() {
    return transaction(
        "schemaVersion",
        c -> {
          try (Statement st = c.createStatement();
              ResultSet rs = st.executeQuery("SELECT MAX(version) FROM schema_version")) {
            return rs.next() ? rs.getInt(1) : 0;
          }
        });
  }

  // ---------------------------------------------------------------------------
  // Documents

  /**
   * Registers a document with status {@code pending}.
   *
   * @return the generated document id
   * @throws ManifestIntegrityException if the path is already registered
   */
  public String addDocument(DocumentRef doc) {
    String docId = UUID.randomUUID().toString();
    transaction(
        "addDocument(" + doc.path() + ")",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "INSERT INTO documents (doc_id, path, mime_type, scope, source_mtime, file_hash,"
                      + " metadata, ingested_at, status) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, docId);
            ps.setString(2, doc.path());
            ps.setString(3, doc.mimeType());
            ps.setString(4, doc.scope());
            ps.setString(5, doc.sourceMtime().toString());
            ps.setString(6, doc.fileHash());
            ps.setString(7, metadataJson(doc.metadata()));
            ps.setString(8, Instant.now().toString());
            ps.setString(9, DocumentStatus.PENDING.dbValue());
            return ps.executeUpdate();
          }
        });
    log.debug("Added document {}: {}", docId, doc.path());
    return docId;
  }

  public Optional<DocumentRecord> getDocument(String docId) {
    return transaction(
        "getDocument",
        c -> queryOne(c, "SELECT * FROM documents WHERE doc_id = ?", docId, this::toDocument));
  }

  public Optional<DocumentRecord> getDocumentByPath(String path) {
    return transaction(
        "getDocumentByPath",
        c -> queryOne(c, "SELECT * FROM documents WHERE path = ?", path, this::toDocument));
  }

  /**
   * Sets the document status. Moving to {@code ingested} also stamps {@code ingested_at}.
   *
   * @return false when the document does not exist
   */
  public boolean updateDocumentStatus(String docId, DocumentStatus status) {
    int updated =
        transaction(
            "updateDocumentStatus",
            c -> {
              String sql =
                  status == DocumentStatus.INGESTED
                      ? "UPDATE documents SET status = ?, ingested_at = ? WHERE doc_id = ?"
                      : "UPDATE documents SET status = ? WHERE doc_id = ?";
              try (PreparedStatement ps = c.prepareStatement(sql)) {
                int i = 1;
                ps.setString(i++, status.dbValue());
                if (status == DocumentStatus.INGESTED) {
                  ps.setString(i++, Instant.now().toString());
                }
                ps.setString(i, docId);
                return ps.executeUpdate();
              }
            });
    if (updated == 0) {
      log.warn("Document not found for status update: {}", docId);
      return false;
    }
    log.debug("Updated document {} status to {}", docId, status.dbValue());
    return true;
  }

  public boolean markDocumentStale(String docId) {
    return updateDocumentStatus(docId, DocumentStatus.STALE);
  }

  /** Records new source attributes for a changed document and resets it to {@code pending}. */
  public void updateDocumentSource(String docId, DocumentRef doc) {
    int updated =
        transaction(
            "updateDocumentSource",
            c -> {
              try (PreparedStatement ps =
                  c.prepareStatement(
                      "UPDATE documents SET mime_type = ?, scope = ?, source_mtime = ?,"
                          + " file_hash = ?, metadata = ?, status = ? WHERE doc_id = ?")) {
                ps.setString(1, doc.mimeType());
                ps.setString(2, doc.scope());
                ps.setString(3, doc.sourceMtime().toString());
                ps.setString(4, doc.fileHash());
                ps.setString(5, metadataJson(doc.metadata()));
                ps.setString(6, DocumentStatus.PENDING.dbValue());
                ps.setString(7, docId);
                return ps.executeUpdate();
              }
            });
    if (updated == 0) {
      throw new NotFoundException("Document not found: " + docId);
    }
  }

  public List<DocumentRecord> listDocuments() {
    return listDocuments(null, null);
  }

  /** Lists documents, newest first, optionally filtered by scope and/or status. */
  public List<DocumentRecord> listDocuments(String scope, DocumentStatus status) {
    StringBuilder sql = new StringBuilder("SELECT * FROM documents WHERE 1=1");
    List<String> params = new ArrayList<>();
    if (scope != null) {
      sql.append(" AND scope = ?");
      params.add(scope);
    }
    if (status != null) {
      sql.append(" AND status = ?");
      params.add(status.dbValue());
    }
    sql.append(" ORDER BY ingested_at DESC, path");
    return transaction(
        "listDocuments",
        c -> {
          try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
              ps.setString(i + 1, params.get(i));
            }
            return collect(ps, this::toDocument);
          }
        });
  }

  public List<DocumentRecord> getStaleDocuments() {
    return listDocuments(null, DocumentStatus.STALE);
  }

  /** Deletes a document; chunks and embeddings go with it. */
  public boolean deleteDocument(String docId) {
    int deleted =
        transaction(
            "deleteDocument", c -> update(c, "DELETE FROM documents WHERE doc_id = ?", docId));
    if (deleted > 0) {
      log.info("Deleted document {} (cascaded to chunks and embeddings)", docId);
      return true;
    }
    log.warn("Document not found for deletion: {}", docId);
    return false;
  }

  // ---------------------------------------------------------------------------
  // Chunks

  public String addChunk(ChunkRef chunk) {
    return addChunks(List.of(chunk)).get(0);
  }

  /** Inserts all chunks in one transaction. */
  public List<String> addChunks(List<ChunkRef> chunks) {
    List<String> ids = new ArrayList<>(chunks.size());
    if (chunks.isEmpty()) return ids;
    String createdAt = Instant.now().toString();
    transaction(
        "addChunks",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "INSERT INTO chunks (chunk_id, doc_id, chunk_index, offset_start, offset_end,"
                      + " chunk_hash, token_count, extractor, extractor_version, scope,"
                      + " created_at, text) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            for (ChunkRef chunk : chunks) {
              String chunkId = UUID.randomUUID().toString();
              ps.setString(1, chunkId);
              ps.setString(2, chunk.docId());
              ps.setInt(3, chunk.chunkIndex());
              ps.setLong(4, chunk.offsetStart());
              ps.setLong(5, chunk.offsetEnd());
              ps.setString(6, chunk.chunkHash());
              ps.setInt(7, chunk.tokenCount());
              ps.setString(8, chunk.extractor());
              ps.setString(9, chunk.extractorVersion());
              ps.setString(10, chunk.scope());
              ps.setString(11, createdAt);
              ps.setString(12, chunk.text());
              ps.executeUpdate();
              ids.add(chunkId);
            }
          }
          return ids.size();
        });
    log.debug("Added {} chunks for document {}", ids.size(), chunks.get(0).docId());
    return ids;
  }

  public List<ChunkRecord> listChunksForDocument(String docId) {
    return transaction(
        "listChunksForDocument",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement("SELECT * FROM chunks WHERE doc_id = ? ORDER BY chunk_index")) {
            ps.setString(1, docId);
            return collect(ps, this::toChunk);
          }
        });
  }

  public Optional<ChunkRecord> getChunk(String chunkId) {
    return transaction(
        "getChunk",
        c -> queryOne(c, "SELECT * FROM chunks WHERE chunk_id = ?", chunkId, this::toChunk));
  }

  /** Deletes a document's chunks; their embeddings cascade. */
  public int deleteChunksForDocument(String docId) {
    int deleted =
        transaction(
            "deleteChunksForDocument",
            c -> update(c, "DELETE FROM chunks WHERE doc_id = ?", docId));
    if (deleted > 0) {
      log.debug("Deleted {} chunks for document {}", deleted, docId);
    }
    return deleted;
  }

  // ---------------------------------------------------------------------------
  // Embeddings

  /**
   * @throws ManifestIntegrityException if the chunk is unknown or already has an embedding for the
   *     same model and version
   */
  public String addEmbedding(EmbeddingRef embedding) {
    String embeddingId = UUID.randomUUID().toString();
    transaction(
        "addEmbedding(" + embedding.chunkId() + ")",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "INSERT INTO embeddings (embedding_id, chunk_id, embedding_model,"
                      + " embedding_model_version, embedded_at, vector_ref)"
                      + " VALUES (?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, embeddingId);
            ps.setString(2, embedding.chunkId());
            ps.setString(3, embedding.model());
            ps.setString(4, embedding.modelVersion());
            ps.setString(5, Instant.now().toString());
            ps.setString(6, embedding.vectorRef());
            return ps.executeUpdate();
          }
        });
    log.debug("Added embedding {} for chunk {}", embeddingId, embedding.chunkId());
    return embeddingId;
  }

  /** Most recent embedding of a chunk, whatever the model. */
  public Optional<EmbeddingRecord> getEmbeddingForChunk(String chunkId) {
    return transaction(
        "getEmbeddingForChunk",
        c ->
            queryOne(
                c,
                "SELECT * FROM embeddings WHERE chunk_id = ? ORDER BY embedded_at DESC LIMIT 1",
                chunkId,
                this::toEmbedding));
  }

  public boolean hasEmbedding(String chunkId, String model, String modelVersion) {
    return transaction(
        "hasEmbedding",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "SELECT 1 FROM embeddings WHERE chunk_id = ? AND embedding_model = ?"
                      + " AND embedding_model_version = ?")) {
            ps.setString(1, chunkId);
            ps.setString(2, model);
            ps.setString(3, modelVersion);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next();
            }
          }
        });
  }

  public int deleteEmbeddingsForDocument(String docId) {
    int deleted =
        transaction(
            "deleteEmbeddingsForDocument",
            c ->
                update(
                    c,
                    "DELETE FROM embeddings WHERE chunk_id IN"
                        + " (SELECT chunk_id FROM chunks WHERE doc_id = ?)",
                    docId));
    if (deleted > 0) {
      log.debug("Deleted {} embeddings for document {}", deleted, docId);
    }
    return deleted;
  }

  // ---------------------------------------------------------------------------
  // Ingest jobs

  public String startIngestJob() {
    String jobId = UUID.randomUUID().toString();
    transaction(
        "startIngestJob",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "INSERT INTO ingest_jobs (job_id, started_at, status, docs_processed,"
                      + " chunks_created, embeddings_created) VALUES (?, ?, ?, 0, 0, 0)")) {
            ps.setString(1, jobId);
            ps.setString(2, Instant.now().toString());
            ps.setString(3, JobStatus.RUNNING.dbValue());
            return ps.executeUpdate();
          }
        });
    log.info("Started ingest job {}", jobId);
    return jobId;
  }

  /**
   * Sets the progress counters of a running job.
   *
   * @throws NotFoundException if the job does not exist
   * @throws StateException if the job is no longer running
   * @throws ValidationException if any counter would decrease
   */
  public void updateIngestJob(String jobId, int docs, int chunks, int embeddings) {
    transaction(
        "updateIngestJob",
        c -> {
          IngestJob job = requireJob(c, jobId);
          if (job.status().isTerminal()) {
            throw new StateException(
                "Ingest job %s is %s; progress can no longer change"
                    .formatted(jobId, job.status().dbValue()));
          }
          if (docs < job.docsProcessed()
              || chunks < job.chunksCreated()
              || embeddings < job.embeddingsCreated()) {
            throw new ValidationException(
                ("Ingest job counters must not decrease:"
                        + " docs %d->%d, chunks %d->%d, embeddings %d->%d")
                    .formatted(
                        job.docsProcessed(), docs,
                        job.chunksCreated(), chunks,
                        job.embeddingsCreated(), embeddings));
          }
          try (PreparedStatement ps =
              c.prepareStatement(
                  "UPDATE ingest_jobs SET docs_processed = ?, chunks_created = ?,"
                      + " embeddings_created = ? WHERE job_id = ?")) {
            ps.setInt(1, docs);
            ps.setInt(2, chunks);
            ps.setInt(3, embeddings);
            ps.setString(4, jobId);
            return ps.executeUpdate();
          }
        });
  }

  /** Moves a running job to {@code completed} or {@code failed}. */
  public void completeIngestJob(String jobId, JobStatus status, String errorMessage) {
    if (!status.isTerminal()) {
      throw new ValidationException("Invalid completion status: " + status.dbValue());
    }
    transaction(
        "completeIngestJob",
        c -> {
          IngestJob job = requireJob(c, jobId);
          if (job.status().isTerminal()) {
            throw new StateException("Ingest job %s already %s".formatted(jobId, job.status()));
          }
          try (PreparedStatement ps =
              c.prepareStatement(
                  "UPDATE ingest_jobs SET completed_at = ?, status = ?, error_message = ?"
                      + " WHERE job_id = ?")) {
            ps.setString(1, Instant.now().toString());
            ps.setString(2, status.dbValue());
            ps.setString(3, errorMessage);
            ps.setString(4, jobId);
            return ps.executeUpdate();
          }
        });
    log.info("Completed ingest job {} with status {}", jobId, status.dbValue());
  }

  public Optional<IngestJob> getIngestJob(String jobId) {
    return transaction(
        "getIngestJob",
        c -> queryOne(c, "SELECT * FROM ingest_jobs WHERE job_id = ?", jobId, this::toJob));
  }

  // ---------------------------------------------------------------------------
  // Queries

  public ManifestStatistics statistics() {
    return transaction(
        "statistics",
        c -> {
          Map<String, Long> byStatus =
              groupCount(c, "SELECT status, COUNT(*) FROM documents GROUP BY status");
          Map<String, Long> byScope =
              groupCount(c, "SELECT scope, COUNT(*) FROM documents GROUP BY scope");
          Map<String, Long> jobs =
              groupCount(c, "SELECT status, COUNT(*) FROM ingest_jobs GROUP BY status");
          return new ManifestStatistics(
              sum(byStatus),
              byStatus,
              byScope,
              count(c, "SELECT COUNT(*) FROM chunks"),
              count(c, "SELECT COUNT(*) FROM embeddings"),
              sum(jobs),
              jobs);
        });
  }

  /**
   * Chunk texts of every non-failed document in {@code scope}, in path and chunk order. Metadata is
   * the owning document's metadata plus {@code chunk_index}.
   */
  @Override
  public List<CorpusChunk> listChunkTextsByScope(String scope) {
    return transaction(
        "listChunkTextsByScope",
        c -> {
          try (PreparedStatement ps =
              c.prepareStatement(
                  "SELECT c.chunk_id, c.doc_id, c.chunk_index, c.scope, c.text, d.path, d.metadata"
                      + " FROM chunks c JOIN documents d ON d.doc_id = c.doc_id"
                      + " WHERE c.scope = ? AND c.text IS NOT NULL AND d.status <> ?"
                      + " ORDER BY d.path, c.chunk_index")) {
            ps.setString(1, scope);
            ps.setString(2, DocumentStatus.FAILED.dbValue());
            return collect(
                ps,
                rs -> {
                  Map<String, Object> metadata =
                      new HashMap<>(parseMetadata(rs.getString("metadata")));
                  metadata.put("chunk_index", rs.getInt("chunk_index"));
                  return new CorpusChunk(
                      rs.getString("chunk_id"),
                      rs.getString("doc_id"),
                      rs.getString("path"),
                      rs.getString("scope"),
                      rs.getString("text"),
                      metadata);
                });
          }
        });
  }

  /** Reclaims free pages. Runs outside a transaction, as SQLite requires. */
  public void vacuum() {
    SqlWork<Void> work =
        c -> {
          try (Statement st = c.createStatement()) {
            st.execute("VACUUM");
          }
          return null;
        };
    if (persistent != null) {
      persistentLock.lock();
      try {
        ensureOpen();
        persistent.setAutoCommit(true);
        work.run(persistent);
      } catch (SQLException e) {
        throw translate("vacuum", e);
      } finally {
        persistentLock.unlock();
      }
    } else {
      try (Connection c = open()) {
        work.run(c);
      } catch (SQLException e) {
        throw translate("vacuum", e);
      }
    }
    log.info("Manifest database vacuumed");
  }

  @Override
  public void close() {
    persistentLock.lock();
    try {
      if (persistent != null) {
        persistent.close();
        persistent = null;
      }
    } catch (SQLException e) {
      throw new ManifestException("Failed to close manifest database", e);
    } finally {
      persistentLock.unlock();
    }
  }

  // ---------------------------------------------------------------------------
  // Plumbing

  private void migrate() {
    transaction(
        "migrate",
        c -> {
          try (Statement st = c.createStatement()) {
            st.execute(ManifestSchema.CREATE_SCHEMA_VERSION);
            int current;
            try (ResultSet rs = st.executeQuery("SELECT MAX(version) FROM schema_version")) {
              current = rs.next() ? rs.getInt(1) : 0;
            }
            for (ManifestSchema.Migration m : ManifestSchema.MIGRATIONS) {
              if (m.version() <= current) continue;
              for (String sql : m.statements()) {
                st.execute(sql);
              }
              try (PreparedStatement ps =
                  c.prepareStatement(
                      "INSERT INTO schema_version (version, applied_at) VALUES (?, ?)")) {
                ps.setInt(1, m.version());
                ps.setString(2, Instant.now().toString());
                ps.executeUpdate();
              }
              log.info("Applied manifest schema v{}: {}", m.version(), m.description());
            }
          }
          return null;
        });
  }

  private <T> T transaction(String operation, SqlWork<T> work) {
    if (IN_MEMORY.equals(databasePath)) {
      persistentLock.lock();
      try {
        ensureOpen();
        return inTransaction(persistent, operation, work);
      } finally {
        persistentLock.unlock();
      }
    }
    try (Connection c = open()) {
      return inTransaction(c, operation, work);
    } catch (SQLException e) {
      throw translate(operation, e);
    }
  }

  private static <T> T inTransaction(Connection c, String operation, SqlWork<T> work) {
    try {
      c.setAutoCommit(false);
      T result = work.run(c);
      c.commit();
      return result;
    } catch (SQLException e) {
      rollback(c, e);
      throw translate(operation, e);
    } catch (RuntimeException e) {
      rollback(c, e);
      throw e;
    }
  }

  private static void rollback(Connection c, Exception failure) {
    try {
      c.rollback();
    } catch (SQLException rollbackFailure) {
      failure.addSuppressed(rollbackFailure);
    }
  }

  private Connection open() throws SQLException {
    return DriverManager.getConnection(url, sqliteConfig.toProperties());
  }

  private void ensureOpen() {
    if (persistent == null) {
      throw new StateException("Manifest store is closed");
    }
  }

  static RuntimeException translate(String operation, SQLException e) {
    if (isConstraintViolation(e)) {
      return new ManifestIntegrityException(
          "Manifest integrity violation in " + operation + ": " + e.getMessage(),
          Map.of("operation", operation),
          e);
    }
    return new ManifestException("Manifest operation failed: " + operation, e);
  }

  static boolean isConstraintViolation(SQLException e) {
    if (e instanceof SQLiteException sqlite
        && sqlite.getResultCode() != null
        && sqlite.getResultCode().name().startsWith("SQLITE_CONSTRAINT")) {
      return true;
    }
    return (e.getErrorCode() & 0xff) == SQLITE_CONSTRAINT;
  }

  private static void createParentDirectory(Path path) {
    Path parent = path.toAbsolutePath().getParent();
    if (parent == null) return;
    try {
      Files.createDirectories(parent);
    } catch (java.io.IOException e) {
      throw new ManifestException("Cannot create manifest directory " + parent, e);
    }
  }

  @FunctionalInterface
  private interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private static <T> Optional<T> queryOne(
      Connection c, String sql, String param, RowMapper<T> mapper) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, param);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
      }
    }
  }

  private static <T> List<T> collect(PreparedStatement ps, RowMapper<T> mapper)
      throws SQLException {
    List<T> out = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        out.add(mapper.map(rs));
      }
    }
    return out;
  }

  private static int update(Connection c, String sql, String param) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, param);
      return ps.executeUpdate();
    }
  }

  private static long count(Connection c, String sql) throws SQLException {
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  private static Map<String, Long> groupCount(Connection c, String sql) throws SQLException {
    Map<String, Long> out = new TreeMap<>();
    try (Statement st = c.createStatement();
        ResultSet rs = st.executeQuery(sql)) {
      while (rs.next()) {
        out.put(rs.getString(1), rs.getLong(2));
      }
    }
    return out;
  }

  private static long sum(Map<String, Long> counts) {
    return counts.values().stream().mapToLong(Long::longValue).sum();
  }

  private IngestJob requireJob(Connection c, String jobId) throws SQLException {
    return queryOne(c, "SELECT * FROM ingest_jobs WHERE job_id = ?", jobId, this::toJob)
        .orElseThrow(() -> new NotFoundException("Ingest job not found: " + jobId));
  }

  private static String metadataJson(Map<String, Object> metadata) {
    return metadata == null || metadata.isEmpty() ? null : JacksonUtility.toJson(metadata);
  }

  private static Map<String, Object> parseMetadata(String json) {
    return json == null ? Map.of() : JacksonUtility.toMap(json);
  }

  private static Instant instant(String value) {
    return value == null ? null : Instant.parse(value);
  }

  private DocumentRecord toDocument(ResultSet rs) throws SQLException {
    return new DocumentRecord(
        rs.getString("doc_id"),
        rs.getString("path"),
        rs.getString("mime_type"),
        rs.getString("scope"),
        instant(rs.getString("source_mtime")),
        rs.getString("file_hash"),
        parseMetadata(rs.getString("metadata")),
        instant(rs.getString("ingested_at")),
        DocumentStatus.fromDb(rs.getString("status")));
  }

  private ChunkRecord toChunk(ResultSet rs) throws SQLException {
    return new ChunkRecord(
        rs.getString("chunk_id"),
        rs.getString("doc_id"),
        rs.getInt("chunk_index"),
        rs.getLong("offset_start"),
        rs.getLong("offset_end"),
        rs.getString("chunk_hash"),
        rs.getInt("token_count"),
        rs.getString("extractor"),
        rs.getString("extractor_version"),
        rs.getString("scope"),
        instant(rs.getString("created_at")),
        rs.getString("text"));
  }

  private EmbeddingRecord toEmbedding(ResultSet rs) throws SQLException {
    return new EmbeddingRecord(
        rs.getString("embedding_id"),
        rs.getString("chunk_id"),
        rs.getString("embedding_model"),
        rs.getString("embedding_model_version"),
        instant(rs.getString("embedded_at")),
        rs.getString("vector_ref"));
  }

  private IngestJob toJob(ResultSet rs) throws SQLException {
    return new IngestJob(
        rs.getString("job_id"),
        instant(rs.getString("started_at")),
        instant(rs.getString("completed_at")),
        JobStatus.fromDb(rs.getString("status")),
        rs.getInt("docs_processed"),
        rs.getInt("chunks_created"),
        rs.getInt("embeddings_created"),
        rs.getString("error_message"));
  }
}
