package com.gentoro.onerag.manifest;

import java.util.List;

/** Ordered schema migrations. Each version is applied once and recorded in schema_version. */
final class ManifestSchema {
  private ManifestSchema() {}

  record Migration(int version, String description, List<String> statements) {}

  static final String CREATE_SCHEMA_VERSION =
      """
      CREATE TABLE IF NOT EXISTS schema_version (
          version INTEGER PRIMARY KEY,
          applied_at TEXT NOT NULL
      )""";

  static final List<Migration> MIGRATIONS =
      List.of(
          new Migration(
              1,
              "initial tables and indexes",
              List.of(
                  """
                  CREATE TABLE documents (
                      doc_id TEXT PRIMARY KEY,
                      path TEXT NOT NULL UNIQUE,
                      mime_type TEXT NOT NULL,
                      scope TEXT NOT NULL,
                      source_mtime TEXT NOT NULL,
                      file_hash TEXT NOT NULL,
                      metadata TEXT,
                      ingested_at TEXT NOT NULL,
                      status TEXT NOT NULL DEFAULT 'pending'
                          CHECK (status IN ('pending', 'ingested', 'failed', 'stale'))
                  )""",
                  """
                  CREATE TABLE chunks (
                      chunk_id TEXT PRIMARY KEY,
                      doc_id TEXT NOT NULL REFERENCES documents(doc_id) ON DELETE CASCADE,
                      chunk_index INTEGER NOT NULL CHECK (chunk_index >= 0),
                      offset_start INTEGER NOT NULL,
                      offset_end INTEGER NOT NULL,
                      chunk_hash TEXT NOT NULL,
                      token_count INTEGER NOT NULL,
                      extractor TEXT NOT NULL,
                      extractor_version TEXT NOT NULL,
                      scope TEXT NOT NULL,
                      created_at TEXT NOT NULL,
                      UNIQUE (doc_id, chunk_index)
                  )""",
                  """
                  CREATE TABLE embeddings (
                      embedding_id TEXT PRIMARY KEY,
                      chunk_id TEXT NOT NULL REFERENCES chunks(chunk_id) ON DELETE CASCADE,
                      embedding_model TEXT NOT NULL,
                      embedding_model_version TEXT NOT NULL,
                      embedded_at TEXT NOT NULL,
                      vector_ref TEXT NOT NULL,
                      UNIQUE (chunk_id, embedding_model, embedding_model_version)
                  )""",
                  """
                  CREATE TABLE ingest_jobs (
                      job_id TEXT PRIMARY KEY,
                      started_at TEXT NOT NULL,
                      completed_at TEXT,
                      status TEXT NOT NULL DEFAULT 'running'
                          CHECK (status IN ('running', 'completed', 'failed')),
                      docs_processed INTEGER NOT NULL DEFAULT 0,
                      chunks_created INTEGER NOT NULL DEFAULT 0,
                      embeddings_created INTEGER NOT NULL DEFAULT 0,
                      error_message TEXT
                  )""",
                  "CREATE INDEX idx_documents_scope ON documents(scope)",
                  "CREATE INDEX idx_documents_status ON documents(status)",
                  "CREATE INDEX idx_chunks_doc_id ON chunks(doc_id)",
                  "CREATE INDEX idx_chunks_scope ON chunks(scope)",
                  "CREATE INDEX idx_chunks_hash ON chunks(chunk_hash)",
                  "CREATE INDEX idx_embeddings_chunk_id ON embeddings(chunk_id)",
                  "CREATE INDEX idx_embeddings_model"
                      + " ON embeddings(embedding_model, embedding_model_version)",
                  "CREATE INDEX idx_ingest_jobs_status ON ingest_jobs(status)")),
          new Migration(
              2,
              "chunk text for lexical indexing",
              List.of("ALTER TABLE chunks ADD COLUMN text TEXT")));

  static int latestVersion() {
    return MIGRATIONS.get(MIGRATIONS.size() - 1).version();
  }
}
