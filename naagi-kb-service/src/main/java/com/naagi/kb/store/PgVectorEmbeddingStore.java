package com.naagi.kb.store;

import com.naagi.kb.embed.store.EmbeddingRecord;
import com.naagi.kb.embed.store.EmbeddingStore;
import com.naagi.kb.embed.store.StoredChunk;
import com.pgvector.PGvector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Embedding store on PostgreSQL with the pgvector extension. Every write is an
 * {@code INSERT ... ON CONFLICT DO UPDATE}, keyed on {@code doc_id}, {@code chunk_id}
 * and {@code (chunk_id, provider)}.
 */
@Slf4j
public class PgVectorEmbeddingStore implements EmbeddingStore {

    private static final String UPSERT_DOCUMENT = """
            INSERT INTO kb_documents (doc_id, title, url, source_system, space_key, doctype, updated_at)
            VALUES (:doc_id, :title, :url, :source_system, :space_key, :doctype, :now)
            ON CONFLICT (doc_id) DO UPDATE SET
                title = EXCLUDED.title,
                url = EXCLUDED.url,
                source_system = EXCLUDED.source_system,
                space_key = EXCLUDED.space_key,
                doctype = EXCLUDED.doctype,
                updated_at = EXCLUDED.updated_at
            """;

    private static final String UPSERT_CHUNK = """
            INSERT INTO kb_chunks (chunk_id, doc_id, ord, text, token_count, chunk_type, content_sha256)
            VALUES (:chunk_id, :doc_id, :ord, :text, :token_count, :chunk_type, :content_sha256)
            ON CONFLICT (chunk_id) DO UPDATE SET
                text = EXCLUDED.text,
                token_count = EXCLUDED.token_count,
                chunk_type = EXCLUDED.chunk_type,
                content_sha256 = EXCLUDED.content_sha256
            """;

    private static final String UPSERT_EMBEDDING = """
            INSERT INTO kb_chunk_embeddings (chunk_id, provider, model, dimension, embedding, content_sha256, created_at)
            VALUES (:chunk_id, :provider, :model, :dimension, :embedding, :content_sha256, :created_at)
            ON CONFLICT (chunk_id, provider) DO UPDATE SET
                model = EXCLUDED.model,
                dimension = EXCLUDED.dimension,
                embedding = EXCLUDED.embedding,
                content_sha256 = EXCLUDED.content_sha256,
                created_at = EXCLUDED.created_at
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final int dimension;

    public PgVectorEmbeddingStore(NamedParameterJdbcTemplate jdbc, int dimension) {
        this.jdbc = jdbc;
        this.dimension = dimension;
    }

    @Override
    public int expectedDimension() {
        return dimension;
    }

    @Override
    public Map<String, String> existingContentHashes(String provider, Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new HashMap<>();
        jdbc.query("""
                        SELECT chunk_id, content_sha256 FROM kb_chunk_embeddings
                        WHERE provider = :provider AND chunk_id IN (:ids)
                        """,
                new MapSqlParameterSource("provider", provider).addValue("ids", chunkIds),
                rs -> {
                    out.put(rs.getString("chunk_id"), rs.getString("content_sha256"));
                });
        return out;
    }

    @Override
    public void upsertChunks(List<StoredChunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        Timestamp now = Timestamp.from(Instant.now());
        // One row per document, last chunk's traceability wins
        Map<String, StoredChunk> docs = new LinkedHashMap<>();
        chunks.forEach(c -> docs.put(c.docId(), c));
        SqlParameterSource[] docRows = docs.values().stream()
                .map(c -> new MapSqlParameterSource()
                        .addValue("doc_id", c.docId())
                        .addValue("title", c.title())
                        .addValue("url", c.url())
                        .addValue("source_system", c.sourceSystem())
                        .addValue("space_key", c.spaceKey())
                        .addValue("doctype", c.doctype())
                        .addValue("now", now))
                .toArray(SqlParameterSource[]::new);
        SqlParameterSource[] chunkRows = chunks.stream()
                .map(c -> new MapSqlParameterSource()
                        .addValue("chunk_id", c.chunkId())
                        .addValue("doc_id", c.docId())
                        .addValue("ord", c.ordinal())
                        .addValue("text", c.text())
                        .addValue("token_count", c.tokenCount())
                        .addValue("chunk_type", c.chunkType())
                        .addValue("content_sha256", c.contentSha256()))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_DOCUMENT, docRows);
        jdbc.batchUpdate(UPSERT_CHUNK, chunkRows);
        log.debug("Upserted {} documents and {} chunks", docRows.length, chunkRows.length);
    }

    @Override
    public int upsertEmbeddings(List<EmbeddingRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        for (EmbeddingRecord r : records) {
            if (r.vector().length != dimension) {
                throw new IllegalArgumentException("Vector for " + r.chunkId() + " has dimension "
                        + r.vector().length + ", store expects " + dimension);
            }
        }
        int existing = 0;
        Map<String, List<String>> idsByProvider = records.stream()
                .collect(Collectors.groupingBy(EmbeddingRecord::provider,
                        Collectors.mapping(EmbeddingRecord::chunkId, Collectors.toList())));
        for (Map.Entry<String, List<String>> e : idsByProvider.entrySet()) {
            existing += existingContentHashes(e.getKey(), e.getValue()).size();
        }

        SqlParameterSource[] rows = records.stream()
                .map(r -> new MapSqlParameterSource()
                        .addValue("chunk_id", r.chunkId())
                        .addValue("provider", r.provider())
                        .addValue("model", r.model())
                        .addValue("dimension", r.dimension())
                        .addValue("embedding", new PGvector(r.vector()))
                        .addValue("content_sha256", r.contentSha256())
                        .addValue("created_at", Timestamp.from(r.createdAt() == null ? Instant.now() : r.createdAt())))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_EMBEDDING, rows);
        return records.size() - existing;
    }

    @Override
    public long countEmbeddings(String provider) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM kb_chunk_embeddings WHERE provider = :provider",
                new MapSqlParameterSource("provider", provider), Long.class);
        return count == null ? 0 : count;
    }
}
