package com.naagi.kb.store;

import com.naagi.kb.retrieval.search.Candidate;
import com.naagi.kb.retrieval.search.CandidateFilter;
import com.naagi.kb.retrieval.search.DenseRetriever;
import com.pgvector.PGvector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

/**
 * Dense leg on pgvector: cosine distance ({@code <=>}) over the provider's embeddings,
 * ties broken by doc id then chunk id.
 */
@Slf4j
public class PgVectorDenseRetriever implements DenseRetriever {

    private final NamedParameterJdbcTemplate jdbc;
    private final int dimension;

    public PgVectorDenseRetriever(NamedParameterJdbcTemplate jdbc, int dimension) {
        this.jdbc = jdbc;
        this.dimension = dimension;
    }

    @Override
    public List<Candidate> search(String provider, float[] queryVector, int topK, CandidateFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("qemb", new PGvector(queryVector))
                .addValue("provider", provider)
                .addValue("dimension", dimension)
                .addValue("limit", topK);
        String sql = "SELECT " + CandidateSql.COLUMNS + ", 1 - (e.embedding <=> :qemb) AS score\n"
                + CandidateSql.FROM + "\n"
                + "JOIN kb_chunk_embeddings e ON e.chunk_id = c.chunk_id\n"
                + "WHERE e.provider = :provider AND e.dimension = :dimension"
                + CandidateSql.where(filter, params) + "\n"
                + "ORDER BY e.embedding <=> :qemb, c.doc_id, c.chunk_id\n"
                + "LIMIT :limit";
        List<Candidate> out = jdbc.query(sql, params, CandidateSql.ROW_MAPPER);
        log.debug("pgvector dense search returned {} candidates (provider={})", out.size(), provider);
        return out;
    }
}
