package com.naagi.kb.store;

import com.naagi.kb.retrieval.search.Candidate;
import com.naagi.kb.retrieval.search.CandidateFilter;
import com.naagi.kb.retrieval.search.LexicalRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;

/**
 * Lexical leg on PostgreSQL full-text search, ranked by {@code ts_rank_cd}.
 * {@code websearch_to_tsquery} understands the {@code OR} of an expanded query.
 */
@Slf4j
public class PostgresFullTextRetriever implements LexicalRetriever {

    private static final String TSQUERY = "websearch_to_tsquery('english', :q)";
    private static final String TSVECTOR = "to_tsvector('english', c.text)";

    private final NamedParameterJdbcTemplate jdbc;

    public PostgresFullTextRetriever(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Candidate> search(String query, int topK, CandidateFilter filter) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("q", query)
                .addValue("limit", topK);
        String sql = "SELECT " + CandidateSql.COLUMNS + ", ts_rank_cd(" + TSVECTOR + ", " + TSQUERY + ") AS score\n"
                + CandidateSql.FROM + "\n"
                + "WHERE " + TSVECTOR + " @@ " + TSQUERY
                + CandidateSql.where(filter, params) + "\n"
                + "ORDER BY score DESC, c.doc_id, c.chunk_id\n"
                + "LIMIT :limit";
        List<Candidate> out = jdbc.query(sql, params, CandidateSql.ROW_MAPPER);
        log.debug("Full-text search returned {} candidates", out.size());
        return out;
    }
}
