package com.naagi.kb.store;

import com.naagi.kb.retrieval.search.Candidate;
import com.naagi.kb.retrieval.search.CandidateFilter;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared SQL for the retrieval legs: the candidate projection, its row mapper and the
 * {@link CandidateFilter} translated into {@code WHERE} clauses.
 */
final class CandidateSql {

    static final String COLUMNS = """
            c.chunk_id, c.doc_id, c.text, d.title, d.url, d.source_system, d.space_key, d.doctype""";

    static final String FROM = """
            FROM kb_chunks c
            JOIN kb_documents d ON d.doc_id = c.doc_id""";

    static final RowMapper<Candidate> ROW_MAPPER = (rs, i) -> new Candidate(
            rs.getString("chunk_id"),
            rs.getString("doc_id"),
            rs.getString("text"),
            rs.getString("title"),
            rs.getString("url"),
            rs.getString("source_system"),
            rs.getString("space_key"),
            rs.getString("doctype"),
            rs.getDouble("score"));

    private CandidateSql() {}

    /**
     * Appends {@code AND ...} conditions for {@code filter}, binding their values into {@code params}.
     */
    static String where(CandidateFilter filter, MapSqlParameterSource params) {
        StringBuilder sql = new StringBuilder();
        if (!filter.spaces().isEmpty()) {
            sql.append("\nAND d.space_key IN (:spaces)");
            params.addValue("spaces", filter.spaces());
        }
        if (filter.hasDocumentFilter()) {
            List<String> any = new ArrayList<>();
            if (!filter.doctypes().isEmpty()) {
                any.add("LOWER(d.doctype) IN (:doctypes)");
                params.addValue("doctypes", filter.doctypes());
            }
            for (int i = 0; i < filter.titleTerms().size(); i++) {
                any.add("LOWER(d.title) LIKE :title_" + i);
                params.addValue("title_" + i, "%" + escapeLike(filter.titleTerms().get(i)) + "%");
            }
            sql.append("\nAND (").append(String.join(" OR ", any)).append(')');
        }
        return sql.toString();
    }

    static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
