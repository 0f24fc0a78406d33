package com.naagi.kb.config;

import com.naagi.kb.retrieval.search.DenseRetriever;
import com.naagi.kb.retrieval.search.LexicalRetriever;
import com.naagi.kb.store.PgVectorDenseRetriever;
import com.naagi.kb.store.PgVectorEmbeddingStore;
import com.naagi.kb.store.PostgresFullTextRetriever;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * PostgreSQL + pgvector store. Tables come from {@code schema-pgvector.sql}.
 */
@Configuration
@ConditionalOnProperty(name = "naagi.kb.store.type", havingValue = "pgvector")
public class PgVectorStoreConfig {

    @Bean
    public PgVectorEmbeddingStore embeddingStore(NamedParameterJdbcTemplate jdbc, KbProperties props) {
        return new PgVectorEmbeddingStore(jdbc, props.getEmbed().getDimension());
    }

    @Bean
    public DenseRetriever denseRetriever(NamedParameterJdbcTemplate jdbc, KbProperties props) {
        return new PgVectorDenseRetriever(jdbc, props.getEmbed().getDimension());
    }

    @Bean
    public LexicalRetriever lexicalRetriever(NamedParameterJdbcTemplate jdbc) {
        return new PostgresFullTextRetriever(jdbc);
    }
}
