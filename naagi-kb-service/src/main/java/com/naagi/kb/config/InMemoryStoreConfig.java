package com.naagi.kb.config;

import com.naagi.kb.embed.store.InMemoryEmbeddingStore;
import com.naagi.kb.retrieval.search.Bm25LexicalRetriever;
import com.naagi.kb.retrieval.search.DenseRetriever;
import com.naagi.kb.retrieval.search.InMemoryDenseRetriever;
import com.naagi.kb.retrieval.search.LexicalRetriever;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local store: embeddings are lost on restart. Lexical search uses the in-memory BM25 index.
 */
@Configuration
@ConditionalOnProperty(name = "naagi.kb.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStoreConfig {

    @Bean
    public InMemoryEmbeddingStore embeddingStore(KbProperties props) {
        return new InMemoryEmbeddingStore(props.getEmbed().getDimension());
    }

    @Bean
    public DenseRetriever denseRetriever(InMemoryEmbeddingStore store) {
        return new InMemoryDenseRetriever(store);
    }

    @Bean
    public LexicalRetriever lexicalRetriever(InMemoryEmbeddingStore store) {
        return new Bm25LexicalRetriever(store);
    }
}
