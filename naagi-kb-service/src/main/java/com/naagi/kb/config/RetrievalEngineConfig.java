package com.naagi.kb.config;

import com.naagi.kb.core.event.EventSinkFactory;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.retrieval.HybridRetriever;
import com.naagi.kb.retrieval.RetrievalSettings;
import com.naagi.kb.retrieval.query.DomainProfile;
import com.naagi.kb.retrieval.query.QueryClassifier;
import com.naagi.kb.retrieval.rank.BoostRule;
import com.naagi.kb.retrieval.rank.DomainBoosts;
import com.naagi.kb.retrieval.search.DenseRetriever;
import com.naagi.kb.retrieval.search.LexicalRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class RetrievalEngineConfig {

    static final String EVENTS_RUN = "retrieval";

    @Bean
    public RetrievalSettings retrievalSettings(KbProperties props) {
        KbProperties.RetrievalConfig r = props.getRetrieval();
        return new RetrievalSettings(r.getTopK(), r.getRrfK(), r.getTopkDense(), r.getTopkBm25(),
                r.getMaxChunksPerDoc(), r.isHybridEnabled(), r.isBoostsEnabled(), r.isDomainFilterEnabled(),
                r.getSpaceWhitelist(), r.getSnippetChars());
    }

    @Bean
    public DomainProfile domainProfile(KbProperties props) {
        return domainProfile(props.getRetrieval().getDomain());
    }

    @Bean
    public QueryClassifier queryClassifier(DomainProfile profile) {
        return new QueryClassifier(profile);
    }

    @Bean
    public DomainBoosts domainBoosts(KbProperties props) {
        List<KbProperties.BoostConfig> configured = props.getRetrieval().getBoosts();
        if (configured == null || configured.isEmpty()) {
            return DomainBoosts.defaults();
        }
        List<BoostRule> rules = configured.stream()
                .map(b -> new BoostRule(b.getName() == null ? b.getPattern() : b.getName(), b.getPattern(), b.getValue()))
                .toList();
        log.info("Loaded {} retrieval boost rules: {}", rules.size(), rules);
        return new DomainBoosts(rules);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService retrievalExecutor(KbProperties props) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(props.getRetrieval().getWorkers(), r -> {
            Thread t = new Thread(r, "retrieval-leg-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public HybridRetriever hybridRetriever(EmbeddingsClient client, DenseRetriever dense, LexicalRetriever lexical,
                                           RetrievalSettings settings, QueryClassifier classifier,
                                           DomainBoosts boosts, ExecutorService retrievalExecutor,
                                           EventSinkFactory sinks) {
        return new HybridRetriever(client, dense, lexical, settings, classifier, boosts, retrievalExecutor,
                sinks.forRun(EVENTS_RUN));
    }

    static DomainProfile domainProfile(KbProperties.DomainConfig d) {
        DomainProfile base = DomainProfile.n2s();
        if (d == null) {
            return base;
        }
        List<DomainProfile.Topic> topics = d.getTopics().isEmpty()
                ? base.topics()
                : d.getTopics().stream()
                        .map(t -> new DomainProfile.Topic(t.getName(), t.getKeywords(), t.getPhrases()))
                        .toList();
        return new DomainProfile(
                d.getName() == null ? base.name() : d.getName(),
                d.getTriggers().isEmpty() ? base.triggers() : d.getTriggers(),
                d.getExpansions().isEmpty() ? base.expansions() : d.getExpansions(),
                topics,
                d.getDocumentTitleTerms().isEmpty() ? base.documentTitleTerms() : d.getDocumentTitleTerms(),
                d.getDocumentTypes().isEmpty() ? base.documentTypes() : lowercase(d.getDocumentTypes()),
                d.getSpaceWhitelist().isEmpty() ? base.spaceWhitelist() : new HashSet<>(d.getSpaceWhitelist()));
    }

    private static HashSet<String> lowercase(List<String> values) {
        HashSet<String> out = new HashSet<>();
        values.forEach(v -> out.add(v.toLowerCase(Locale.ROOT)));
        return out;
    }
}
