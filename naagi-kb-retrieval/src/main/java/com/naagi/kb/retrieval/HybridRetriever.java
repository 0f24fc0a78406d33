package com.naagi.kb.retrieval;

import com.naagi.kb.core.event.EventSink;
import com.naagi.kb.core.event.KbEvent;
import com.naagi.kb.embed.guard.DimensionMismatchException;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import com.naagi.kb.retrieval.health.RetrievalHealth;
import com.naagi.kb.retrieval.pack.ContextPacker;
import com.naagi.kb.retrieval.pack.PackedContext;
import com.naagi.kb.retrieval.query.DomainProfile;
import com.naagi.kb.retrieval.query.QueryAnalysis;
import com.naagi.kb.retrieval.query.QueryClassifier;
import com.naagi.kb.retrieval.rank.DiversityFilter;
import com.naagi.kb.retrieval.rank.DomainBoosts;
import com.naagi.kb.retrieval.search.Candidate;
import com.naagi.kb.retrieval.search.CandidateFilter;
import com.naagi.kb.retrieval.search.DenseRetriever;
import com.naagi.kb.retrieval.search.FusedCandidate;
import com.naagi.kb.retrieval.search.LexicalRetriever;
import com.naagi.kb.retrieval.search.RrfFusion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Hybrid retrieval: dense and BM25 legs run in parallel, are fused with RRF, boosted, filtered for
 * traceability and diversity, and optionally packed into context blocks.
 * <p>
 * Stateless per query; one instance serves any number of concurrent callers.
 */
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);
    static final String EVENT_RUN = "retrieval";

    private final EmbeddingsClient embedder;
    private final DenseRetriever dense;
    private final LexicalRetriever lexical;
    private final RetrievalSettings settings;
    private final QueryClassifier classifier;
    private final DomainBoosts boosts;
    private final ContextPacker packer = new ContextPacker();
    private final Executor executor;
    private final EventSink events;

    public HybridRetriever(EmbeddingsClient embedder, DenseRetriever dense, LexicalRetriever lexical,
                           RetrievalSettings settings, QueryClassifier classifier, DomainBoosts boosts,
                           Executor executor, EventSink events) {
        this.embedder = embedder;
        this.dense = dense;
        this.lexical = lexical;
        this.settings = settings;
        this.classifier = classifier;
        this.boosts = boosts;
        this.executor = executor;
        this.events = events;
    }

    public RetrievalResponse retrieve(RetrievalRequest request) {
        request.validate();
        if (request.provider() != null && !request.provider().equals(embedder.provider())) {
            throw new IllegalArgumentException("No query embedder for provider '" + request.provider()
                    + "', configured provider is '" + embedder.provider() + "'");
        }
        RetrievalRequest r = request.withDefaults(settings);
        long started = System.currentTimeMillis();
        String queryId = "q-" + UUID.randomUUID().toString().substring(0, 8);

        QueryAnalysis analysis = classifier.analyze(r.queryText().strip());
        DomainProfile profile = classifier.profile();
        Set<String> spaces = new HashSet<>(r.spaceWhitelist());
        if (spaces.isEmpty() && analysis.domainQuery()) {
            spaces.addAll(profile.spaceWhitelist());
        }
        CandidateFilter denseFilter = CandidateFilter.spaces(spaces);
        CandidateFilter lexicalFilter = r.domainFilterEnabled() && analysis.domainQuery()
                ? denseFilter.withDocumentFilter(profile.documentTitleTerms(), profile.documentTypes())
                : denseFilter;

        events.emit(KbEvent.of("retrieve.begin", EVENT_RUN, fields(
                "query_id", queryId,
                "query", r.queryText(),
                "expanded_query", analysis.expanded(),
                "domain_query", analysis.domainQuery(),
                "hybrid_enabled", r.hybridEnabled(),
                "top_k", r.topK())));

        CompletableFuture<List<Candidate>> denseLeg = CompletableFuture.supplyAsync(
                () -> denseSearch(analysis.expanded(), r, denseFilter), executor);
        CompletableFuture<List<Candidate>> lexicalLeg = r.hybridEnabled()
                ? CompletableFuture.supplyAsync(() -> lexical.search(analysis.expanded(), r.topkBm25(), lexicalFilter), executor)
                : CompletableFuture.completedFuture(List.of());

        List<Candidate> denseHits = join(denseLeg);
        List<Candidate> lexicalHits = join(lexicalLeg);

        List<FusedCandidate> ranked = new RrfFusion(r.rrfK()).fuse(denseHits, lexicalHits);
        if (r.boostsEnabled()) {
            List<FusedCandidate> boosted = new ArrayList<>(ranked.size());
            for (FusedCandidate c : ranked) {
                boosted.add(c.withBoost(boosts.boostFor(c.candidate().title(), c.candidate().doctype())));
            }
            boosted.sort(RrfFusion.ORDER);
            ranked = boosted;
        }

        List<FusedCandidate> traceable = ranked.stream()
                .filter(c -> notBlank(c.candidate().title()) && notBlank(c.candidate().url()))
                .toList();
        int untraceable = ranked.size() - traceable.size();
        if (untraceable > 0) {
            log.debug("Excluded {} candidates without title or url for query {}", untraceable, queryId);
        }

        List<FusedCandidate> selected = DiversityFilter.select(traceable, r.maxChunksPerDoc(), r.topK());
        List<RetrievalHit> hits = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            hits.add(toHit(i + 1, selected.get(i)));
        }

        List<PackedContext> contexts = new ArrayList<>();
        if (!r.budgets().isEmpty()) {
            List<ContextPacker.Segment> segments = selected.stream()
                    .map(c -> new ContextPacker.Segment(c.candidate().text(), c.candidate().title(),
                            c.candidate().url(), c.finalScore()))
                    .toList();
            for (int budget : r.budgets()) {
                contexts.add(packer.pack(segments, budget));
            }
        }

        long duration = System.currentTimeMillis() - started;
        events.emit(KbEvent.of("retrieve.complete", EVENT_RUN, fields(
                "query_id", queryId,
                "dense_candidates", denseHits.size(),
                "bm25_candidates", lexicalHits.size(),
                "fused_candidates", ranked.size(),
                "excluded_untraceable", untraceable,
                "hits", hits.size(),
                "duration_ms", duration)));
        log.info("Retrieval {} returned {} hits ({} dense, {} bm25) in {}ms",
                queryId, hits.size(), denseHits.size(), lexicalHits.size(), duration);

        return new RetrievalResponse(queryId, r.queryText(), analysis.expanded(), analysis.domainQuery(),
                embedder.provider(), r.hybridEnabled(), hits, contexts, RetrievalHealth.measure(hits), duration);
    }

    private List<Candidate> denseSearch(String query, RetrievalRequest r, CandidateFilter filter) {
        List<Double> vector = embedder.embed(query);
        if (r.dimension() != null && vector.size() != r.dimension()) {
            throw new DimensionMismatchException(embedder.provider(), embedder.model(), r.dimension(), vector.size());
        }
        float[] q = new float[vector.size()];
        for (int i = 0; i < q.length; i++) q[i] = vector.get(i).floatValue();
        return dense.search(embedder.provider(), q, r.topkDense(), filter);
    }

    private RetrievalHit toHit(int rank, FusedCandidate c) {
        Candidate k = c.candidate();
        return new RetrievalHit(rank, k.chunkId(), k.docId(), k.title(), k.url(), k.sourceSystem(),
                snippet(k.text()), c.denseRank(), c.bm25Rank(), c.rrfScore(), c.boost(), c.finalScore());
    }

    String snippet(String text) {
        if (text == null) return "";
        String flat = text.strip();
        int max = settings.snippetChars();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static Map<String, Object> fields(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
