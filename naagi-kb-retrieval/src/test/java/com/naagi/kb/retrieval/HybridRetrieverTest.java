package com.naagi.kb.retrieval;

import com.naagi.kb.core.event.InMemoryEventSink;
import com.naagi.kb.embed.guard.DimensionMismatchException;
import com.naagi.kb.retrieval.pack.PackedContext;
import com.naagi.kb.retrieval.query.DomainProfile;
import com.naagi.kb.retrieval.query.QueryClassifier;
import com.naagi.kb.retrieval.rank.DomainBoosts;
import com.naagi.kb.retrieval.search.Bm25LexicalRetriever;
import com.naagi.kb.retrieval.search.InMemoryDenseRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.naagi.kb.retrieval.RetrievalFixture.url;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HybridRetrieverTest {

    private RetrievalFixture fixture;
    private InMemoryEventSink events;

    @BeforeEach
    void setUp() {
        fixture = new RetrievalFixture();
        events = new InMemoryEventSink();
    }

    private HybridRetriever retriever() {
        return retriever(RetrievalSettings.defaults());
    }

    private HybridRetriever retriever(RetrievalSettings settings) {
        return new HybridRetriever(fixture.client(),
                new InMemoryDenseRetriever(fixture.store()),
                new Bm25LexicalRetriever(fixture.store()),
                settings,
                new QueryClassifier(DomainProfile.n2s()),
                DomainBoosts.defaults(),
                Runnable::run,
                events);
    }

    /** One document with ten strongly matching chunks plus fifteen single-chunk documents. */
    private void n2sCorpus() {
        for (int i = 0; i < 10; i++) {
            fixture.add("n2s-guide", i, "N2S Guide", url("n2s-guide"),
                    "N2S lifecycle overview part " + i + ": the N2S lifecycle covers discovery, build and optimize.");
        }
        for (int d = 0; d < 15; d++) {
            String text = d % 2 == 0
                    ? "Lifecycle phase notes for area " + d + " with sprint planning details."
                    : "Integration design for interface " + d + " and data mapping.";
            fixture.add("page-" + d, 0, "Delivery Page " + d, url("page-" + d), text);
        }
    }

    @Nested
    @DisplayName("Diversity")
    class Diversity {

        @Test
        @DisplayName("\"N2S lifecycle overview\" at top_k=12 spans at least six documents")
        void dominantDocumentCannotFillTheWindow() {
            n2sCorpus();
            RetrievalRequest request = new RetrievalRequest("N2S lifecycle overview", 12, null, null, null,
                    true, 60, null, null, null, null, null, null);

            RetrievalResponse response = retriever().retrieve(request);

            assertThat(response.hits()).hasSize(12);
            Map<String, Long> perDoc = response.hits().stream()
                    .collect(Collectors.groupingBy(RetrievalHit::docId, Collectors.counting()));
            assertThat(perDoc).hasSizeGreaterThanOrEqualTo(6);
            assertThat(perDoc.values()).allMatch(n -> n <= 3);
            assertThat(response.health().duplicationRate()).isZero();
            assertThat(response.domainQuery()).isTrue();
            assertThat(response.expandedQuery()).contains("Navigate to SaaS");
        }

        @Test
        @DisplayName("A document dominating both legs is capped and the window backfills in ranked order")
        void dominantDocumentIsCappedAndBackfilled() {
            for (int i = 0; i < 20; i++) {
                fixture.add("cutover-guide", i, "Cutover Guide", url("cutover-guide"),
                        "Payroll cutover checklist step " + i + ": freeze payroll, reconcile and sign off the cutover.");
            }
            for (int d = 0; d < 5; d++) {
                fixture.add("team-" + d, 0, "Team Page " + d, url("team-" + d),
                        "Team " + d + " notes on the payroll calendar and onboarding.");
            }
            RetrievalRequest capped = new RetrievalRequest("payroll cutover checklist", 8, null, null, null,
                    true, 60, null, null, null, null, null, 3);
            RetrievalRequest uncapped = new RetrievalRequest("payroll cutover checklist", 25, null, null, null,
                    true, 60, null, null, null, null, null, 25);

            List<RetrievalHit> hits = retriever().retrieve(capped).hits();
            List<RetrievalHit> full = retriever().retrieve(uncapped).hits();

            assertThat(hits).hasSize(8);
            assertThat(hits).filteredOn(h -> h.docId().equals("cutover-guide")).hasSize(3);
            assertThat(hits.stream().map(RetrievalHit::docId).distinct()).hasSize(6);
            assertThat(hits).isSortedAccordingTo(Comparator.comparingDouble(RetrievalHit::fusedScore).reversed()
                    .thenComparing(RetrievalHit::chunkId));

            List<String> expected = new ArrayList<>();
            Map<String, Integer> perDoc = new HashMap<>();
            for (RetrievalHit h : full) {
                if (perDoc.merge(h.docId(), 1, Integer::sum) <= 3) expected.add(h.chunkId());
            }
            assertThat(hits).extracting(RetrievalHit::chunkId).containsExactlyElementsOf(expected.subList(0, 8));
        }

        @Test
        void noPairRepeats() {
            n2sCorpus();

            RetrievalResponse response = retriever().retrieve(RetrievalRequest.of("lifecycle", 20));

            assertThat(response.hits()).extracting(h -> h.docId() + "/" + h.chunkId()).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("Ranking")
    class Ranking {

        @Test
        @DisplayName("Hits are ordered by fused score, with ranks from both legs")
        void fusedOrder() {
            n2sCorpus();

            List<RetrievalHit> hits = retriever().retrieve(RetrievalRequest.of("lifecycle sprint planning", 8)).hits();

            assertThat(hits).isSortedAccordingTo(Comparator.comparingDouble(RetrievalHit::fusedScore).reversed());
            assertThat(hits).extracting(RetrievalHit::rank).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
            assertThat(hits).anyMatch(h -> h.denseRank() != null && h.bm25Rank() != null);
            hits.forEach(h -> assertThat(h.fusedScore()).isCloseTo(h.rrfScore() + h.boost(), within(1e-12)));
        }

        @Test
        @DisplayName("Methodology pages are boosted above everything else and periodic pages demoted")
        void boosts() {
            n2sCorpus();
            fixture.add("method", 0, "Release Methodology", url("method"), "How releases are planned.");
            fixture.add("status", 0, "Status Report January 2024", url("status"), "Lifecycle status for the month.");

            List<RetrievalHit> hits = retriever().retrieve(RetrievalRequest.of("lifecycle", 30)).hits();

            assertThat(hits.get(0).docId()).isEqualTo("method");
            assertThat(hits.get(0).boost()).isCloseTo(0.20, within(1e-9));
            RetrievalHit status = hits.stream().filter(h -> h.docId().equals("status")).findFirst().orElseThrow();
            assertThat(status.boost()).isCloseTo(-0.10, within(1e-9));
            assertThat(hits.get(hits.size() - 1).docId()).isEqualTo("status");
        }

        @Test
        void boostsCanBeDisabled() {
            fixture.add("method", 0, "Release Methodology", url("method"), "How releases are planned.");

            List<RetrievalHit> hits = retriever().retrieve(RetrievalRequest.of("releases", 5).withBoostsEnabled(false)).hits();

            assertThat(hits).allMatch(h -> h.boost() == 0.0);
        }

        @Test
        @DisplayName("With hybrid disabled only the dense leg contributes")
        void denseOnly() {
            n2sCorpus();

            RetrievalResponse response = retriever().retrieve(RetrievalRequest.of("lifecycle", 10)
                    .withHybridEnabled(false).withBoostsEnabled(false));

            assertThat(response.hybridEnabled()).isFalse();
            assertThat(response.hits()).allMatch(h -> h.bm25Rank() == null && h.denseRank() != null);
            assertThat(response.hits()).isSortedAccordingTo(Comparator.comparing(RetrievalHit::denseRank));
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("Chunks without a title or url are never returned")
        void untraceableExcluded() {
            n2sCorpus();
            fixture.add("no-url", 0, "Lifecycle Notes", null, "Lifecycle lifecycle lifecycle overview.");
            fixture.add("no-title", 0, " ", url("no-title"), "Lifecycle lifecycle lifecycle overview.");

            RetrievalResponse response = retriever().retrieve(RetrievalRequest.of("lifecycle overview", 30));

            assertThat(response.hits()).extracting(RetrievalHit::docId).doesNotContain("no-url", "no-title");
            assertThat(response.hits()).allMatch(h -> !h.title().isBlank() && !h.url().isBlank());
            assertThat(response.health().traceability().completeHits()).isEqualTo(response.hits().size());
            assertThat(events.named("retrieve.complete").get(0).field("excluded_untraceable")).isEqualTo(2);
        }

        @Test
        void spaceWhitelist() {
            fixture.add("dev-1", 0, "Dev Page", url("dev-1"), "Deployment lifecycle in dev.", "DEV", null);
            fixture.add("ops-1", 0, "Ops Page", url("ops-1"), "Deployment lifecycle in ops.", "OPS", null);

            List<RetrievalHit> hits = retriever()
                    .retrieve(RetrievalRequest.of("deployment lifecycle", 5).withSpaceWhitelist(List.of("OPS"))).hits();

            assertThat(hits).extracting(RetrievalHit::docId).containsExactly("ops-1");
        }

        @Test
        @DisplayName("Domain filter restricts the lexical leg to domain documents")
        void domainFilterOnLexicalLeg() {
            n2sCorpus();

            List<RetrievalHit> hits = retriever()
                    .retrieve(RetrievalRequest.of("N2S lifecycle", 20).withDomainFilterEnabled(true)).hits();

            assertThat(hits).filteredOn(h -> h.bm25Rank() != null)
                    .isNotEmpty()
                    .allMatch(h -> h.docId().equals("n2s-guide"));
        }
    }

    @Nested
    @DisplayName("Contract")
    class Contract {

        @Test
        @DisplayName("One packed context per requested budget")
        void packsPerBudget() {
            n2sCorpus();

            RetrievalResponse response = retriever()
                    .retrieve(RetrievalRequest.of("lifecycle", 8).withBudgets(List.of(300, 6000)));

            assertThat(response.contexts()).extracting(PackedContext::budgetChars).containsExactly(300, 6000);
            assertThat(response.contexts().get(0).chars()).isLessThanOrEqualTo(300);
            assertThat(response.contexts().get(1).text()).contains("--- Chunk 1 (score: ");
            assertThat(response.contexts().get(1).chunksIncluded()).isEqualTo(response.hits().size());
        }

        @Test
        void noBudgetsNoContexts() {
            n2sCorpus();

            assertThat(retriever().retrieve(RetrievalRequest.of("lifecycle", 3)).contexts()).isEmpty();
        }

        @Test
        @DisplayName("A query vector of the wrong dimension is rejected")
        void dimensionMismatch() {
            n2sCorpus();
            RetrievalRequest request = new RetrievalRequest("lifecycle", 5, null, null, 1536,
                    null, null, null, null, null, null, null, null);

            assertThatThrownBy(() -> retriever().retrieve(request))
                    .isInstanceOf(DimensionMismatchException.class)
                    .hasMessageContaining("expected 1536, got " + RetrievalFixture.DIM);
        }

        @Test
        void unknownProviderRejected() {
            RetrievalRequest request = new RetrievalRequest("lifecycle", 5, null, "openai", null,
                    null, null, null, null, null, null, null, null);

            assertThatThrownBy(() -> retriever().retrieve(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("openai");
        }

        @Test
        void invalidRequestsRejected() {
            assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of(" ", 5)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("query_text is required");
            assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of("x", 0)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> retriever().retrieve(RetrievalRequest.of("x", 5).withBudgets(List.of(0))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Begin and complete events are emitted for each query")
        void events() {
            n2sCorpus();

            RetrievalResponse response = retriever().retrieve(RetrievalRequest.of("N2S lifecycle", 4));

            assertThat(events.named("retrieve.begin")).hasSize(1);
            assertThat(events.named("retrieve.begin").get(0).field("domain_query")).isEqualTo(true);
            assertThat(events.named("retrieve.complete").get(0).field("query_id")).isEqualTo(response.queryId());
            assertThat(events.named("retrieve.complete").get(0).field("hits")).isEqualTo(4);
        }

        @Test
        @DisplayName("Concurrent queries return identical results")
        void concurrentQueries() throws Exception {
            n2sCorpus();
            ExecutorService legs = Executors.newFixedThreadPool(4);
            ExecutorService callers = Executors.newFixedThreadPool(4);
            try {
                HybridRetriever shared = new HybridRetriever(fixture.client(),
                        new InMemoryDenseRetriever(fixture.store()), new Bm25LexicalRetriever(fixture.store()),
                        RetrievalSettings.defaults(), new QueryClassifier(DomainProfile.n2s()),
                        DomainBoosts.defaults(), legs, events);
                Function<RetrievalResponse, List<String>> ids = r -> r.hits().stream().map(RetrievalHit::chunkId).toList();

                List<String> expected = ids.apply(shared.retrieve(RetrievalRequest.of("lifecycle overview", 10)));
                List<Future<List<String>>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(callers.submit(() -> ids.apply(shared.retrieve(RetrievalRequest.of("lifecycle overview", 10)))));
                }
                for (Future<List<String>> f : futures) {
                    assertThat(f.get(10, TimeUnit.SECONDS)).isEqualTo(expected);
                }
            } finally {
                callers.shutdownNow();
                legs.shutdownNow();
            }
        }
    }
}
