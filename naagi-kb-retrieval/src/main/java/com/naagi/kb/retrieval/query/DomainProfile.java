package com.naagi.kb.retrieval.query;

import java.util.List;
import java.util.Set;

/**
 * Vocabulary of one knowledge domain: the phrases that mark a query as belonging to it,
 * the phrases added when expanding such a query, and the terms that identify its documents.
 */
public record DomainProfile(
        String name,
        List<String> triggers,
        List<String> expansions,
        List<Topic> topics,
        List<String> documentTitleTerms,
        Set<String> documentTypes,
        Set<String> spaceWhitelist
) {

    /**
     * Extra expansion phrases used when any of {@code keywords} occurs in the query.
     */
    public record Topic(String name, List<String> keywords, List<String> phrases) {

        public Topic {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            phrases = phrases == null ? List.of() : List.copyOf(phrases);
        }
    }

    public DomainProfile {
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        expansions = expansions == null ? List.of() : List.copyOf(expansions);
        topics = topics == null ? List.of() : List.copyOf(topics);
        documentTitleTerms = documentTitleTerms == null ? List.of() : List.copyOf(documentTitleTerms);
        documentTypes = documentTypes == null ? Set.of() : Set.copyOf(documentTypes);
        spaceWhitelist = spaceWhitelist == null ? Set.of() : Set.copyOf(spaceWhitelist);
    }

    /** Navigate to SaaS (N2S) delivery methodology. */
    public static DomainProfile n2s() {
        return new DomainProfile(
                "N2S",
                List.of("n2s", "navigate to saas", "sprint 0", "sprint zero", "methodology"),
                List.of("N2S", "Navigate to SaaS"),
                List.of(
                        new Topic("lifecycle", List.of("lifecycle", "phase", "phases"),
                                List.of("Discovery", "Build", "Optimize", "Sprint 0")),
                        new Topic("governance", List.of("governance", "checkpoint", "checkpoints", "gate"),
                                List.of("entry criteria", "exit criteria", "governance checkpoint"))),
                List.of("n2s", "navigate to saas", "methodology", "playbook", "runbook"),
                Set.of("methodology", "playbook", "runbook"),
                Set.of());
    }
}
