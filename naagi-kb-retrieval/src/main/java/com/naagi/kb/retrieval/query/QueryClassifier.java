package com.naagi.kb.retrieval.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword and phrase classifier for domain queries. Matching is case-insensitive on whole words.
 */
public class QueryClassifier {

    private final DomainProfile profile;
    private final List<Pattern> triggers;

    public QueryClassifier(DomainProfile profile) {
        this.profile = profile;
        this.triggers = profile.triggers().stream().map(QueryClassifier::wordPattern).toList();
    }

    public DomainProfile profile() {
        return profile;
    }

    public boolean isDomainQuery(String query) {
        if (query == null || query.isBlank()) return false;
        String q = query.toLowerCase(Locale.ROOT);
        return triggers.stream().anyMatch(p -> p.matcher(q).find());
    }

    /**
     * Expands a domain query to {@code original OR phrase OR ...}; other queries pass through unchanged.
     */
    public QueryAnalysis analyze(String query) {
        if (!isDomainQuery(query)) {
            return new QueryAnalysis(query, query, false, List.of());
        }
        String q = query.toLowerCase(Locale.ROOT);
        List<String> topics = new ArrayList<>();
        List<String> parts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        parts.add(query.strip());
        seen.add(q.strip());

        for (String phrase : profile.expansions()) {
            if (seen.add(phrase.toLowerCase(Locale.ROOT))) parts.add(phrase);
        }
        for (DomainProfile.Topic topic : profile.topics()) {
            boolean hit = topic.keywords().stream().anyMatch(k -> wordPattern(k).matcher(q).find());
            if (!hit) continue;
            topics.add(topic.name());
            for (String phrase : topic.phrases()) {
                if (seen.add(phrase.toLowerCase(Locale.ROOT))) parts.add(phrase);
            }
        }
        return new QueryAnalysis(query, String.join(" OR ", parts), true, topics);
    }

    private static Pattern wordPattern(String phrase) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase.toLowerCase(Locale.ROOT)) + "(?![a-z0-9])");
    }
}
