package com.naagi.kb.retrieval.search;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Restrictions a retrieval leg applies before ranking: a content-space whitelist and,
 * for domain queries, a document filter on title terms or doctype.
 */
public record CandidateFilter(Set<String> spaces, List<String> titleTerms, Set<String> doctypes) {

    public static final CandidateFilter NONE = new CandidateFilter(Set.of(), List.of(), Set.of());

    public CandidateFilter {
        spaces = spaces == null ? Set.of() : Set.copyOf(spaces);
        titleTerms = titleTerms == null ? List.of()
                : titleTerms.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        doctypes = doctypes == null ? Set.of() : Set.copyOf(doctypes);
    }

    public static CandidateFilter spaces(Set<String> spaces) {
        return new CandidateFilter(spaces, List.of(), Set.of());
    }

    public CandidateFilter withDocumentFilter(List<String> terms, Set<String> types) {
        return new CandidateFilter(spaces, terms, types);
    }

    public boolean hasDocumentFilter() {
        return !titleTerms.isEmpty() || !doctypes.isEmpty();
    }

    public boolean accepts(String spaceKey, String title, String doctype) {
        if (!spaces.isEmpty() && (spaceKey == null || !spaces.contains(spaceKey))) {
            return false;
        }
        if (!hasDocumentFilter()) {
            return true;
        }
        if (doctype != null && doctypes.contains(doctype.toLowerCase(Locale.ROOT))) {
            return true;
        }
        String t = title == null ? "" : title.toLowerCase(Locale.ROOT);
        return titleTerms.stream().anyMatch(t::contains);
    }
}
