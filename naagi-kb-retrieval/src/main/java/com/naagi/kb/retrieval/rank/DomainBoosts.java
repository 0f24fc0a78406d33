package com.naagi.kb.retrieval.rank;

import java.util.List;

/**
 * Domain-aware boosts applied after fusion. Among positive rules the first match in
 * configured order wins; every matching negative rule is added on top.
 */
public class DomainBoosts {

    public static final String PERIODIC_PATTERN =
            "\\b(january|february|march|april|may|june|july|august|september|october|november|december)\\b|\\b20\\d{2}\\b";

    private final List<BoostRule> rules;

    public DomainBoosts(List<BoostRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static DomainBoosts defaults() {
        return new DomainBoosts(List.of(
                new BoostRule("methodology", "methodology", 0.20),
                new BoostRule("playbook", "playbook", 0.15),
                new BoostRule("runbook", "runbook", 0.10),
                new BoostRule("periodic", PERIODIC_PATTERN, -0.10)));
    }

    public List<BoostRule> rules() {
        return rules;
    }

    public double boostFor(String title, String doctype) {
        String text = (title == null ? "" : title) + " " + (doctype == null ? "" : doctype);
        double positive = 0.0;
        double negative = 0.0;
        boolean positiveMatched = false;
        for (BoostRule rule : rules) {
            if (rule.value() >= 0) {
                if (!positiveMatched && rule.matches(text)) {
                    positive = rule.value();
                    positiveMatched = true;
                }
            } else if (rule.matches(text)) {
                negative += rule.value();
            }
        }
        return positive + negative;
    }
}
