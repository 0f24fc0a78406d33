package com.naagi.kb.retrieval.rank;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Additive score adjustment for documents whose title or doctype matches {@code pattern}
 * (case-insensitive, found anywhere in the text).
 */
public final class BoostRule {

    private final String name;
    private final Pattern pattern;
    private final double value;

    public BoostRule(String name, String regex, double value) {
        this.name = Objects.requireNonNull(name, "name");
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"), Pattern.CASE_INSENSITIVE);
        this.value = value;
    }

    public String name() {
        return name;
    }

    public String regex() {
        return pattern.pattern();
    }

    public double value() {
        return value;
    }

    boolean matches(String text) {
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    @Override
    public String toString() {
        return name + "(" + value + ")";
    }
}
