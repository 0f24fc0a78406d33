package com.naagi.kb.core.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenCountersTest {

    @Test
    @DisplayName("Heuristic counter rounds characters up to whole tokens")
    void heuristicRoundsUp() {
        TokenCounter counter = TokenCounters.create("heuristic");

        assertThat(counter.count("")).isZero();
        assertThat(counter.count("abcd")).isEqualTo(1);
        assertThat(counter.count("abcde")).isEqualTo(2);
        assertThat(counter.name()).isEqualTo("heuristic");
    }

    @Test
    @DisplayName("cl100k counter counts BPE tokens")
    void cl100kCountsTokens() {
        TokenCounter counter = TokenCounters.create("cl100k");

        assertThat(counter.count("hello world")).isEqualTo(2);
        assertThat(counter.name()).isEqualTo("cl100k");
    }

    @Test
    @DisplayName("Unknown tokenizer name is reported as unavailable")
    void unknownTokenizer() {
        assertThat(TokenCounters.isAvailable("sentencepiece-xl")).isFalse();
        assertThatThrownBy(() -> TokenCounters.create("sentencepiece-xl"))
                .isInstanceOf(TokenizerUnavailableException.class)
                .hasMessageContaining("sentencepiece-xl");
    }
}
