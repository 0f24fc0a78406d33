package com.naagi.kb.embed.guard;

import com.naagi.kb.embed.llm.DummyEmbeddingsClient;
import com.naagi.kb.embed.llm.EmbeddingsClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DimensionGuardTest {

    @Test
    @DisplayName("Declared dimension is trusted without a provider call")
    void declaredDimension() {
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        when(client.declaredDimension()).thenReturn(1536);

        assertThat(new DimensionGuard(client, 1536).verify()).isEqualTo(1536);
        verify(client, never()).embed(anyString());
    }

    @Test
    @DisplayName("Unknown dimension is measured with one trial embedding")
    void measuredDimension() {
        EmbeddingsClient client = mock(EmbeddingsClient.class);
        when(client.provider()).thenReturn("ollama");
        when(client.model()).thenReturn("nomic-embed-text");
        when(client.embed(anyString())).thenReturn(Collections.nCopies(768, 0.1));

        assertThatThrownBy(() -> new DimensionGuard(client, 1536).verify())
                .isInstanceOf(DimensionMismatchException.class)
                .hasMessage("Dimension mismatch for provider 'ollama' model 'nomic-embed-text': expected 1536, got 768");
    }

    @Test
    @DisplayName("Per-vector check catches drift after the guard passed")
    void vectorCheck() {
        DimensionGuard guard = new DimensionGuard(new DummyEmbeddingsClient(8), 8);

        assertThat(guard.verify()).isEqualTo(8);
        assertThatThrownBy(() -> guard.check(Collections.nCopies(4, 0.0)))
                .isInstanceOf(DimensionMismatchException.class)
                .satisfies(e -> assertThat(((DimensionMismatchException) e).getActual()).isEqualTo(4));
    }
}
