package com.deskpilot.orchestrator.llm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OllamaEmbedderTest {

    @Mock OllamaClient ollama;

    @Test
    void embed_modelAnswers_returnsVector() {
        when(ollama.embed("nomic-embed-text", "hello")).thenReturn(List.of(0.1, 0.2));

        assertThat(new OllamaEmbedder(ollama, true, "nomic-embed-text").embed("hello"))
                .hasValue(List.of(0.1, 0.2));
    }

    @Test
    void embed_modelDown_empty() {
        when(ollama.embed("nomic-embed-text", "hello")).thenThrow(new LlmUnavailableException("refused"));

        assertThat(new OllamaEmbedder(ollama, true, "nomic-embed-text").embed("hello")).isEmpty();
    }

    @Test
    void embed_disabledOrBlank_neverCallsModel() {
        assertThat(new OllamaEmbedder(ollama, false, "m").embed("hello")).isEmpty();
        assertThat(new OllamaEmbedder(ollama, true, "m").embed("  ")).isEmpty();
        verifyNoInteractions(ollama);
    }
}
