package com.deskpilot.orchestrator.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Embeddings through the same Ollama server as the chat model. Disabled
 * embeddings and failed calls both come back empty, which turns memory
 * search off for that utterance.
 */
@Component
public class OllamaEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbedder.class);

    private final OllamaClient ollama;
    private final boolean      enabled;
    private final String       model;

    public OllamaEmbedder(OllamaClient ollama,
                          @Value("${deskpilot.embedding.enabled:true}") boolean enabled,
                          @Value("${deskpilot.embedding.model:nomic-embed-text}") String model) {
        this.ollama  = ollama;
        this.enabled = enabled;
        this.model   = model;
    }

    @Override
    public Optional<List<Double>> embed(String text) {
        if (!enabled || text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ollama.embed(model, text));
        } catch (LlmUnavailableException e) {
            log.debug("Embedding unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
