package com.deskpilot.orchestrator.llm;

import java.util.List;
import java.util.Optional;

/**
 * Turns text into an embedding vector for memory search and storage.
 */
public interface Embedder {

    /** @return the vector, or empty when embeddings are disabled or the call failed */
    Optional<List<Double>> embed(String text);
}
