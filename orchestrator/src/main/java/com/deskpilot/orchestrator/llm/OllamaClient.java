package com.deskpilot.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the local Ollama chat endpoint.
 *
 * Raw {@link HttpClient}, same approach as the other service clients, so
 * the exact request body is visible when debugging a bad plan. There is no
 * remote fallback: if the local model server is down the caller gets an
 * {@link LlmUnavailableException} and reports it.
 */
@Component
public class OllamaClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "system", "user" or "assistant". */
    public record Message(String role, String content) {

        public static Message system(String content) { return new Message("system", content); }
        public static Message user(String content)   { return new Message("user", content); }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(Message message, Boolean done) {

        public String text() {
            return message == null || message.content() == null ? "" : message.content();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final int CONTEXT_WINDOW = 8192;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       defaultModel;
    private final Duration     timeout;

    public OllamaClient(@Value("${deskpilot.llm.base-url:http://localhost:11434}") String baseUrl,
                        @Value("${deskpilot.llm.model:llama3.1}") String defaultModel,
                        @Value("${deskpilot.llm.timeout-seconds:120}") long timeoutSeconds,
                        ObjectMapper objectMapper) {
        this.baseUrl      = baseUrl;
        this.defaultModel = defaultModel;
        this.timeout      = Duration.ofSeconds(timeoutSeconds);
        this.json         = objectMapper;
        this.http         = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public String defaultModel() {
        return defaultModel;
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /** Chat with the configured default model. */
    public String chat(List<Message> messages, boolean jsonFormat) {
        return chat(defaultModel, messages, jsonFormat);
    }

    /**
     * One non-streaming chat turn.
     *
     * @param jsonFormat ask the server to constrain output to a JSON object
     * @return the assistant's text, possibly empty
     * @throws LlmUnavailableException on I/O failure or a non-2xx status
     */
    public String chat(String model, List<Message> messages, boolean jsonFormat) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",    model);
        body.put("messages", messages);
        body.put("stream",   false);
        if (jsonFormat) {
            body.put("format", "json");
        }
        body.put("options",    Map.of("num_ctx", CONTEXT_WINDOW));
        body.put("keep_alive", -1);

        log.debug("Ollama chat request: model={} messages={}", model, messages.size());
        String respBody = post("/api/chat", toJson(body), "chat");
        try {
            String text = json.readValue(respBody, ChatResponse.class).text();
            log.debug("Ollama chat response: {} chars", text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new LlmUnavailableException("Failed to parse Ollama chat response", e);
        }
    }

    /**
     * Compute an embedding with the given model.
     *
     * @throws LlmUnavailableException on I/O failure, non-2xx status or a reply without a vector
     */
    public List<Double> embed(String model, String text) {
        String respBody = post("/api/embeddings", toJson(Map.of("model", model, "prompt", text)), "embeddings");
        try {
            EmbeddingResponse parsed = json.readValue(respBody, EmbeddingResponse.class);
            if (parsed.embedding() == null || parsed.embedding().isEmpty()) {
                throw new LlmUnavailableException("Ollama returned no embedding");
            }
            return parsed.embedding();
        } catch (JsonProcessingException e) {
            throw new LlmUnavailableException("Failed to parse Ollama embeddings response", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<Double> embedding) {}

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new LlmUnavailableException(
                        "Ollama " + opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (LlmUnavailableException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("Ollama " + opName + " interrupted", e);
        } catch (Exception e) {
            throw new LlmUnavailableException("Ollama " + opName + " failed: " + e.getMessage(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new LlmUnavailableException("JSON serialization failed", e);
        }
    }
}
