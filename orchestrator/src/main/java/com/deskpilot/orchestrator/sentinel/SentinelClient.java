package com.deskpilot.orchestrator.sentinel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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
import java.time.Instant;
import java.util.Map;

/**
 * HTTP client for the Sentinel, the local service that drives the keyboard
 * and mouse and reads the accessibility tree.
 *
 * Input calls are fire-and-check: a 2xx means the Sentinel performed the
 * action, anything else becomes a {@link SentinelException}. Only
 * {@link #scanFullTree()} and {@link #focusedWindow()} return data.
 */
@Component
public class SentinelClient {

    private static final Logger log = LoggerFactory.getLogger(SentinelClient.class);

    private static final Duration INPUT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SCAN_TIMEOUT  = Duration.ofSeconds(30);
    private static final Duration READY_POLL    = Duration.ofMillis(500);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public SentinelClient(@Value("${deskpilot.sentinel.base-url:http://localhost:5006}") String baseUrl,
                          ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Poll {@code GET /health} until the Sentinel answers 2xx or the
     * deadline passes.
     *
     * @return true once the Sentinel is ready
     */
    public boolean awaitReady(Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                HttpRequest req = HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/health"))
                        .timeout(INPUT_TIMEOUT)
                        .GET()
                        .build();
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
                    log.info("Sentinel ready at {} after {} attempt(s)", baseUrl, attempts);
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (Exception e) {
                log.debug("Sentinel not ready yet: {}", e.getMessage());
            }
            if (Instant.now().plus(READY_POLL).isAfter(deadline)) {
                log.warn("Sentinel did not become ready within {}", timeout);
                return false;
            }
            try {
                Thread.sleep(READY_POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /** Ask the Sentinel to terminate. Errors are logged, never thrown. */
    public void shutdown() {
        try {
            post("/shutdown", "{}", "shutdown", INPUT_TIMEOUT);
            log.info("Sentinel terminated");
        } catch (SentinelException e) {
            log.warn("Error terminating Sentinel: {}", e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Input
    // ------------------------------------------------------------------

    public void typeText(String text) {
        post("/input/type", toJson(Map.of("text", text)), "typeText", INPUT_TIMEOUT);
    }

    public void pressKey(String key) {
        post("/input/key", toJson(Map.of("key", key)), "pressKey(" + key + ")", INPUT_TIMEOUT);
    }

    public void click(double x, double y) {
        post("/input/click", toJson(Map.of("x", (int) Math.round(x), "y", (int) Math.round(y))),
                "click", INPUT_TIMEOUT);
    }

    // ------------------------------------------------------------------
    // Vision
    // ------------------------------------------------------------------

    /** Full accessibility tree of every visible window. */
    public JsonNode scanFullTree() {
        return parse(post("/vision/scan", "{}", "scanFullTree", SCAN_TIMEOUT), "scanFullTree");
    }

    /** The element that currently has focus: {@code {name, control_type, ...}}. */
    public JsonNode focusedWindow() {
        return parse(get("/vision/focused", "focusedWindow"), "focusedWindow");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String get(String path, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(INPUT_TIMEOUT)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            return send(req, opName);
        } catch (SentinelException e) {
            throw e;
        } catch (Exception e) {
            throw new SentinelException(opName + " failed", e);
        }
    }

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            return send(req, opName);
        } catch (SentinelException e) {
            throw e;
        } catch (Exception e) {
            throw new SentinelException(opName + " failed", e);
        }
    }

    private String send(HttpRequest req, String opName) throws Exception {
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SentinelException(opName + " interrupted", e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new SentinelException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return resp.body();
    }

    private JsonNode parse(String body, String opName) {
        try {
            return json.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new SentinelException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new SentinelException("JSON serialization failed", e);
        }
    }
}
