package com.deskpilot.orchestrator.kernel;

import com.deskpilot.orchestrator.kernel.dto.MemoryArtifact;
import com.deskpilot.orchestrator.kernel.dto.PermissionRequest;
import com.deskpilot.orchestrator.kernel.dto.PermissionResponse;
import com.deskpilot.orchestrator.kernel.dto.ReflexHit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional client for the Kernel (permission + long-term memory service).
 *
 * Every call is one short-lived TCP exchange:
 * <pre>
 *   connect → {"auth_token": ...}\n → {request}\n → read one response line → close
 * </pre>
 * No connection is pooled or held between calls; a Kernel restart never
 * leaves a stale socket behind.
 *
 * Failure policy: timeouts, refused connections and unparseable replies are
 * logged and turned into "no data" (empty Optional, empty list, false). None
 * of the public methods throw; the planner and the engine always proceed in
 * degraded mode.
 */
@Component
public class KernelClient {

    private static final Logger log = LoggerFactory.getLogger(KernelClient.class);

    /** Cached plans at or below this score are ignored. */
    public static final double REFLEX_TRUST_THRESHOLD = 5;

    private static final int DEFAULT_MAX_BYTES = 4096;
    private static final int SEARCH_MAX_BYTES  = 8192;

    private final String              host;
    private final int                 port;
    private final Duration            timeout;
    private final Duration            searchTimeout;
    private final KernelTokenProvider tokens;
    private final ObjectMapper        json;

    public KernelClient(@Value("${deskpilot.kernel.host:localhost}") String host,
                        @Value("${deskpilot.kernel.port:5005}") int port,
                        @Value("${deskpilot.kernel.timeout-ms:2000}") long timeoutMs,
                        @Value("${deskpilot.kernel.search-timeout-ms:3000}") long searchTimeoutMs,
                        KernelTokenProvider tokens,
                        ObjectMapper objectMapper) {
        this.host          = host;
        this.port          = port;
        this.timeout       = Duration.ofMillis(timeoutMs);
        this.searchTimeout = Duration.ofMillis(searchTimeoutMs);
        this.tokens        = tokens;
        this.json          = objectMapper;
    }

    // ------------------------------------------------------------------
    // Reflex cache
    // ------------------------------------------------------------------

    /**
     * Ask the Kernel for a cached plan for this exact intent text.
     *
     * @return the cached plan only when the Kernel found one and its trust
     *         score is strictly above {@link #REFLEX_TRUST_THRESHOLD}
     */
    public Optional<ReflexHit> queryReflex(String intent) {
        try {
            JsonNode resp = exchange(request("reflex_query", Map.of("intent", intent)),
                    timeout, DEFAULT_MAX_BYTES);
            if (!resp.path("found").asBoolean(false)) {
                return Optional.empty();
            }
            double trust = resp.path("trust_score").asDouble(0);
            JsonNode cached = resp.path("cached_plan");
            if (trust <= REFLEX_TRUST_THRESHOLD || cached.isMissingNode() || cached.isNull()) {
                log.debug("Reflex for '{}' ignored (trust score {})", intent, trust);
                return Optional.empty();
            }
            // The Kernel stores plans as JSON text; accept an inline object too.
            JsonNode plan = cached.isTextual() ? json.readTree(cached.asText()) : cached;
            if (plan == null || !plan.isObject()) {
                return Optional.empty();
            }
            log.info("Reflex found for '{}' (trust score {})", intent, trust);
            return Optional.of(new ReflexHit(plan, trust));
        } catch (KernelException | JsonProcessingException e) {
            log.debug("Reflex query unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Drop the cached plan for an intent after it failed. Fire-and-forget:
     * the Kernel does not acknowledge invalidations, so success means the
     * frame was delivered.
     */
    public boolean invalidateReflex(String intent) {
        try (Socket socket = open(timeout)) {
            OutputStream out = socket.getOutputStream();
            out.write(frame(Map.of("auth_token", tokens.token())));
            out.write(frame(request("invalidate_reflex", Map.of("intent", intent))));
            out.flush();
            log.info("Invalidated reflex cache for '{}'", intent);
            return true;
        } catch (IOException | KernelException e) {
            log.debug("Could not invalidate reflex for '{}' (Kernel unavailable): {}", intent, e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Long-term memory
    // ------------------------------------------------------------------

    /**
     * Store a fact in the Kernel's memory.
     *
     * @param vector optional embedding; omitted from the frame when null
     * @return true when the Kernel answered {@code success} or {@code approved}
     */
    public boolean storeMemory(String key, String value, String context, String traceId, List<Double> vector) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("key",      key);
        fields.put("value",    value);
        fields.put("context",  context);
        fields.put("trace_id", traceId);
        if (vector != null && !vector.isEmpty()) {
            fields.put("vector", vector);
        }
        try {
            JsonNode resp = exchange(request("memory_store", fields), timeout, DEFAULT_MAX_BYTES);
            boolean ok = resp.path("success").asBoolean(false) || resp.path("approved").asBoolean(false);
            if (ok) {
                log.info("Kernel stored memory {} = {}", key, value);
            } else {
                log.warn("Kernel refused memory {}: {}", key, resp.path("error").asText("unknown error"));
            }
            return ok;
        } catch (KernelException e) {
            log.debug("Kernel memory store unavailable: {}", e.getMessage());
            return false;
        }
    }

    /** Vector search over the Kernel's memory; empty on any failure. */
    public List<MemoryArtifact> searchMemory(List<Double> vector, int limit) {
        try {
            JsonNode resp = exchange(request("memory_search", Map.of("vector", vector, "limit", limit)),
                    searchTimeout, SEARCH_MAX_BYTES);
            JsonNode artifacts = resp.path("artifacts");
            if (!artifacts.isArray()) {
                return List.of();
            }
            List<MemoryArtifact> result = new ArrayList<>();
            for (JsonNode a : artifacts) {
                result.add(json.treeToValue(a, MemoryArtifact.class));
            }
            return result;
        } catch (KernelException | JsonProcessingException | IllegalArgumentException e) {
            log.debug("Kernel memory search unavailable: {}", e.getMessage());
            return List.of();
        }
    }

    // ------------------------------------------------------------------
    // Permission
    // ------------------------------------------------------------------

    /**
     * Ask the Kernel whether the actions in this request may run.
     *
     * @return empty when the Kernel is unreachable or its reply cannot be
     *         parsed; the caller decides how to degrade
     */
    public Optional<PermissionResponse> requestPermission(PermissionRequest request) {
        try {
            JsonNode resp = exchange(request, timeout, DEFAULT_MAX_BYTES);
            return Optional.of(json.treeToValue(resp, PermissionResponse.class));
        } catch (KernelException | JsonProcessingException | IllegalArgumentException e) {
            log.debug("Kernel permission call unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Transport
    // ------------------------------------------------------------------

    /**
     * One full transaction. Package-private so tests can drive it against
     * an in-process server.
     */
    JsonNode exchange(Object request, Duration deadline, int maxBytes) {
        try (Socket socket = open(deadline)) {
            OutputStream out = socket.getOutputStream();
            out.write(frame(Map.of("auth_token", tokens.token())));
            out.write(frame(request));
            out.flush();

            String raw = readFrame(socket.getInputStream(), maxBytes).strip();
            if (raw.isEmpty()) {
                throw new KernelException("Kernel closed the connection without a response");
            }
            return json.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Kernel response parse error: {}", e.getOriginalMessage());
            throw new KernelException("Malformed Kernel response", e);
        } catch (IOException e) {
            throw new KernelException("Kernel unavailable at " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    private Socket open(Duration deadline) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) deadline.toMillis());
            socket.setSoTimeout((int) deadline.toMillis());
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    /** Reads up to the first newline, end of stream or {@code maxBytes}, whichever comes first. */
    private static String readFrame(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while (buf.size() < maxBytes && (b = in.read()) != -1) {
            if (b == '\n') {
                break;
            }
            buf.write(b);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }

    private byte[] frame(Object payload) {
        try {
            return (json.writeValueAsString(payload) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new KernelException("JSON serialization failed", e);
        }
    }

    private static Map<String, Object> request(String type, Map<String, ?> fields) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.putAll(fields);
        return body;
    }
}
