package com.deskpilot.orchestrator.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Local user profile on disk: remembered facts plus a bounded change log.
 *
 * <pre>
 * {
 *   "identity": { ... },                       (optional persona, never written here)
 *   "facts":    { key: {value, context, timestamp, updated_count} },
 *   "history":  [ {key, value, context, timestamp}, ... ]   (last 100)
 * }
 * </pre>
 *
 * Writes are read-modify-write under a single lock and land atomically
 * through a temp file. Blocks this class does not own (such as
 * {@code identity}) are carried over untouched.
 */
@Component
public class LocalFactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFactStore.class);

    static final int HISTORY_LIMIT = 100;

    private final Path          profilePath;
    private final ObjectMapper  json;
    private final Clock         clock;
    private final ReentrantLock lock = new ReentrantLock();

    public LocalFactStore(@Value("${deskpilot.memory.profile-path:data/user_profile.json}") String profilePath,
                          ObjectMapper objectMapper) {
        this(Path.of(profilePath), objectMapper, Clock.systemDefaultZone());
    }

    LocalFactStore(Path profilePath, ObjectMapper objectMapper, Clock clock) {
        this.profilePath = profilePath;
        this.json        = objectMapper;
        this.clock       = clock;
    }

    public Path profilePath() {
        return profilePath;
    }

    // ------------------------------------------------------------------
    // Writes
    // ------------------------------------------------------------------

    /**
     * Remember {@code key = value}.
     *
     * Storing the value a key already holds changes nothing on disk and
     * still counts as success.
     *
     * @return false when the profile could not be read or written
     */
    public boolean store(String key, String value, String context) {
        lock.lock();
        try {
            ObjectNode profile = readProfile();
            ObjectNode facts   = objectField(profile, "facts");

            JsonNode existing = facts.path(key);
            if (existing.isObject() && value.equals(existing.path("value").asText(null))) {
                log.debug("Fact already known: {} = {}", key, value);
                return true;
            }

            String now = LocalDateTime.now(clock).toString();
            ObjectNode fact = json.createObjectNode();
            fact.put("value",         value);
            fact.put("context",       context);
            fact.put("timestamp",     now);
            fact.put("updated_count", existing.path("updated_count").asInt(0) + 1);
            facts.set(key, fact);

            ArrayNode history = arrayField(profile, "history");
            ObjectNode entry = history.addObject();
            entry.put("key",       key);
            entry.put("value",     value);
            entry.put("context",   context);
            entry.put("timestamp", now);
            while (history.size() > HISTORY_LIMIT) {
                history.remove(0);
            }

            writeAtomically(profile);
            log.info("Stored fact {} = {} ({} facts in profile)", key, value, facts.size());
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Local fact store failed for '{}': {}", key, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    /** All facts in insertion order; empty when the profile is missing or unreadable. */
    public Map<String, Fact> facts() {
        JsonNode facts = snapshot().path("facts");
        if (!facts.isObject()) {
            return Map.of();
        }
        Map<String, Fact> result = new LinkedHashMap<>();
        facts.fields().forEachRemaining(e -> {
            try {
                result.put(e.getKey(), json.treeToValue(e.getValue(), Fact.class));
            } catch (IOException | IllegalArgumentException ex) {
                log.debug("Skipping malformed fact '{}': {}", e.getKey(), ex.getMessage());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public Optional<Fact> fact(String key) {
        return Optional.ofNullable(facts().get(key));
    }

    /** Change log, oldest first. */
    public List<HistoryEntry> history() {
        JsonNode history = snapshot().path("history");
        if (!history.isArray()) {
            return List.of();
        }
        List<HistoryEntry> result = new ArrayList<>();
        for (JsonNode h : history) {
            try {
                result.add(json.treeToValue(h, HistoryEntry.class));
            } catch (IOException | IllegalArgumentException e) {
                log.debug("Skipping malformed history entry: {}", e.getMessage());
            }
        }
        return List.copyOf(result);
    }

    /** The optional persona block; empty when absent or not an object. */
    public Optional<JsonNode> identity() {
        JsonNode identity = snapshot().path("identity");
        return identity.isObject() && identity.size() > 0 ? Optional.of(identity) : Optional.empty();
    }

    // ------------------------------------------------------------------
    // File I/O
    // ------------------------------------------------------------------

    private ObjectNode snapshot() {
        lock.lock();
        try {
            return readProfile();
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read profile {}: {}", profilePath, e.getMessage());
            return json.createObjectNode();
        } finally {
            lock.unlock();
        }
    }

    private ObjectNode readProfile() throws IOException {
        if (!Files.isRegularFile(profilePath)) {
            return json.createObjectNode();
        }
        JsonNode root = json.readTree(profilePath.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Profile " + profilePath + " is not a JSON object");
        }
        return (ObjectNode) root;
    }

    private void writeAtomically(ObjectNode profile) throws IOException {
        Path dir = profilePath.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, profilePath.getFileName().toString(), ".tmp");
        try {
            json.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), profile);
            restrictPermissions(tmp);
            try {
                Files.move(tmp, profilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, profilePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private ObjectNode objectField(ObjectNode parent, String name) {
        JsonNode node = parent.get(name);
        if (node instanceof ObjectNode obj) {
            return obj;
        }
        return parent.putObject(name);
    }

    private ArrayNode arrayField(ObjectNode parent, String name) {
        JsonNode node = parent.get(name);
        if (node instanceof ArrayNode arr) {
            return arr;
        }
        return parent.putArray(name);
    }

    private static void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            log.debug("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }
}
