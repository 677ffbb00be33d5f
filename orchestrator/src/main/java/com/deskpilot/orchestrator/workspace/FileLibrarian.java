package com.deskpilot.orchestrator.workspace;

import com.deskpilot.orchestrator.action.PathSandbox;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File operations for the LIST, READ, SEARCH, WRITE and EDIT actions.
 *
 * Every path goes through {@link PathSandbox#resolve} again here even though
 * the validator already checked it; the filesystem may have changed since.
 * Results are JSON snapshots that the engine hands to the planner's file
 * context slot.
 */
@Component
public class FileLibrarian {

    private static final Logger log = LoggerFactory.getLogger(FileLibrarian.class);

    static final int MAX_READ_CHARS   = 5000;
    static final int MAX_SEARCH_HITS  = 200;

    private final PathSandbox  sandbox;
    private final ObjectMapper json;

    public FileLibrarian(PathSandbox sandbox, ObjectMapper objectMapper) {
        this.sandbox = sandbox;
        this.json    = objectMapper;
    }

    // ------------------------------------------------------------------
    // Read-only operations
    // ------------------------------------------------------------------

    /** {@code {operation, path, entries: [{name, type, size}]}}, sorted by name. */
    public ObjectNode list(String path) {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            throw new LibrarianException(LibrarianException.Kind.NOT_FOUND, "Not a directory: " + path);
        }
        ObjectNode result = snapshot("LIST", path);
        ArrayNode entries = result.putArray("entries");
        try (Stream<Path> children = Files.list(dir)) {
            children.sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .forEach(child -> {
                        ObjectNode e = entries.addObject();
                        e.put("name", child.getFileName().toString());
                        boolean isDir = Files.isDirectory(child);
                        e.put("type", isDir ? "directory" : "file");
                        if (!isDir) {
                            e.put("size", sizeOf(child));
                        }
                    });
        } catch (IOException e) {
            throw new LibrarianException(LibrarianException.Kind.IO_ERROR, "Cannot list " + path, e);
        }
        log.info("Listed {} ({} entries)", path, entries.size());
        return result;
    }

    /** {@code {operation, path, content, truncated, size}}; content is at most 5000 chars. */
    public ObjectNode read(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new LibrarianException(LibrarianException.Kind.NOT_FOUND, "No such file: " + path);
        }
        String content = readString(file, path);
        ObjectNode result = snapshot("READ", path);
        boolean truncated = content.length() > MAX_READ_CHARS;
        result.put("content",   truncated ? content.substring(0, MAX_READ_CHARS) : content);
        result.put("truncated", truncated);
        result.put("size",      content.length());
        log.info("Read {} ({} chars{})", path, content.length(), truncated ? ", truncated" : "");
        return result;
    }

    /**
     * Recursive glob search. A pattern without a separator matches file
     * names at any depth; one with a separator matches the path relative to
     * {@code directory}.
     *
     * @return {@code {operation, directory, pattern, matches: [...], truncated}}
     */
    public ObjectNode search(String directory, String pattern) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            throw new LibrarianException(LibrarianException.Kind.NOT_FOUND, "Not a directory: " + directory);
        }
        boolean byName = !pattern.contains("/");
        PathMatcher matcher;
        try {
            matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        } catch (IllegalArgumentException e) {
            throw new LibrarianException(LibrarianException.Kind.INVALID_PATTERN,
                    "Malformed glob '" + pattern + "': " + e.getMessage(), e);
        }

        ObjectNode result = json.createObjectNode();
        result.put("operation", "SEARCH");
        result.put("directory", directory);
        result.put("pattern",   pattern);
        ArrayNode matches = result.putArray("matches");

        List<Path> hits;
        try (Stream<Path> walk = Files.walk(dir)) {
            hits = walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(byName ? p.getFileName() : dir.relativize(p)))
                    .sorted()
                    .limit(MAX_SEARCH_HITS + 1L)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new LibrarianException(LibrarianException.Kind.IO_ERROR, "Cannot search " + directory, e);
        }
        hits.stream().limit(MAX_SEARCH_HITS)
                .forEach(p -> matches.add(sandbox.root().relativize(p).toString().replace('\\', '/')));
        result.put("truncated", hits.size() > MAX_SEARCH_HITS);
        log.info("Search {} in {}: {} match(es)", pattern, directory, matches.size());
        return result;
    }

    // ------------------------------------------------------------------
    // Mutating operations
    // ------------------------------------------------------------------

    /** Create or overwrite; parent directories are created as needed. */
    public ObjectNode write(String path, String content) {
        Path file = resolve(path);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LibrarianException(LibrarianException.Kind.IO_ERROR, "Cannot write " + path, e);
        }
        ObjectNode result = snapshot("WRITE", path);
        result.put("bytes", content.getBytes(StandardCharsets.UTF_8).length);
        log.info("Wrote {} ({} chars)", path, content.length());
        return result;
    }

    /** Replace the first occurrence of {@code find}; it must be present. */
    public ObjectNode edit(String path, String find, String replace) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new LibrarianException(LibrarianException.Kind.NOT_FOUND, "No such file: " + path);
        }
        String content = readString(file, path);
        int at = content.indexOf(find);
        if (at < 0) {
            throw new LibrarianException(LibrarianException.Kind.FIND_NOT_PRESENT,
                    "Text to replace not found in " + path);
        }
        String updated = content.substring(0, at) + replace + content.substring(at + find.length());
        try {
            Files.writeString(file, updated, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LibrarianException(LibrarianException.Kind.IO_ERROR, "Cannot write " + path, e);
        }
        ObjectNode result = snapshot("EDIT", path);
        result.put("replaced_at", at);
        log.info("Edited {} at offset {}", path, at);
        return result;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path resolve(String path) {
        try {
            return sandbox.resolve(path);
        } catch (SecurityException e) {
            throw new LibrarianException(LibrarianException.Kind.UNSAFE_PATH, e.getMessage(), e);
        }
    }

    private ObjectNode snapshot(String operation, String path) {
        ObjectNode node = json.createObjectNode();
        node.put("operation", operation);
        node.put("path",      path);
        return node;
    }

    private static String readString(Path file, String path) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LibrarianException(LibrarianException.Kind.IO_ERROR, "Cannot read " + path, e);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1;
        }
    }
}
