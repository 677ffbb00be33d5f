package com.deskpilot.orchestrator.action;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Decides whether a path named by a plan stays inside the sandbox root.
 *
 * A path is safe iff it is relative and its resolution against the root
 * does not escape the root, neither lexically ({@code ..}) nor through a
 * symlink anywhere along the path, including a dangling one whose target
 * does not exist yet. Every error is treated as unsafe.
 */
@Component
public class PathSandbox {

    // Drive-letter and UNC forms are absolute on Windows even when the JVM runs elsewhere.
    private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^([A-Za-z]:|\\\\\\\\|\\\\)");

    private static final int MAX_LINK_DEPTH = 40;

    private final Path root;

    @Autowired
    public PathSandbox(@Value("${deskpilot.sandbox.root:}") String root) {
        this(root == null || root.isBlank() ? Path.of("") : Path.of(root));
    }

    public PathSandbox(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public boolean isSafe(String path) {
        try {
            resolve(path);
            return true;
        } catch (Exception e) {
            return false;
        }
    }

    /**
     * Resolve a plan path against the root.
     *
     * @throws SecurityException if the path is absolute or escapes the root
     */
    public Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new SecurityException("Empty path");
        }
        if (WINDOWS_ABSOLUTE.matcher(path).find()) {
            throw new SecurityException("Absolute path not allowed: " + path);
        }
        Path relative = Path.of(path);
        if (relative.isAbsolute()) {
            throw new SecurityException("Absolute path not allowed: " + path);
        }
        Path target = root.resolve(relative).normalize();
        if (!target.startsWith(root)) {
            throw new SecurityException("Path escapes sandbox: " + path);
        }
        checkLinks(target, path);
        return target;
    }

    // Walks the target one component at a time, following every link (dangling ones
    // included) the way the filesystem would, and requires the result to stay in the root.
    private void checkLinks(Path target, String original) {
        try {
            Path realRoot = realize(root, 0);
            if (!realize(target, 0).startsWith(realRoot)) {
                throw new SecurityException("Path escapes sandbox through a link: " + original);
            }
        } catch (IOException e) {
            throw new SecurityException("Cannot resolve path: " + original, e);
        }
    }

    /**
     * Physical location of an absolute path: links are replaced by their
     * targets, and the first missing component ends the walk, since nothing
     * below it can be a link.
     */
    static Path realize(Path path, int depth) throws IOException {
        if (depth > MAX_LINK_DEPTH) {
            throw new IOException("Too many levels of symbolic links: " + path);
        }
        Path result = path.getRoot();
        int names = path.getNameCount();
        for (int i = 0; i < names; i++) {
            Path next = result.resolve(path.getName(i));
            if (Files.isSymbolicLink(next)) {
                next = realize(result.resolve(Files.readSymbolicLink(next)).normalize(), depth + 1);
            } else if (!Files.exists(next, LinkOption.NOFOLLOW_LINKS)) {
                return i + 1 < names ? next.resolve(path.subpath(i + 1, names)) : next;
            }
            result = next;
        }
        return result;
    }
}
