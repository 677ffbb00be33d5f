package com.deskpilot.orchestrator.kernel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Supplies the shared secret sent as the first frame of every Kernel
 * transaction.
 *
 * The token lives in a file next to the process ({@code deskpilot.token} by
 * default, with {@code bin/} as a second location). A missing or malformed
 * token is replaced by 32 fresh random bytes written owner-only.
 */
@Component
public class KernelTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(KernelTokenProvider.class);

    private static final Pattern TOKEN_FORMAT = Pattern.compile("[0-9a-fA-F]{64}");

    private final Path primary;
    private final Path fallback;
    private volatile String token;

    public KernelTokenProvider(@Value("${deskpilot.kernel.token-file:deskpilot.token}") String tokenFile) {
        this.primary  = Path.of(tokenFile);
        this.fallback = Path.of("bin").resolve(primary.getFileName());
    }

    public String token() {
        String t = token;
        if (t == null) {
            synchronized (this) {
                if (token == null) {
                    token = loadOrGenerate();
                }
                t = token;
            }
        }
        return t;
    }

    private String loadOrGenerate() {
        for (Path candidate : new Path[] {primary, fallback}) {
            try {
                if (Files.isRegularFile(candidate)) {
                    String raw = Files.readString(candidate, StandardCharsets.UTF_8).strip();
                    if (TOKEN_FORMAT.matcher(raw).matches()) {
                        log.debug("Loaded Kernel auth token from {}", candidate);
                        return raw;
                    }
                    log.warn("Ignoring malformed Kernel auth token in {}", candidate);
                }
            } catch (IOException e) {
                log.warn("Could not read Kernel auth token from {}: {}", candidate, e.getMessage());
            }
        }

        byte[] bytes = new byte[32];
        new SecureRandom().nextBytes(bytes);
        String generated = HexFormat.of().formatHex(bytes);
        try {
            Path parent = primary.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(primary, generated, StandardCharsets.UTF_8);
            restrictPermissions(primary);
            log.info("Generated new Kernel auth token at {}", primary);
        } catch (IOException e) {
            log.error("Could not persist Kernel auth token to {}; using it for this process only: {}",
                    primary, e.getMessage());
        }
        return generated;
    }

    private static void restrictPermissions(Path file) {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException | IOException e) {
            // Non-POSIX filesystems (Windows) rely on the user profile ACLs instead.
            log.debug("Could not restrict permissions on {}: {}", file, e.getMessage());
        }
    }
}
