package com.deskpilot.orchestrator.cli;

import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.InputSource;
import com.deskpilot.orchestrator.planner.ContextSlots;
import com.deskpilot.orchestrator.planner.ContextSnapshot;
import com.deskpilot.orchestrator.sentinel.SentinelClient;
import com.deskpilot.orchestrator.sentinel.SentinelException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Interactive console surface.
 *
 * Lines are read from stdin until {@code exit} or end of input:
 * <pre>
 *   exit           shut the process down
 *   scan           full screen scan into the vision slot
 *   debug:status   engine and slot state
 *   debug:vision   dump the vision slot
 *   debug:clear    empty both context slots
 *   anything else  executed as an utterance
 * </pre>
 */
@Component
@ConditionalOnProperty(name = "deskpilot.console.enabled", havingValue = "true")
public class ConsoleRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRunner.class);

    private final ExecutionEngine                engine;
    private final SentinelClient                 sentinel;
    private final ContextSlots                   slots;
    private final ObjectMapper                   objectMapper;
    private final ConfigurableApplicationContext context;

    public ConsoleRunner(ExecutionEngine engine,
                         SentinelClient sentinel,
                         ContextSlots slots,
                         ObjectMapper objectMapper,
                         ConfigurableApplicationContext context) {
        this.engine       = engine;
        this.sentinel     = sentinel;
        this.slots        = slots;
        this.objectMapper = objectMapper;
        this.context      = context;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        loop(in, System.out);
        log.info("Console closed, shutting down");
        System.exit(SpringApplication.exit(context, () -> 0));
    }

    /** Processes lines until {@code exit} or end of input. */
    void loop(BufferedReader in, PrintStream out) throws IOException {
        out.println("DeskPilot ready. Type a command, 'scan', 'debug:status' or 'exit'.");
        String line;
        while ((line = in.readLine()) != null) {
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if (input.equalsIgnoreCase("exit")) {
                return;
            }
            handle(input, out);
        }
    }

    void handle(String input, PrintStream out) {
        switch (input.toLowerCase(Locale.ROOT)) {
            case "scan"         -> scan(out);
            case "debug:status" -> status(out);
            case "debug:vision" -> vision(out);
            case "debug:clear"  -> {
                slots.clearVision();
                slots.clearFile();
                out.println("Context slots cleared.");
            }
            default -> print(engine.execute(input, InputSource.CONSOLE), out);
        }
    }

    // ------------------------------------------------------------------
    // Commands
    // ------------------------------------------------------------------

    private void scan(PrintStream out) {
        try {
            JsonNode tree = sentinel.scanFullTree();
            slots.updateVision(tree);
            JsonNode windows = tree.path("windows");
            out.printf("Scan complete: %d window(s), %d chars of UI tree.%n",
                    windows.isArray() ? windows.size() : 0, tree.toString().length());
        } catch (SentinelException e) {
            out.println("Scan failed: " + e.getMessage());
        }
    }

    private void status(PrintStream out) {
        out.println("busy:   " + engine.isBusy());
        out.println("silent: " + engine.isSilent());
        out.println("vision: " + slots.vision().map(s -> s.capturedAt().toString()).orElse("empty"));
        out.println("file:   " + slots.file().map(s -> s.capturedAt().toString()).orElse("empty"));
    }

    private void vision(PrintStream out) {
        ContextSnapshot snapshot = slots.vision().orElse(null);
        if (snapshot == null) {
            out.println("No vision data. Run 'scan' first.");
            return;
        }
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot.data()));
        } catch (JsonProcessingException e) {
            out.println("Could not render vision data: " + e.getOriginalMessage());
        }
    }

    private static void print(ExecutionReport report, PrintStream out) {
        if (report.message() == null) {
            out.printf("[%s] %s (%s, %d action(s))%n",
                    report.traceId(), report.status(), report.intent(), report.executedCount());
        } else {
            out.printf("[%s] %s: %s%n", report.traceId(), report.status(), report.message());
        }
    }
}
