package com.deskpilot.orchestrator.cli;

import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.ExecutionStatus;
import com.deskpilot.orchestrator.engine.InputSource;
import com.deskpilot.orchestrator.planner.ContextSlots;
import com.deskpilot.orchestrator.sentinel.SentinelClient;
import com.deskpilot.orchestrator.sentinel.SentinelException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Console command routing. The loop is fed from a string instead of stdin.
 */
@ExtendWith(MockitoExtension.class)
class ConsoleRunnerTest {

    @Mock ExecutionEngine                engine;
    @Mock SentinelClient                 sentinel;
    @Mock ConfigurableApplicationContext context;

    ObjectMapper json = new ObjectMapper();
    ContextSlots slots = new ContextSlots();
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    ConsoleRunner runner;

    @BeforeEach
    void setUp() {
        runner = new ConsoleRunner(engine, sentinel, slots, json, context);
    }

    private String run(String input) throws Exception {
        runner.loop(new BufferedReader(new StringReader(input)), out);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void loop_utterance_executedAsConsoleInput() throws Exception {
        when(engine.execute("open notepad", InputSource.CONSOLE)).thenReturn(
                new ExecutionReport("abcd1234", ExecutionStatus.COMPLETED, "open_app", 4, null));

        String output = run("open notepad\n");

        assertThat(output).contains("[abcd1234] COMPLETED (open_app, 4 action(s))");
    }

    @Test
    void loop_blankLinesSkipped_exitStops() throws Exception {
        run("\n   \nexit\nopen notepad\n");

        verify(engine, never()).execute(any(), any());
    }

    @Test
    void loop_scan_fillsVisionSlot() throws Exception {
        ObjectNode tree = json.createObjectNode();
        tree.putArray("windows").addObject().put("name", "Notepad");
        when(sentinel.scanFullTree()).thenReturn(tree);

        String output = run("scan\n");

        assertThat(output).contains("Scan complete: 1 window(s)");
        assertThat(slots.vision()).isPresent();
    }

    @Test
    void loop_scanFails_reportsError() throws Exception {
        when(sentinel.scanFullTree()).thenThrow(new SentinelException("Sentinel unavailable"));

        assertThat(run("scan\n")).contains("Scan failed: Sentinel unavailable");
        assertThat(slots.vision()).isEmpty();
    }

    @Test
    void loop_debugClear_emptiesBothSlots() throws Exception {
        slots.updateVision(json.createObjectNode());
        slots.updateFile(json.createObjectNode());

        String output = run("debug:clear\ndebug:status\n");

        assertThat(slots.vision()).isEmpty();
        assertThat(slots.file()).isEmpty();
        assertThat(output).contains("vision: empty").contains("file:   empty");
        verify(engine, never()).execute(any(), any());
    }

    @Test
    void loop_debugVisionWithoutScan_hints() throws Exception {
        assertThat(run("debug:vision\n")).contains("Run 'scan' first");
    }
}
