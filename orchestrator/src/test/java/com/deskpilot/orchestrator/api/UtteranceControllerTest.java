package com.deskpilot.orchestrator.api;

import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.ExecutionStatus;
import com.deskpilot.orchestrator.engine.InputSource;
import com.deskpilot.orchestrator.planner.ContextSlots;
import com.deskpilot.orchestrator.planner.ContextSnapshot;
import com.deskpilot.orchestrator.voice.VoiceCommandHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for UtteranceController.
 *
 * Only the web layer is started; the engine, slots and voice handler are
 * mocks.
 */
@WebMvcTest(UtteranceController.class)
class UtteranceControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean ExecutionEngine     engine;
    @MockitoBean ContextSlots        slots;
    @MockitoBean VoiceCommandHandler voice;

    // ------------------------------------------------------------------
    // POST /utterances
    // ------------------------------------------------------------------

    @Test
    void execute_validText_returns200WithReport() throws Exception {
        when(engine.execute("open notepad", InputSource.API)).thenReturn(
                new ExecutionReport("abcd1234", ExecutionStatus.COMPLETED, "open_app", 4, null));

        mockMvc.perform(post("/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"text":"  open notepad "}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.traceId").value("abcd1234"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.executedCount").value(4));
    }

    @Test
    void execute_blankText_returns400() throws Exception {
        mockMvc.perform(post("/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verify(engine, never()).execute(any(), any());
    }

    @Test
    void execute_engineBusy_returns409() throws Exception {
        when(engine.execute("scan", InputSource.API)).thenReturn(ExecutionReport.busy("ffff0000"));

        mockMvc.perform(post("/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"scan\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void execute_rejectedByKernel_stillReturns200() throws Exception {
        when(engine.execute("delete everything", InputSource.API)).thenReturn(
                new ExecutionReport("t", ExecutionStatus.REJECTED, "delete", 0, "Blocked by policy"));

        mockMvc.perform(post("/utterances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"delete everything\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.message").value("Blocked by policy"));
    }

    // ------------------------------------------------------------------
    // POST /utterances/voice
    // ------------------------------------------------------------------

    @Test
    void executeVoice_noSpeech_returns204() throws Exception {
        when(voice.handle(any())).thenReturn(Optional.empty());

        mockMvc.perform(multipart("/utterances/voice")
                        .file(new MockMultipartFile("audio", "c.wav", "audio/wav", new byte[] {1, 2})))
                .andExpect(status().isNoContent());
    }

    @Test
    void executeVoice_heard_returnsReport() throws Exception {
        when(voice.handle(any())).thenReturn(Optional.of(
                new ExecutionReport("v1", ExecutionStatus.COMPLETED, "greet", 1, null)));

        mockMvc.perform(multipart("/utterances/voice")
                        .file(new MockMultipartFile("audio", "c.wav", "audio/wav", new byte[] {1, 2})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.intent").value("greet"));
    }

    // ------------------------------------------------------------------
    // GET /status
    // ------------------------------------------------------------------

    @Test
    void status_reportsEngineAndSlots() throws Exception {
        when(engine.isBusy()).thenReturn(true);
        when(slots.vision()).thenReturn(Optional.of(new ContextSnapshot(
                new ObjectMapper().createObjectNode(), Instant.parse("2024-05-01T10:00:00Z"))));
        when(slots.file()).thenReturn(Optional.empty());

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.busy").value(true))
                .andExpect(jsonPath("$.silent").value(false))
                .andExpect(jsonPath("$.visionCapturedAt").value("2024-05-01T10:00:00Z"))
                .andExpect(jsonPath("$.fileCapturedAt").doesNotExist());
    }
}
