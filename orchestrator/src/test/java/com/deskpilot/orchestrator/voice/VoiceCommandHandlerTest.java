package com.deskpilot.orchestrator.voice;

import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.ExecutionStatus;
import com.deskpilot.orchestrator.engine.InputSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for VoiceCommandHandler: echo rejection, transcription
 * failures and capture cleanup.
 */
@ExtendWith(MockitoExtension.class)
class VoiceCommandHandlerTest {

    @TempDir Path dir;

    @Mock ExecutionEngine engine;
    @Mock Transcriber     transcriber;

    VoiceCommandHandler handler;
    Path capture;

    @BeforeEach
    void setUp() throws Exception {
        handler = new VoiceCommandHandler(engine, transcriber);
        capture = Files.write(dir.resolve("capture.wav"), new byte[] {1, 2, 3});
    }

    @Test
    void handle_engineBusy_dropsCaptureWithoutTranscribing() {
        when(engine.isBusy()).thenReturn(true);

        Optional<ExecutionReport> report = handler.handle(capture);

        assertThat(report).hasValueSatisfying(r ->
                assertThat(r.status()).isEqualTo(ExecutionStatus.REJECTED_BUSY));
        assertThat(Files.exists(capture)).isFalse();
        verifyNoInteractions(transcriber);
        verify(engine, never()).execute(any(), any());
    }

    @Test
    void handle_speechHeard_executedAsVoiceInput() {
        ExecutionReport done = new ExecutionReport("abc", ExecutionStatus.COMPLETED, "open_app", 4, null);
        when(transcriber.transcribe(capture)).thenReturn("open notepad");
        when(engine.execute("open notepad", InputSource.VOICE)).thenReturn(done);

        assertThat(handler.handle(capture)).hasValue(done);
        assertThat(Files.exists(capture)).isFalse();
    }

    @Test
    void handle_silence_nothingExecuted() {
        when(transcriber.transcribe(capture)).thenReturn("   ");

        assertThat(handler.handle(capture)).isEmpty();
        verify(engine, never()).execute(any(), any());
    }

    @Test
    void handle_transcriptionFails_emptyAndCaptureDeleted() {
        when(transcriber.transcribe(capture)).thenThrow(new TranscriptionException("whisper down"));

        assertThat(handler.handle(capture)).isEmpty();
        assertThat(Files.exists(capture)).isFalse();
    }
}
