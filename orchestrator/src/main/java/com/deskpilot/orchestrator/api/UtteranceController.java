package com.deskpilot.orchestrator.api;

import com.deskpilot.orchestrator.api.dto.StatusResponse;
import com.deskpilot.orchestrator.api.dto.UtteranceRequest;
import com.deskpilot.orchestrator.engine.ExecutionEngine;
import com.deskpilot.orchestrator.engine.ExecutionReport;
import com.deskpilot.orchestrator.engine.ExecutionStatus;
import com.deskpilot.orchestrator.engine.InputSource;
import com.deskpilot.orchestrator.planner.ContextSlots;
import com.deskpilot.orchestrator.planner.ContextSnapshot;
import com.deskpilot.orchestrator.voice.VoiceCommandHandler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * HTTP surface over the execution engine.
 *
 * POST /utterances        execute one text command
 * POST /utterances/voice  execute one push-to-talk capture (WAV upload)
 * GET  /status            engine and context slot state
 *
 * A command arriving while another executes gets 409; the engine never queues.
 */
@RestController
public class UtteranceController {

    private final ExecutionEngine     engine;
    private final ContextSlots        slots;
    private final VoiceCommandHandler voice;

    public UtteranceController(ExecutionEngine engine, ContextSlots slots, VoiceCommandHandler voice) {
        this.engine = engine;
        this.slots  = slots;
        this.voice  = voice;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/utterances \
     *     -H "Content-Type: application/json" \
     *     -d '{"text":"open notepad"}'
     */
    @PostMapping("/utterances")
    public ExecutionReport execute(@RequestBody UtteranceRequest req) {
        if (req == null || req.text() == null || req.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text must not be blank");
        }
        return rejectIfBusy(engine.execute(req.text().strip(), InputSource.API));
    }

    /**
     * Returns 204 when the capture held no speech.
     */
    @PostMapping(value = "/utterances/voice", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ExecutionReport> executeVoice(@RequestParam("audio") MultipartFile audio) {
        if (audio.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "audio must not be empty");
        }
        Path capture;
        try {
            capture = Files.createTempFile("deskpilot-capture-", ".wav");
            audio.transferTo(capture);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Could not store capture", e);
        }
        return voice.handle(capture)
                .map(this::rejectIfBusy)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return new StatusResponse(
                engine.isBusy(),
                engine.isSilent(),
                slots.vision().map(ContextSnapshot::capturedAt).orElse(null),
                slots.file().map(ContextSnapshot::capturedAt).orElse(null));
    }

    private ExecutionReport rejectIfBusy(ExecutionReport report) {
        if (report.status() == ExecutionStatus.REJECTED_BUSY) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, report.message());
        }
        return report;
    }
}
