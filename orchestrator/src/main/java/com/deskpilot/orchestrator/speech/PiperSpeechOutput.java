package com.deskpilot.orchestrator.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.Clip;
import javax.sound.sampled.LineEvent;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Neural text-to-speech through a local Piper binary.
 *
 * The text is piped to Piper's stdin, Piper writes a WAV file and the file
 * is played without blocking the caller. The engine's echo pause covers
 * the playback time.
 */
@Component
@ConditionalOnProperty(name = "deskpilot.speech.engine", havingValue = "piper")
public class PiperSpeechOutput implements SpeechOutput {

    private static final Logger log = LoggerFactory.getLogger(PiperSpeechOutput.class);

    private final Path binary;
    private final Path model;
    private final Path outputFile;
    private final long timeoutSeconds;

    public PiperSpeechOutput(@Value("${deskpilot.speech.piper.binary:bin/piper/piper}") String binary,
                             @Value("${deskpilot.speech.piper.model:bin/piper/en_US-amy-medium.onnx}") String model,
                             @Value("${deskpilot.speech.piper.output-file:voice_out.wav}") String outputFile,
                             @Value("${deskpilot.speech.piper.timeout-seconds:10}") long timeoutSeconds) {
        this.binary         = Path.of(binary);
        this.model          = Path.of(model);
        this.outputFile     = Path.of(outputFile);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void say(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        // Piper reads one utterance per line
        String line = text.replace("\"", "").replace('\n', ' ');
        try {
            Process process = new ProcessBuilder(List.of(
                    binary.toString(), "--model", model.toString(), "--output_file", outputFile.toString()))
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(line.getBytes(StandardCharsets.UTF_8));
            }
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("Piper timed out after {}s", timeoutSeconds);
                return;
            }
            if (process.exitValue() != 0) {
                log.warn("Piper exited with status {}", process.exitValue());
                return;
            }
            play(outputFile);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Piper interrupted");
        } catch (IOException e) {
            log.error("Piper error: {}", e.getMessage());
        }
    }

    private void play(Path wav) {
        if (!Files.isRegularFile(wav)) {
            log.warn("Piper produced no audio at {}", wav);
            return;
        }
        try (AudioInputStream audio = AudioSystem.getAudioInputStream(wav.toFile())) {
            Clip clip = AudioSystem.getClip();
            clip.addLineListener(event -> {
                if (event.getType() == LineEvent.Type.STOP) {
                    clip.close();
                }
            });
            clip.open(audio);
            clip.start();
        } catch (Exception e) {
            log.warn("Could not play {}: {}", wav, e.getMessage());
        }
    }
}
