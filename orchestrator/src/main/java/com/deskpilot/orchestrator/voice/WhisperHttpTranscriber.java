package com.deskpilot.orchestrator.voice;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Transcribes audio through a local Whisper server exposing the
 * OpenAI-compatible {@code POST /v1/audio/transcriptions} endpoint
 * (multipart upload, JSON {@code {"text": ...}} reply).
 */
@Component
public class WhisperHttpTranscriber implements Transcriber {

    private static final Logger log = LoggerFactory.getLogger(WhisperHttpTranscriber.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranscriptionResponse(String text) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       model;
    private final Duration     timeout;

    public WhisperHttpTranscriber(@Value("${deskpilot.voice.whisper-url:http://localhost:8178}") String baseUrl,
                                  @Value("${deskpilot.voice.model:tiny.en}") String model,
                                  @Value("${deskpilot.voice.timeout-seconds:30}") long timeoutSeconds,
                                  ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.model   = model;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public String transcribe(Path audio) {
        String boundary = "----deskpilot" + UUID.randomUUID().toString().replace("-", "");
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/audio/transcriptions"))
                    .timeout(timeout)
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(multipart(boundary, audio)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new TranscriptionException(
                        "Transcription failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            String text = json.readValue(resp.body(), TranscriptionResponse.class).text();
            log.debug("Transcribed {} -> '{}'", audio.getFileName(), text);
            return text == null ? "" : text.strip();
        } catch (TranscriptionException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new TranscriptionException("Failed to parse transcription response", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Transcription interrupted", e);
        } catch (IOException e) {
            throw new TranscriptionException("Transcription failed: " + e.getMessage(), e);
        }
    }

    private byte[] multipart(String boundary, Path audio) throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        String modelPart = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"model\"\r\n\r\n"
                + model + "\r\n";
        String fileHeader = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + audio.getFileName() + "\"\r\n"
                + "Content-Type: audio/wav\r\n\r\n";
        body.write(modelPart.getBytes(StandardCharsets.UTF_8));
        body.write(fileHeader.getBytes(StandardCharsets.UTF_8));
        body.write(Files.readAllBytes(audio));
        body.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return body.toByteArray();
    }
}
