package com.deskpilot.orchestrator.voice;

import java.nio.file.Path;

/**
 * Speech-to-text for captured push-to-talk audio.
 */
public interface Transcriber {

    /**
     * @return the recognised text, empty when nothing was said
     * @throws TranscriptionException when the engine fails
     */
    String transcribe(Path audio);

    /** Unload the model or release connections on shutdown. */
    default void close() {}
}
