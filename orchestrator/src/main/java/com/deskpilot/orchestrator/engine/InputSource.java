package com.deskpilot.orchestrator.engine;

/** Which producer an utterance came from; carried in the log context. */
public enum InputSource {
    CONSOLE,
    VOICE,
    API
}
