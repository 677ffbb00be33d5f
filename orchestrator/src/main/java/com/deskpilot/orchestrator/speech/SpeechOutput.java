package com.deskpilot.orchestrator.speech;

/**
 * Says something to the user. Implementations must not throw; a failed
 * utterance is logged and the plan carries on.
 */
public interface SpeechOutput {

    void say(String text);

    /** Release engine resources on shutdown. */
    default void close() {}
}
