package io.riff.core.event;

public enum TurnEventType {
    REASONING_STARTED,
    REASONING_CHUNK,
    REASONING_ENDED,
    NARRATION_STARTED,
    NARRATION_CHUNK,
    NARRATION_ENDED,
    CALL_STARTED,
    CALL_REQUESTED,
    CALL_RESOLVED,
    CALL_ENDED,
    ERROR,
    DONE
}
