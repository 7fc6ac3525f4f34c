package io.riff.core.provider;

public enum DeltaKind {
    REASONING,
    NARRATION,
    CALL
}
