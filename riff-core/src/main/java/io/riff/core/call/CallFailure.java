package io.riff.core.call;

public enum CallFailure {
    NONE,
    UNKNOWN_CALL,
    INVALID_ARGUMENTS,
    SANDBOX
}
