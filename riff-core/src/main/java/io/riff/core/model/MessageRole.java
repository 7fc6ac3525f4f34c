package io.riff.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT,
    TOOL
}
