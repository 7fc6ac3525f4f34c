package io.riff.core.agent;

public enum TurnStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}
