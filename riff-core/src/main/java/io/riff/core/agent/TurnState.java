package io.riff.core.agent;

public enum TurnState {
    IDLE,
    STREAMING,
    THINKING,
    RESPONDING,
    DISPATCHING,
    CONTINUING,
    DONE,
    ERROR
}
