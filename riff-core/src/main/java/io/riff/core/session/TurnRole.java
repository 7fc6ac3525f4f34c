package io.riff.core.session;

public enum TurnRole {
    USER,
    AGENT
}
