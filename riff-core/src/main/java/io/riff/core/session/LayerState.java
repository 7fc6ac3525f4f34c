package io.riff.core.session;

public enum LayerState {
    ACTIVE,
    STOPPED
}
