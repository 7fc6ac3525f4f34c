package io.riff.core.call;

import java.util.Optional;

public enum CallKind {
    PLAY_SYNTH("play_synth"),
    PLAY_DRUMS("play_drums"),
    SET_TEMPO("set_tempo"),
    SET_SCALE("set_scale"),
    SET_ROOT("set_root"),
    STOP_PLAYER("stop_player"),
    STOP_ALL("stop_all"),
    MODIFY_LAYER("modify_layer"),
    EXECUTE_CODE("execute_code"),
    GET_SESSION_STATE("get_session_state");

    private final String wireName;

    CallKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CallKind> fromWireName(String name) {
        for (CallKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
