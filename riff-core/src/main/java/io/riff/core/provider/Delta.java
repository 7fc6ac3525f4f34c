package io.riff.core.provider;

import io.riff.core.model.ToolCall;
import java.util.Objects;

public record Delta(DeltaKind kind, String text, ToolCall call) {

    public Delta {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == DeltaKind.CALL) {
            Objects.requireNonNull(call, "call must not be null for a call delta");
            text = "";
        } else {
            text = text == null ? "" : text;
            call = null;
        }
    }

    public static Delta reasoning(String text) {
        return new Delta(DeltaKind.REASONING, text, null);
    }

    public static Delta narration(String text) {
        return new Delta(DeltaKind.NARRATION, text, null);
    }

    public static Delta call(ToolCall call) {
        return new Delta(DeltaKind.CALL, "", call);
    }
}
