package io.riff.core.session;

import java.time.Instant;

public record ExecutionRecord(Instant timestamp, String code, boolean success, String output) {
    public ExecutionRecord {
        code = code == null ? "" : code;
        output = output == null ? "" : output;
    }
}
