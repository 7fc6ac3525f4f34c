package io.riff.core.sandbox;

import java.time.Duration;
import java.util.List;

public record ExecutionResult(
    boolean success,
    String code,
    String output,
    String error,
    List<String> affectedPlayers,
    Duration elapsed,
    List<String> warnings
) {
    public ExecutionResult {
        code = code == null ? "" : code;
        output = output == null ? "" : output;
        error = error == null ? "" : error;
        affectedPlayers = affectedPlayers == null ? List.of() : List.copyOf(affectedPlayers);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExecutionResult failure(String code, String error, List<String> affectedPlayers) {
        return new ExecutionResult(false, code, "", error, affectedPlayers, Duration.ZERO, List.of());
    }
}
