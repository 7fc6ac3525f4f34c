package io.riff.core.agent;

import io.riff.core.call.CallRecord;
import java.util.List;
import java.util.Objects;

public record TurnResult(TurnStatus status, String response, String reasoning, List<CallRecord> calls, String error) {
    public TurnResult {
        Objects.requireNonNull(status, "status must not be null");
        response = response == null ? "" : response;
        reasoning = reasoning == null ? "" : reasoning;
        calls = calls == null ? List.of() : List.copyOf(calls);
        error = error == null ? "" : error;
    }

    public static TurnResult completed(String response, String reasoning, List<CallRecord> calls) {
        return new TurnResult(TurnStatus.COMPLETED, response, reasoning, calls, "");
    }

    public static TurnResult failed(String error) {
        return new TurnResult(TurnStatus.FAILED, "", "", List.of(), error);
    }

    public static TurnResult cancelled() {
        return new TurnResult(TurnStatus.CANCELLED, "", "", List.of(), "");
    }
}
