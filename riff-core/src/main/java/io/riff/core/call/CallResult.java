package io.riff.core.call;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record CallResult(
    CallStatus status,
    CallFailure failure,
    String code,
    String output,
    String error,
    List<String> affectedLayers,
    String state
) {
    public CallResult {
        Objects.requireNonNull(status, "status must not be null");
        failure = failure == null ? CallFailure.NONE : failure;
        output = output == null ? "" : output;
        error = error == null ? "" : error;
        affectedLayers = affectedLayers == null ? List.of() : List.copyOf(affectedLayers);
    }

    public static CallResult success(String code, String output, List<String> affectedLayers) {
        return new CallResult(CallStatus.SUCCESS, CallFailure.NONE, code, output, "", affectedLayers, null);
    }

    public static CallResult sessionState(String state) {
        return new CallResult(CallStatus.SUCCESS, CallFailure.NONE, null, "", "", List.of(), state);
    }

    public static CallResult codeGenerated(String code, List<String> affectedLayers) {
        return new CallResult(CallStatus.CODE_GENERATED, CallFailure.NONE, code, "", "", affectedLayers, null);
    }

    public static CallResult failed(CallFailure failure, String error) {
        return new CallResult(CallStatus.ERROR, failure, null, "", error, List.of(), null);
    }

    public static CallResult sandboxFailed(String code, String output, String error, List<String> affectedLayers) {
        return new CallResult(CallStatus.ERROR, CallFailure.SANDBOX, code, output, error, affectedLayers, null);
    }

    public boolean succeeded() {
        return status != CallStatus.ERROR;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status.wireName());
        if (state != null) {
            map.put("state", state);
            return map;
        }
        if (code != null) {
            map.put("code", code);
        }
        if (status == CallStatus.CODE_GENERATED) {
            map.put("message", "Code generated but not executed");
        }
        if (!output.isEmpty()) {
            map.put("output", output);
        }
        if (!error.isEmpty()) {
            map.put("error", error);
        }
        if (!affectedLayers.isEmpty()) {
            map.put("players_affected", affectedLayers);
        }
        return map;
    }
}
