package io.riff.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolResult(String callId, String name, Map<String, Object> result) {

    public ToolResult {
        Objects.requireNonNull(name, "name must not be null");
        callId = callId == null ? "" : callId;
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }
}
