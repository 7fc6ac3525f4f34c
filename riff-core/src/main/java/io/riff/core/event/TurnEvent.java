package io.riff.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record TurnEvent(TurnEventType type, Instant timestamp, Map<String, Object> payload) {
    public TurnEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String text() {
        Object text = payload.get("text");
        return text == null ? "" : String.valueOf(text);
    }
}
