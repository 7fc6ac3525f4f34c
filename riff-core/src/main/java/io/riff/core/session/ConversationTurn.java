package io.riff.core.session;

import io.riff.core.call.CallRecord;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record ConversationTurn(
    TurnRole role,
    String content,
    String reasoning,
    List<CallRecord> calls,
    int sizeEstimate,
    Instant createdAt
) {
    public ConversationTurn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        reasoning = reasoning == null || reasoning.isEmpty() ? null : reasoning;
        calls = calls == null ? List.of() : List.copyOf(calls);
        sizeEstimate = Math.max(0, sizeEstimate);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public List<String> callNames() {
        return calls.stream().map(CallRecord::name).toList();
    }
}
