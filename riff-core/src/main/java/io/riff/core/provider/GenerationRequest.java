package io.riff.core.provider;

import io.riff.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record GenerationRequest(
    String model,
    List<ChatMessage> messages,
    List<Map<String, Object>> tools,
    double temperature,
    boolean includeReasoning
) {
    public GenerationRequest {
        Objects.requireNonNull(model, "model must not be null");
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
