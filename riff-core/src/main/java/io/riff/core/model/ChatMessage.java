package io.riff.core.model;

import java.util.List;
import java.util.Objects;

public record ChatMessage(MessageRole role, String content, List<ToolCall> toolCalls, List<ToolResult> toolResults) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, List.of(), List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, List.of(), List.of());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, List.of(), List.of());
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls, List<ToolResult> toolResults) {
        return new ChatMessage(MessageRole.ASSISTANT, content, toolCalls, toolResults);
    }

    public static ChatMessage toolResults(List<ToolResult> toolResults) {
        return new ChatMessage(MessageRole.TOOL, "", List.of(), toolResults);
    }
}
