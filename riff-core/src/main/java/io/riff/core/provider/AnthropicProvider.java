package io.riff.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.riff.core.config.ConfigurationException;
import io.riff.core.model.ChatMessage;
import io.riff.core.model.MessageRole;
import io.riff.core.model.ToolCall;
import io.riff.core.model.ToolResult;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AnthropicProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(AnthropicProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final int MAX_TOKENS = 8192;
    private static final int THINKING_BUDGET = 2048;

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public AnthropicProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, 3);
    }

    public AnthropicProvider(String name, String apiKey, String apiBase, int maxAttempts) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("Missing API key for provider " + name);
        }
        this.apiKey = apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DeltaStream stream(GenerationRequest request) throws IOException {
        Map<String, Object> payload = basePayload(request.model(), request.messages());
        payload.put("stream", true);
        // Extended thinking cannot be resumed across tool_use blocks we did not keep signatures for.
        if (request.includeReasoning() && !hasAssistantCalls(request.messages())) {
            payload.put("thinking", Map.of("type", "enabled", "budget_tokens", THINKING_BUDGET));
        } else {
            payload.put("temperature", request.temperature());
        }
        if (!request.tools().isEmpty()) {
            payload.put("tools", toAnthropicTools(request.tools()));
        }

        Response response = execute(payload);
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new StreamException("Empty response body from provider " + name);
        }
        return new AnthropicDeltaStream(response, new SseReader(body.source()));
    }

    @Override
    public String complete(String model, List<ChatMessage> messages) throws IOException {
        Map<String, Object> payload = basePayload(model, messages);
        payload.put("temperature", 0.3);
        try (Response response = execute(payload)) {
            if (response.body() == null) {
                return "";
            }
            JsonNode root = mapper.readTree(response.body().string());
            failOnError(root);
            StringBuilder content = new StringBuilder();
            for (JsonNode item : root.path("content")) {
                if ("text".equals(item.path("type").asText(""))) {
                    content.append(item.path("text").asText(""));
                }
            }
            return content.toString();
        }
    }

    private Map<String, Object> basePayload(String model, List<ChatMessage> messages) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", MAX_TOKENS);
        payload.put("messages", toWireMessages(messages));

        String systemPrompt = extractSystemPrompt(messages);
        if (!systemPrompt.isBlank()) {
            payload.put("system", systemPrompt);
        }
        return payload;
    }

    private Response execute(Map<String, Object> payload) throws IOException {
        long delayMs = 250;
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Response response = client.newCall(buildRequest(payload)).execute();
                if (response.isSuccessful()) {
                    return response;
                }
                String errorBody = response.body() == null ? "" : response.body().string();
                int code = response.code();
                response.close();
                boolean retryable = code == 429 || code >= 500;
                if (retryable && attempt < maxAttempts) {
                    LOG.debug("Provider {} returned HTTP {}, retrying", name, code);
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                    continue;
                }
                throw new StreamException("HTTP " + code + " from provider " + name + ": " + errorBody);
            } catch (StreamException e) {
                throw e;
            } catch (IOException e) {
                lastFailure = e;
                if (attempt < maxAttempts) {
                    LOG.debug("Provider {} request failed ({}), retrying", name, e.getMessage());
                    sleep(delayMs);
                    delayMs = Math.min(delayMs * 2, 2000);
                }
            }
        }
        throw new StreamException("Provider " + name + " is unreachable", lastFailure);
    }

    private Request buildRequest(Map<String, Object> payload) throws IOException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(messagesUrl())
            .post(body)
            .header("x-api-key", apiKey)
            .header("anthropic-version", "2023-06-01")
            .header("content-type", "application/json")
            .build();
    }

    private HttpUrl messagesUrl() {
        return apiBase.newBuilder()
            .addPathSegment("messages")
            .build();
    }

    private boolean hasAssistantCalls(List<ChatMessage> messages) {
        return messages.stream()
            .anyMatch(m -> m.role() == MessageRole.ASSISTANT && !m.toolCalls().isEmpty());
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "assistant" : "user");

            if (message.role() == MessageRole.TOOL) {
                List<Map<String, Object>> content = new ArrayList<>();
                for (ToolResult result : message.toolResults()) {
                    Map<String, Object> block = new LinkedHashMap<>();
                    block.put("type", "tool_result");
                    block.put("tool_use_id", result.callId());
                    block.put("content", toJson(result.result()));
                    content.add(block);
                }
                row.put("content", content);
            } else if (message.role() == MessageRole.ASSISTANT && !message.toolCalls().isEmpty()) {
                List<Map<String, Object>> content = new ArrayList<>();
                if (!message.content().isBlank()) {
                    content.add(Map.of("type", "text", "text", message.content()));
                }
                for (ToolCall call : message.toolCalls()) {
                    Map<String, Object> block = new LinkedHashMap<>();
                    block.put("type", "tool_use");
                    block.put("id", call.id());
                    block.put("name", call.name());
                    block.put("input", call.arguments());
                    content.add(block);
                }
                row.put("content", content);
            } else if (message.role() == MessageRole.ASSISTANT && message.content().isBlank()) {
                continue;
            } else {
                row.put("content", message.content());
            }
            wire.add(row);
        }
        return wire;
    }

    private String extractSystemPrompt(List<ChatMessage> messages) {
        return messages.stream()
            .filter(m -> m.role() == MessageRole.SYSTEM)
            .map(ChatMessage::content)
            .reduce("", (a, b) -> a.isBlank() ? b : a + "\n\n" + b);
    }

    private List<Map<String, Object>> toAnthropicTools(List<Map<String, Object>> tools) {
        List<Map<String, Object>> mapped = new ArrayList<>();
        for (Map<String, Object> tool : tools) {
            Object fn = tool.get("function");
            if (!(fn instanceof Map<?, ?> fnMap)) {
                continue;
            }
            Object toolName = fnMap.get("name");
            if (!(toolName instanceof String s) || s.isBlank()) {
                continue;
            }
            Object description = fnMap.containsKey("description") ? fnMap.get("description") : "";
            Object parameters = fnMap.containsKey("parameters")
                ? fnMap.get("parameters")
                : Map.of("type", "object", "properties", Map.of());
            mapped.add(Map.of(
                "name", s,
                "description", String.valueOf(description),
                "input_schema", parameters
            ));
        }
        return mapped;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    private void failOnError(JsonNode root) throws StreamException {
        if ("error".equals(root.path("type").asText(""))) {
            String message = root.path("error").path("message").asText(root.path("error").toString());
            throw new StreamException("Provider " + name + " reported an error: " + message);
        }
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ToolUseBuffer {
        private final String id;
        private final String name;
        private final StringBuilder inputJson = new StringBuilder();

        private ToolUseBuffer(String id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    private final class AnthropicDeltaStream implements DeltaStream {
        private final Response response;
        private final SseReader reader;
        private final Deque<Delta> pending = new ArrayDeque<>();
        private final Map<Integer, ToolUseBuffer> toolBlocks = new HashMap<>();
        private boolean finished;

        private AnthropicDeltaStream(Response response, SseReader reader) {
            this.response = response;
            this.reader = reader;
        }

        @Override
        public Delta next() throws IOException {
            while (pending.isEmpty() && !finished) {
                readEvent();
            }
            return pending.poll();
        }

        @Override
        public void close() {
            response.close();
        }

        private void readEvent() throws IOException {
            String payload = reader.nextData();
            if (payload == null) {
                if (!toolBlocks.isEmpty()) {
                    throw new StreamException("Stream ended inside a tool_use block");
                }
                finished = true;
                return;
            }
            if (payload.isEmpty()) {
                return;
            }

            JsonNode event = mapper.readTree(payload);
            failOnError(event);
            String type = event.path("type").asText("");
            int index = event.path("index").asInt(0);
            switch (type) {
                case "content_block_start" -> {
                    JsonNode block = event.path("content_block");
                    if ("tool_use".equals(block.path("type").asText(""))) {
                        toolBlocks.put(index, new ToolUseBuffer(block.path("id").asText(""), block.path("name").asText("")));
                    }
                }
                case "content_block_delta" -> onBlockDelta(index, event.path("delta"));
                case "content_block_stop" -> {
                    ToolUseBuffer buffer = toolBlocks.remove(index);
                    if (buffer != null) {
                        pending.add(Delta.call(new ToolCall(buffer.id, buffer.name, parseInput(buffer))));
                    }
                }
                case "message_stop" -> finished = true;
                default -> {
                }
            }
        }

        private void onBlockDelta(int index, JsonNode delta) {
            String deltaType = delta.path("type").asText("");
            switch (deltaType) {
                case "thinking_delta" -> {
                    String thinking = delta.path("thinking").asText("");
                    if (!thinking.isEmpty()) {
                        pending.add(Delta.reasoning(thinking));
                    }
                }
                case "text_delta" -> {
                    String text = delta.path("text").asText("");
                    if (!text.isEmpty()) {
                        pending.add(Delta.narration(text));
                    }
                }
                case "input_json_delta" -> {
                    ToolUseBuffer buffer = toolBlocks.get(index);
                    if (buffer != null) {
                        buffer.inputJson.append(delta.path("partial_json").asText(""));
                    }
                }
                default -> {
                }
            }
        }

        private Map<String, Object> parseInput(ToolUseBuffer buffer) throws StreamException {
            String raw = buffer.inputJson.toString();
            if (raw.isBlank()) {
                return Map.of();
            }
            try {
                return mapper.readValue(raw, MAP_TYPE);
            } catch (IOException e) {
                throw new StreamException("Malformed arguments for call " + buffer.name, e);
            }
        }
    }
}
