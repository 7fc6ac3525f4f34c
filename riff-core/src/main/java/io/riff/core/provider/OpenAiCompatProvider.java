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

public final class OpenAiCompatProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(OpenAiCompatProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> extraHeaders;
    private final int maxAttempts;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, Map<String, String> extraHeaders) {
        this(name, apiKey, apiBase, extraHeaders, 3);
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        Map<String, String> extraHeaders,
        int maxAttempts
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("Missing API key for provider " + name);
        }
        this.apiKey = apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
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
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.model());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("stream", true);
        payload.put("temperature", request.temperature());
        if (!request.tools().isEmpty()) {
            payload.put("tools", request.tools());
            payload.put("tool_choice", "auto");
        }
        Response response = execute(payload);
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            throw new StreamException("Empty response body from provider " + name);
        }
        return new OpenAiDeltaStream(response, new SseReader(body.source()));
    }

    @Override
    public String complete(String model, List<ChatMessage> messages) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(messages));
        payload.put("stream", false);
        payload.put("temperature", 0.3);
        try (Response response = execute(payload)) {
            ResponseBody body = response.body();
            if (body == null) {
                return "";
            }
            String contentType = response.header("Content-Type", "");
            if (contentType != null && contentType.contains("text/event-stream")) {
                return drainNarration(new OpenAiDeltaStream(response, new SseReader(body.source())));
            }
            JsonNode root = mapper.readTree(body.string());
            failOnError(root);
            return root.path("choices").path(0).path("message").path("content").asText("");
        }
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
        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");

        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        return apiBase.newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.TOOL) {
                for (ToolResult result : message.toolResults()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("role", "tool");
                    row.put("tool_call_id", result.callId());
                    row.put("content", toJson(result.result()));
                    wire.add(row);
                }
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", toRoleValue(message.role()));
            row.put("content", message.content());
            if (message.role() == MessageRole.ASSISTANT && !message.toolCalls().isEmpty()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolCall call : toolCalls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", toJson(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return mapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (IOException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    private String toRoleValue(MessageRole role) {
        return switch (role) {
            case SYSTEM -> "system";
            case USER -> "user";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
        };
    }

    private void failOnError(JsonNode root) throws StreamException {
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.isTextual() ? error.asText() : error.path("message").asText(error.toString());
            throw new StreamException("Provider " + name + " reported an error: " + message);
        }
    }

    private String drainNarration(DeltaStream stream) throws IOException {
        StringBuilder text = new StringBuilder();
        Delta delta;
        while ((delta = stream.next()) != null) {
            if (delta.kind() == DeltaKind.NARRATION) {
                text.append(delta.text());
            }
        }
        return text.toString();
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class ToolCallBuffer {
        private String id = "";
        private String name = "";
        private final StringBuilder arguments = new StringBuilder();
    }

    private final class OpenAiDeltaStream implements DeltaStream {
        private final Response response;
        private final SseReader reader;
        private final Deque<Delta> pending = new ArrayDeque<>();
        private final Map<Integer, ToolCallBuffer> toolBuffers = new LinkedHashMap<>();
        private boolean finished;

        private OpenAiDeltaStream(Response response, SseReader reader) {
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
            if (payload == null || "[DONE]".equals(payload)) {
                flushToolCalls();
                finished = true;
                return;
            }
            if (payload.isEmpty()) {
                return;
            }

            JsonNode event = mapper.readTree(payload);
            failOnError(event);
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                String reasoning = text(delta, "reasoning_content");
                if (reasoning.isEmpty()) {
                    reasoning = text(delta, "reasoning");
                }
                if (!reasoning.isEmpty()) {
                    pending.add(Delta.reasoning(reasoning));
                }
                String content = text(delta, "content");
                if (!content.isEmpty()) {
                    pending.add(Delta.narration(content));
                }
                collectToolCalls(delta.path("tool_calls"));
                String finishReason = text(choice, "finish_reason");
                if (!finishReason.isEmpty()) {
                    flushToolCalls();
                }
            }
        }

        private void collectToolCalls(JsonNode toolCallsNode) {
            if (!toolCallsNode.isArray()) {
                return;
            }
            for (JsonNode toolCall : toolCallsNode) {
                int index = Math.max(toolCall.path("index").asInt(0), 0);
                ToolCallBuffer buffer = toolBuffers.computeIfAbsent(index, ignored -> new ToolCallBuffer());
                String id = toolCall.path("id").asText("");
                if (!id.isBlank()) {
                    buffer.id = id;
                }
                JsonNode function = toolCall.path("function");
                String functionName = function.path("name").asText("");
                if (!functionName.isBlank()) {
                    buffer.name = functionName;
                }
                String argChunk = function.path("arguments").asText("");
                if (!argChunk.isEmpty()) {
                    buffer.arguments.append(argChunk);
                }
            }
        }

        private void flushToolCalls() throws StreamException {
            for (Map.Entry<Integer, ToolCallBuffer> entry : toolBuffers.entrySet()) {
                ToolCallBuffer buffer = entry.getValue();
                if (buffer.name.isBlank()) {
                    throw new StreamException("Call fragment without a name at index " + entry.getKey());
                }
                // A missing id stays blank so the engine can number calls across passes.
                pending.add(Delta.call(new ToolCall(buffer.id, buffer.name, parseArguments(buffer.name, buffer.arguments.toString()))));
            }
            toolBuffers.clear();
        }

        private Map<String, Object> parseArguments(String callName, String raw) throws StreamException {
            if (raw == null || raw.isBlank()) {
                return Map.of();
            }
            try {
                return mapper.readValue(raw, MAP_TYPE);
            } catch (IOException e) {
                throw new StreamException("Malformed arguments for call " + callName, e);
            }
        }

        private String text(JsonNode node, String field) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull() || value.isMissingNode()) {
                return "";
            }
            return value.asText("");
        }
    }
}
