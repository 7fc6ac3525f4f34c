package io.riff.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.riff.core.config.ConfigurationException;
import io.riff.core.model.ChatMessage;
import io.riff.core.model.ToolCall;
import io.riff.core.model.ToolResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldClassifyStreamedDeltasAndAssembleFragmentedCalls() throws Exception {
        server.enqueue(sse(
            "{\"choices\":[{\"delta\":{\"reasoning_content\":\"Upbeat means \"}}]}",
            "{\"choices\":[{\"delta\":{\"reasoning\":\"faster.\"}}]}",
            "{\"choices\":[{\"delta\":{\"content\":\"Raising the tempo.\"}}]}",
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"call_x\",\"function\":{\"name\":\"set_tempo\",\"arguments\":\"{\\\"bp\"}}]}}]}",
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"function\":{\"arguments\":\"m\\\": 140}\"}}]}}]}",
            "{\"choices\":[{\"delta\":{},\"finish_reason\":\"tool_calls\"}]}",
            "[DONE]"
        ));
        OpenAiCompatProvider provider = provider();

        List<Delta> deltas;
        try (DeltaStream stream = provider.stream(request(List.of(ChatMessage.system("sys"), ChatMessage.user("make it upbeat"))))) {
            deltas = drain(stream);
        }

        assertThat(deltas).extracting(Delta::kind).containsExactly(
            DeltaKind.REASONING, DeltaKind.REASONING, DeltaKind.NARRATION, DeltaKind.CALL
        );
        assertThat(deltas.get(0).text()).isEqualTo("Upbeat means ");
        ToolCall call = deltas.get(3).call();
        assertThat(call.id()).isEqualTo("call_x");
        assertThat(call.name()).isEqualTo("set_tempo");
        assertThat(call.arguments()).containsEntry("bpm", 140);

        RecordedRequest recorded = server.takeRequest();
        assertThat(recorded.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(recorded.getHeader("HTTP-Referer")).isEqualTo("https://riff.local");
        String body = recorded.getBody().readUtf8();
        assertThat(body).contains("\"stream\":true").contains("\"tool_choice\":\"auto\"").contains("\"name\":\"set_tempo\"");
    }

    @Test
    void shouldLeaveIdBlankWhenProviderOmitsIt() throws Exception {
        server.enqueue(sse(
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":1,\"function\":{\"name\":\"stop_all\",\"arguments\":\"\"}}]}}]}"
        ));

        List<Delta> deltas;
        try (DeltaStream stream = provider().stream(request(List.of(ChatMessage.user("silence"))))) {
            deltas = drain(stream);
        }

        assertThat(deltas).hasSize(1);
        assertThat(deltas.get(0).call().id()).isEmpty();
        assertThat(deltas.get(0).call().arguments()).isEmpty();
    }

    @Test
    void shouldSendCallsAndResultsInWireShape() throws Exception {
        server.enqueue(sse("{\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}", "[DONE]"));
        ToolCall call = new ToolCall("c1", "set_tempo", Map.of("bpm", 140));
        ToolResult result = new ToolResult("c1", "set_tempo", Map.of("status", "success"));

        try (DeltaStream stream = provider().stream(request(List.of(
            ChatMessage.user("faster"),
            ChatMessage.assistantWithToolCalls("Sure.", List.of(call), List.of(result)),
            ChatMessage.toolResults(List.of(result))
        )))) {
            drain(stream);
        }

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("\"tool_calls\":[{\"id\":\"c1\",\"type\":\"function\"");
        assertThat(body).contains("\"role\":\"tool\"").contains("\"tool_call_id\":\"c1\"");
    }

    @Test
    void shouldFailOnMalformedCallArguments() throws Exception {
        server.enqueue(sse(
            "{\"choices\":[{\"delta\":{\"tool_calls\":[{\"index\":0,\"id\":\"c\",\"function\":{\"name\":\"set_tempo\",\"arguments\":\"{bpm\"}}]}}]}",
            "[DONE]"
        ));

        try (DeltaStream stream = provider().stream(request(List.of(ChatMessage.user("x"))))) {
            assertThatThrownBy(stream::next)
                .isInstanceOf(StreamException.class)
                .hasMessageContaining("Malformed arguments");
        }
    }

    @Test
    void shouldFailOnErrorEventMidStream() throws Exception {
        server.enqueue(sse(
            "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
            "{\"error\":{\"message\":\"overloaded\"}}"
        ));

        try (DeltaStream stream = provider().stream(request(List.of(ChatMessage.user("x"))))) {
            assertThat(stream.next().text()).isEqualTo("Hel");
            assertThatThrownBy(stream::next).isInstanceOf(StreamException.class).hasMessageContaining("overloaded");
        }
    }

    @Test
    void shouldSurfaceHttpErrorsAfterRetries() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("still busy"));
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openrouter", "sk-test", server.url("/v1/").toString(), Map.of(), 2);

        assertThatThrownBy(() -> provider.stream(request(List.of(ChatMessage.user("x")))))
            .isInstanceOf(StreamException.class)
            .hasMessageContaining("HTTP 503");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldCompleteWithoutStreaming() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\":[{\"message\":{\"content\":\"A summary.\"}}]}"));

        String summary = provider().complete("test-model", List.of(ChatMessage.user("summarize")));

        assertThat(summary).isEqualTo("A summary.");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"stream\":false");
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> new OpenAiCompatProvider("openai", " ", "https://api.openai.com/v1", Map.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("openai");
    }

    private OpenAiCompatProvider provider() {
        return new OpenAiCompatProvider(
            "openrouter",
            "sk-test",
            server.url("/v1/").toString(),
            Map.of("HTTP-Referer", "https://riff.local"),
            1
        );
    }

    private static GenerationRequest request(List<ChatMessage> messages) {
        List<Map<String, Object>> tools = List.of(Map.of(
            "type", "function",
            "function", Map.of("name", "set_tempo", "description", "Set tempo", "parameters", Map.of("type", "object"))
        ));
        return new GenerationRequest("test-model", messages, tools, 0.9, true);
    }

    static MockResponse sse(String... events) {
        StringBuilder body = new StringBuilder();
        for (String event : events) {
            body.append("data: ").append(event).append("\n\n");
        }
        return new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(body.toString());
    }

    static List<Delta> drain(DeltaStream stream) throws IOException {
        List<Delta> deltas = new ArrayList<>();
        Delta delta;
        while ((delta = stream.next()) != null) {
            deltas.add(delta);
        }
        return deltas;
    }
}
