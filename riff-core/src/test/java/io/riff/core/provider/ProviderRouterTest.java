package io.riff.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.riff.core.config.ConfigurationException;
import io.riff.core.model.ChatMessage;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderRouterTest {

    @Test
    void shouldResolveByModelHeuristics() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new StubProvider("anthropic"));
        registry.register(new StubProvider("openai"));
        registry.register(new StubProvider("openrouter"));
        ProviderRouter router = new ProviderRouter(registry);

        assertThat(router.resolve(null, "claude-sonnet-4-5").name()).isEqualTo("anthropic");
        assertThat(router.resolve("", "gpt-4o").name()).isEqualTo("openai");
        assertThat(router.resolve(null, "google/gemini-2.5-flash").name()).isEqualTo("openrouter");
        assertThat(router.resolve("anthropic", "google/gemini-2.5-flash").name()).isEqualTo("anthropic");
    }

    @Test
    void shouldFailForUnconfiguredProviderOrMissingModel() {
        ProviderRouter router = new ProviderRouter(new ProviderRegistry());

        assertThatThrownBy(() -> router.resolve("openrouter", "some-model"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("openrouter");
        assertThatThrownBy(() -> router.resolve(null, " "))
            .isInstanceOf(ConfigurationException.class);
    }

    private record StubProvider(String name) implements LlmProvider {
        @Override
        public DeltaStream stream(GenerationRequest request) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String complete(String model, List<ChatMessage> messages) {
            return "";
        }
    }
}
