package io.riff.core.provider;

import io.riff.core.config.ConfigurationException;
import java.util.Locale;

public final class ProviderRouter {
    private final ProviderRegistry registry;

    public ProviderRouter(ProviderRegistry registry) {
        this.registry = registry;
    }

    public LlmProvider resolve(String preferredProvider, String model) {
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("A model id is required");
        }
        if (preferredProvider != null && !preferredProvider.isBlank()) {
            return require(preferredProvider);
        }

        String normalizedModel = model.toLowerCase(Locale.ROOT);
        if (normalizedModel.startsWith("claude")) {
            return require("anthropic");
        }
        if (normalizedModel.startsWith("gpt") || normalizedModel.startsWith("o1") || normalizedModel.startsWith("o3")) {
            return require("openai");
        }
        return require("openrouter");
    }

    private LlmProvider require(String name) {
        return registry.find(name)
            .orElseThrow(() -> new ConfigurationException("Provider " + name + " is not configured (missing API key?)"));
    }
}
