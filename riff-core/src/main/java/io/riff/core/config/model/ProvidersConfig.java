package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openrouter,
    ProviderConfig openai,
    ProviderConfig anthropic
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.withBase("https://openrouter.ai/api/v1"),
            ProviderConfig.withBase("https://api.openai.com/v1"),
            ProviderConfig.withBase("https://api.anthropic.com/v1")
        );
    }
}
