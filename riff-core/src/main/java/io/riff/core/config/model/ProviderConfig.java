package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public static ProviderConfig withBase(String apiBase) {
        return new ProviderConfig("", apiBase, Map.of());
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
