package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextConfig(
    @JsonAlias({"max_size", "max_tokens"}) int maxSize,
    @JsonAlias({"consolidation_threshold"}) double consolidationThreshold,
    @JsonAlias({"keep_recent_turns"}) int keepRecentTurns
) {

    public static ContextConfig defaults() {
        return new ContextConfig(100_000, 0.7, 5);
    }
}
