package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    String workspace,
    String provider,
    String model,
    double temperature,
    @JsonAlias({"auto_execute"}) boolean autoExecute,
    @JsonAlias({"include_reasoning", "include_thoughts"}) boolean includeReasoning,
    @JsonAlias({"max_continuation_depth"}) int maxContinuationDepth
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(
            "~/.riff/workspace",
            "openrouter",
            "google/gemini-2.5-flash",
            0.9,
            true,
            true,
            4
        );
    }
}
