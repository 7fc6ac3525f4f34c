package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RiffConfig(
    AgentsConfig agents,
    ContextConfig context,
    ProvidersConfig providers,
    SandboxConfig sandbox,
    StorageConfig storage
) {

    public static RiffConfig defaults() {
        return new RiffConfig(
            AgentsConfig.defaultConfig(),
            ContextConfig.defaults(),
            ProvidersConfig.defaults(),
            SandboxConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
