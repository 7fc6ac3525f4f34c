package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SandboxConfig(
    String mode,
    String command,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static SandboxConfig defaults() {
        return new SandboxConfig("dry_run", "", 30);
    }
}
