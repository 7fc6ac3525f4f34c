package io.riff.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(String backend) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite");
    }
}
