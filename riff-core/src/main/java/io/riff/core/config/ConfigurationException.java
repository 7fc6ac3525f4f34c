package io.riff.core.config;

public class ConfigurationException extends IllegalStateException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
