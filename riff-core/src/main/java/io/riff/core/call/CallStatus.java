package io.riff.core.call;

public enum CallStatus {
    SUCCESS("success"),
    ERROR("error"),
    CODE_GENERATED("code_generated");

    private final String wireName;

    CallStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
