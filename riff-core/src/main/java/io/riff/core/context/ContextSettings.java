package io.riff.core.context;

public record ContextSettings(int maxSize, double consolidationThreshold, int keepRecentTurns) {
    public static final int DEFAULT_MAX_SIZE = 100_000;
    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final int DEFAULT_KEEP_RECENT = 5;

    public ContextSettings {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (consolidationThreshold <= 0 || consolidationThreshold > 1) {
            throw new IllegalArgumentException("consolidationThreshold must be in (0, 1]");
        }
        if (keepRecentTurns < 1) {
            throw new IllegalArgumentException("keepRecentTurns must be at least 1");
        }
    }

    public static ContextSettings defaults() {
        return new ContextSettings(DEFAULT_MAX_SIZE, DEFAULT_THRESHOLD, DEFAULT_KEEP_RECENT);
    }
}
