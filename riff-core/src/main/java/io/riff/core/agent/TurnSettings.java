package io.riff.core.agent;

import io.riff.core.config.ConfigurationException;

public record TurnSettings(
    String systemPrompt,
    String provider,
    String model,
    double temperature,
    boolean autoExecute,
    boolean includeReasoning,
    int maxContinuationDepth
) {
    public static final int DEFAULT_MAX_CONTINUATION_DEPTH = 4;

    static final String DEFAULT_SYSTEM_PROMPT = """
        You are an expert music producer and live coder working in FoxDot.
        Turn every musical request into calls: play_synth for melodic, bass and pad layers,
        play_drums for percussion, modify_layer to adjust what is already playing, and the
        set_* calls for tempo, scale and root. Build on the layers that are already playing
        unless the user asks for something new. After the calls resolve, describe briefly
        what changed.""";

    public TurnSettings {
        if (model == null || model.isBlank()) {
            throw new ConfigurationException("A model id is required");
        }
        provider = provider == null ? "" : provider.trim();
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
        maxContinuationDepth = Math.max(1, maxContinuationDepth);
    }

    public static TurnSettings of(String provider, String model) {
        return new TurnSettings(null, provider, model, 0.9, true, true, DEFAULT_MAX_CONTINUATION_DEPTH);
    }
}
