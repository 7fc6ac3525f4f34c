package io.riff.cli;

import io.riff.core.agent.TurnEngine;
import io.riff.core.config.model.RiffConfig;

@FunctionalInterface
public interface EngineFactory {
    TurnEngine create(RiffConfig config, String providerOverride, String modelOverride) throws Exception;
}
