package io.riff.cli;

import io.riff.core.config.ConfigService;
import io.riff.core.observability.ObservabilityService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    EngineFactory engineFactory,
    SnapshotStoreFactory snapshotStoreFactory,
    ObservabilityService observability
) {
    public CliContext(ConfigService configService, Path configPath, EngineFactory engineFactory, SnapshotStoreFactory snapshotStoreFactory) {
        this(configService, configPath, engineFactory, snapshotStoreFactory, null);
    }
}
