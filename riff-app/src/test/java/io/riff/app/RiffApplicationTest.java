package io.riff.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.riff.core.agent.TurnEngine;
import io.riff.core.config.ConfigService;
import io.riff.core.config.ConfigurationException;
import io.riff.core.config.model.AgentDefaults;
import io.riff.core.config.model.AgentsConfig;
import io.riff.core.config.model.ContextConfig;
import io.riff.core.config.model.ProviderConfig;
import io.riff.core.config.model.ProvidersConfig;
import io.riff.core.config.model.RiffConfig;
import io.riff.core.config.model.SandboxConfig;
import io.riff.core.config.model.StorageConfig;
import io.riff.core.session.FileSessionSnapshotStore;
import io.riff.core.session.SessionSnapshotStore;
import io.riff.core.session.SqliteSessionSnapshotStore;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RiffApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldBuildEngineForConfiguredProvider() throws Exception {
        RiffConfig config = config(new ProviderConfig("sk-test", "http://localhost:1/v1", Map.of()));

        try (TurnEngine engine = RiffApplication.buildEngine(config, null, "anthropic/claude-sonnet-4", null)) {
            assertThat(engine.settings().provider()).isEqualTo("openrouter");
            assertThat(engine.settings().model()).isEqualTo("anthropic/claude-sonnet-4");
            assertThat(engine.settings().maxContinuationDepth()).isEqualTo(4);
            assertThat(engine.contextManager().settings().keepRecentTurns()).isEqualTo(5);
        }
    }

    @Test
    void shouldRejectProviderWithoutApiKey() {
        RiffConfig config = config(ProviderConfig.withBase("https://openrouter.ai/api/v1"));

        assertThatThrownBy(() -> RiffApplication.buildEngine(config, null, null, null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("openrouter");
    }

    @Test
    void shouldChooseSnapshotStoreFromEnvironmentBeforeConfig() throws Exception {
        RiffConfig config = config(ProviderConfig.withBase("https://openrouter.ai/api/v1"));
        ConfigService configService = new ConfigService();

        SessionSnapshotStore overridden = RiffApplication.buildSnapshotStore(
            configService, config, Map.of(ConfigService.SESSION_STORE_ENV, "file")
        );
        SessionSnapshotStore configured = RiffApplication.buildSnapshotStore(configService, config, Map.of());

        assertThat(overridden).isInstanceOf(FileSessionSnapshotStore.class);
        assertThat(configured).isInstanceOf(SqliteSessionSnapshotStore.class);
        assertThat(tempDir.resolve("workspace").resolve("sessions.db")).exists();
    }

    private RiffConfig config(ProviderConfig openrouter) {
        AgentDefaults defaults = AgentDefaults.defaults();
        AgentDefaults agent = new AgentDefaults(
            tempDir.resolve("workspace").toString(),
            defaults.provider(),
            defaults.model(),
            defaults.temperature(),
            defaults.autoExecute(),
            defaults.includeReasoning(),
            defaults.maxContinuationDepth()
        );
        ProvidersConfig providers = ProvidersConfig.defaults();
        return new RiffConfig(
            new AgentsConfig(agent),
            ContextConfig.defaults(),
            new ProvidersConfig(openrouter, providers.openai(), providers.anthropic()),
            SandboxConfig.defaults(),
            StorageConfig.defaults()
        );
    }
}
