package io.riff.app;

import io.riff.cli.ChatCommand;
import io.riff.cli.CliContext;
import io.riff.cli.OnboardCommand;
import io.riff.cli.RiffCliCommand;
import io.riff.cli.SendCommand;
import io.riff.cli.StatusCommand;
import io.riff.core.agent.TurnEngine;
import io.riff.core.agent.TurnSettings;
import io.riff.core.call.CallRegistry;
import io.riff.core.call.FoxDotCodeBuilder;
import io.riff.core.config.ConfigPaths;
import io.riff.core.config.ConfigService;
import io.riff.core.config.model.AgentDefaults;
import io.riff.core.config.model.ContextConfig;
import io.riff.core.config.model.ProviderConfig;
import io.riff.core.config.model.RiffConfig;
import io.riff.core.config.model.SandboxConfig;
import io.riff.core.context.CharacterSizeEstimator;
import io.riff.core.context.ContextManager;
import io.riff.core.context.ContextSettings;
import io.riff.core.observability.FileAuditStore;
import io.riff.core.observability.ObservabilityService;
import io.riff.core.provider.AnthropicProvider;
import io.riff.core.provider.LlmProvider;
import io.riff.core.provider.OpenAiCompatProvider;
import io.riff.core.provider.ProviderRegistry;
import io.riff.core.provider.ProviderRouter;
import io.riff.core.sandbox.DryRunSandbox;
import io.riff.core.sandbox.ExecutionSandbox;
import io.riff.core.sandbox.ProcessSandbox;
import io.riff.core.session.FileSessionSnapshotStore;
import io.riff.core.session.SessionSnapshotStore;
import io.riff.core.session.SqliteSessionSnapshotStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class RiffApplication {
    private static final Logger LOG = LoggerFactory.getLogger(RiffApplication.class);

    private RiffApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        RiffConfig config = loadConfig(configService, configPath);
        Path workspacePath = configService.workspace(config);

        ObservabilityService observabilityService = new ObservabilityService(
            new FileAuditStore(ConfigPaths.auditEvents(workspacePath)),
            Clock.systemUTC()
        );

        CliContext context = new CliContext(
            configService,
            configPath,
            (loaded, provider, model) -> buildEngine(loaded, provider, model, observabilityService),
            loaded -> buildSnapshotStore(configService, loaded, System.getenv()),
            observabilityService
        );

        CommandLine commandLine = new CommandLine(new RiffCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("send", new SendCommand(context));
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static RiffConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
            return RiffConfig.defaults();
        }
    }

    static TurnEngine buildEngine(
        RiffConfig config,
        String providerOverride,
        String modelOverride,
        ObservabilityService observabilityService
    ) throws IOException {
        AgentDefaults defaults = config.agents().defaults();
        String provider = providerOverride != null ? providerOverride : defaults.provider();
        String model = modelOverride != null ? modelOverride : defaults.model();
        TurnSettings settings = new TurnSettings(
            null,
            provider,
            model,
            defaults.temperature(),
            defaults.autoExecute(),
            defaults.includeReasoning(),
            defaults.maxContinuationDepth()
        );

        LlmProvider llm = new ProviderRouter(buildProviderRegistry(config)).resolve(settings.provider(), settings.model());
        Path workspacePath = ConfigPaths.resolveWorkspace(defaults.workspace());
        LOG.debug("Using provider {} with model {}", llm.name(), settings.model());
        return new TurnEngine(
            llm,
            settings,
            CallRegistry.defaultCatalog(),
            new FoxDotCodeBuilder(),
            buildSandbox(config.sandbox(), workspacePath),
            buildContextManager(config.context()),
            observabilityService,
            Clock.systemDefaultZone()
        );
    }

    private static ProviderRegistry buildProviderRegistry(RiffConfig config) {
        ProviderRegistry registry = new ProviderRegistry();
        registerOpenAiCompat(registry, "openrouter", config.providers().openrouter(), "https://openrouter.ai/api/v1");
        registerOpenAiCompat(registry, "openai", config.providers().openai(), "https://api.openai.com/v1");
        ProviderConfig anthropic = config.providers().anthropic();
        if (anthropic != null && anthropic.configured()) {
            registry.register(new AnthropicProvider("anthropic", anthropic.apiKey(), apiBase(anthropic, "https://api.anthropic.com/v1")));
        }
        return registry;
    }

    private static void registerOpenAiCompat(ProviderRegistry registry, String name, ProviderConfig providerConfig, String defaultBase) {
        if (providerConfig != null && providerConfig.configured()) {
            registry.register(new OpenAiCompatProvider(
                name,
                providerConfig.apiKey(),
                apiBase(providerConfig, defaultBase),
                providerConfig.extraHeaders()
            ));
        }
    }

    private static String apiBase(ProviderConfig providerConfig, String defaultBase) {
        return providerConfig.apiBase() == null || providerConfig.apiBase().isBlank() ? defaultBase : providerConfig.apiBase();
    }

    private static ExecutionSandbox buildSandbox(SandboxConfig sandboxConfig, Path workspacePath) throws IOException {
        String mode = sandboxConfig.mode() == null ? "dry_run" : sandboxConfig.mode().trim().toLowerCase(Locale.ROOT);
        if (!"process".equals(mode)) {
            return new DryRunSandbox();
        }
        String command = sandboxConfig.command() == null || sandboxConfig.command().isBlank()
            ? ProcessSandbox.bundledBridgeCommand(ConfigPaths.sandboxDirectory(workspacePath))
            : sandboxConfig.command();
        return new ProcessSandbox(command, Duration.ofSeconds(Math.max(1, sandboxConfig.timeoutSeconds())));
    }

    private static ContextManager buildContextManager(ContextConfig contextConfig) {
        return new ContextManager(
            new ContextSettings(
                contextConfig.maxSize(),
                contextConfig.consolidationThreshold(),
                contextConfig.keepRecentTurns()
            ),
            new CharacterSizeEstimator()
        );
    }

    static SessionSnapshotStore buildSnapshotStore(
        ConfigService configService,
        RiffConfig config,
        Map<String, String> environment
    ) throws IOException {
        Path workspacePath = configService.workspace(config);
        if ("sqlite".equals(configService.storageBackend(config, environment))) {
            return new SqliteSessionSnapshotStore(ConfigPaths.sessionsDatabase(workspacePath));
        }
        return new FileSessionSnapshotStore(ConfigPaths.sessionsDirectory(workspacePath));
    }
}
