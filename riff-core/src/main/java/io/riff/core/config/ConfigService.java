package io.riff.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.riff.core.config.model.ContextConfig;
import io.riff.core.config.model.RiffConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads {@code config.json} merged over {@link RiffConfig#defaults()}, so a file only needs the
 * keys it changes, and rejects values the runtime cannot act on.
 */
public final class ConfigService {
    public static final String SESSION_STORE_ENV = "RIFF_SESSION_STORE";

    private static final Set<String> SANDBOX_MODES = Set.of("dry_run", "process");
    private static final Set<String> STORAGE_BACKENDS = Set.of("sqlite", "file");

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public RiffConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return RiffConfig.defaults();
        }

        JsonNode merged = overlay(mapper.valueToTree(RiffConfig.defaults()), mapper.readTree(Files.readString(configPath)));
        RiffConfig config = mapper.treeToValue(merged, RiffConfig.class);
        validate(config);
        return config;
    }

    public void save(Path configPath, RiffConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        validate(Objects.requireNonNull(config, "config must not be null"));
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config) + System.lineSeparator());
    }

    /**
     * Writes defaults (or merges new defaults into an existing file) and lays out the workspace
     * the configured storage backend and sandbox mode will use.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        RiffConfig config = created || overwrite ? RiffConfig.defaults() : load(configPath);
        save(configPath, config);

        Path workspace = workspace(config);
        Files.createDirectories(ConfigPaths.sessionsDirectory(workspace));
        Files.createDirectories(ConfigPaths.auditEvents(workspace).getParent());
        if ("process".equals(normalize(config.sandbox().mode()))) {
            Files.createDirectories(ConfigPaths.sandboxDirectory(workspace));
        }
        return new OnboardResult(configPath, workspace, created, !created && overwrite);
    }

    public Path workspace(RiffConfig config) {
        return ConfigPaths.resolveWorkspace(config.agents().defaults().workspace());
    }

    /**
     * Session store backend: {@value #SESSION_STORE_ENV} when set, otherwise {@code storage.backend}.
     */
    public String storageBackend(RiffConfig config, Map<String, String> environment) {
        String override = environment.get(SESSION_STORE_ENV);
        String backend = override != null && !override.isBlank() ? normalize(override) : normalize(config.storage().backend());
        if (!STORAGE_BACKENDS.contains(backend)) {
            throw new ConfigurationException("Unknown session store backend '" + backend + "' (expected sqlite or file)");
        }
        return backend;
    }

    private void validate(RiffConfig config) {
        String mode = normalize(config.sandbox().mode());
        if (!SANDBOX_MODES.contains(mode)) {
            throw new ConfigurationException("sandbox.mode must be dry_run or process, was '" + mode + "'");
        }
        String backend = normalize(config.storage().backend());
        if (!STORAGE_BACKENDS.contains(backend)) {
            throw new ConfigurationException("storage.backend must be sqlite or file, was '" + backend + "'");
        }
        ContextConfig context = config.context();
        if (context.maxSize() <= 0 || context.keepRecentTurns() < 1
            || context.consolidationThreshold() <= 0 || context.consolidationThreshold() > 1) {
            throw new ConfigurationException("context needs maxSize > 0, keepRecentTurns >= 1 and a threshold in (0, 1]");
        }
        if (config.agents().defaults().maxContinuationDepth() < 1) {
            throw new ConfigurationException("agents.defaults.maxContinuationDepth must be at least 1");
        }
    }

    private static String normalize(String value) {
        return value == null || value.isBlank() ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static JsonNode overlay(JsonNode defaults, JsonNode file) {
        if (file == null || file.isNull()) {
            return defaults;
        }
        if (defaults == null || !defaults.isObject() || !file.isObject()) {
            return file;
        }
        ObjectNode merged = ((ObjectNode) defaults).deepCopy();
        file.fields().forEachRemaining(entry -> merged.set(entry.getKey(), overlay(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }
}
