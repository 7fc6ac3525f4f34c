package io.riff.core.config;

import java.nio.file.Path;

/**
 * Where Riff keeps its files. Everything except {@code config.json} lives under the workspace.
 */
public final class ConfigPaths {
    private static final Path RIFF_HOME = Path.of(System.getProperty("user.home"), ".riff");

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return RIFF_HOME.resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return RIFF_HOME.resolve("workspace");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path sessionsDirectory(Path workspace) {
        return workspace.resolve("sessions");
    }

    public static Path sessionsDatabase(Path workspace) {
        return workspace.resolve("sessions.db");
    }

    public static Path auditEvents(Path workspace) {
        return workspace.resolve("audit").resolve("audit-events.json");
    }

    public static Path sandboxDirectory(Path workspace) {
        return workspace.resolve("sandbox");
    }
}
