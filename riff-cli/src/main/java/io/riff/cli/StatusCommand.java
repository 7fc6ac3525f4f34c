package io.riff.cli;

import io.riff.core.config.model.RiffConfig;
import io.riff.core.session.ConversationTurn;
import io.riff.core.session.SessionSnapshot;
import io.riff.core.session.SessionSnapshotStore;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configuration, storage and audit status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-s", "--session"}, description = "Also describe a saved session")
    String sessionId;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RiffConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Workspace: " + context.configService().workspace(config));
            System.out.println("Default provider: " + config.agents().defaults().provider());
            System.out.println("Default model: " + config.agents().defaults().model());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Anthropic configured: " + config.providers().anthropic().configured());
            System.out.println("Sandbox: " + config.sandbox().mode());
            System.out.println("Context window: " + config.context().maxSize() + " (approx. size units), consolidate at "
                + Math.round(config.context().consolidationThreshold() * 100) + "%");

            SessionSnapshotStore store = context.snapshotStoreFactory().open(config);
            System.out.println("Session store: " + context.configService().storageBackend(config, System.getenv()));
            System.out.println("Saved sessions: " + store.list().size());
            if (sessionId != null && !sessionId.isBlank()) {
                SessionSnapshot snapshot = store.load(sessionId).orElse(null);
                if (snapshot == null) {
                    System.err.println("Unknown session: " + sessionId);
                    return 1;
                }
                printSession(snapshot);
            }

            if (context.observability() != null) {
                Map<String, Long> counts = context.observability().countsByType();
                System.out.println("Audit events: " + counts.values().stream().mapToLong(Long::longValue).sum());
                counts.forEach((type, count) -> System.out.println("  " + type + ": " + count));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }

    private void printSession(SessionSnapshot snapshot) {
        List<ConversationTurn> turns = snapshot.turns();
        int size = turns.stream().mapToInt(ConversationTurn::sizeEstimate).sum();
        System.out.println("Session " + snapshot.sessionId() + ": tempo " + snapshot.tempo()
            + ", " + snapshot.layers().size() + " layer(s), " + turns.size() + " turn(s), approx. size " + size);
    }
}
