package io.riff.cli;

import io.riff.core.agent.TurnResult;
import io.riff.core.agent.TurnStatus;
import io.riff.core.config.model.RiffConfig;
import io.riff.core.sandbox.ExecutionResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "chat", description = "Interactive session; lines starting with / are commands")
public final class ChatCommand implements Callable<Integer> {
    private static final String HELP = "Commands: /state /code /stop /clear /save /sessions /quit";

    private final CliContext context;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"-s", "--session"}, description = "Resume a saved session")
    String sessionId;

    @Option(names = "--hide-reasoning", description = "Do not print reasoning")
    boolean hideReasoning;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RiffConfig config = context.configService().load(context.configPath());
            try (SessionBinding binding = SessionBinding.open(context, config, provider, model, sessionId)) {
                System.out.println("Session " + binding.engine().session().id() + ". " + HELP);
                loop(binding);
                System.out.println("Saved session: " + binding.save());
                return 0;
            }
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private void loop(SessionBinding binding) throws IOException {
        ConsoleRenderer renderer = new ConsoleRenderer(System.out, System.err, !hideReasoning);
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        while (true) {
            System.out.print("riff> ");
            System.out.flush();
            String line = in.readLine();
            if (line == null) {
                return;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith("/")) {
                if (!handleCommand(line, binding)) {
                    return;
                }
                continue;
            }
            TurnResult result = binding.engine().send(line, renderer);
            if (result.status() == TurnStatus.COMPLETED) {
                binding.save();
            }
        }
    }

    private boolean handleCommand(String line, SessionBinding binding) throws IOException {
        switch (line) {
            case "/quit", "/exit" -> {
                return false;
            }
            case "/state" -> System.out.println(binding.engine().session().describe());
            case "/code" -> {
                String code = binding.engine().currentCode();
                System.out.println(code.isEmpty() ? "(nothing playing)" : code);
            }
            case "/stop" -> {
                ExecutionResult result = binding.engine().stopAll();
                System.out.println(result.success() ? "Stopped all music" : "Stop failed: " + result.error());
            }
            case "/clear" -> {
                binding.engine().clearContext();
                System.out.println("Conversation context cleared");
            }
            case "/save" -> System.out.println("Saved session: " + binding.save());
            case "/sessions" -> {
                List<String> ids = binding.store().list();
                System.out.println(ids.isEmpty() ? "(no saved sessions)" : String.join(System.lineSeparator(), ids));
            }
            default -> System.out.println(HELP);
        }
        return true;
    }
}
