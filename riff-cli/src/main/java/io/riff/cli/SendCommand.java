package io.riff.cli;

import io.riff.core.agent.TurnResult;
import io.riff.core.agent.TurnStatus;
import io.riff.core.config.model.RiffConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "send", description = "Send one message to the agent and save the session")
public final class SendCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-m", "--model"}, description = "Model override")
    String model;

    @Option(names = {"-p", "--provider"}, description = "Provider override")
    String provider;

    @Option(names = {"-s", "--session"}, description = "Resume a saved session")
    String sessionId;

    @Option(names = "--hide-reasoning", description = "Do not print reasoning")
    boolean hideReasoning;

    public SendCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RiffConfig config = context.configService().load(context.configPath());
            try (SessionBinding binding = SessionBinding.open(context, config, provider, model, sessionId)) {
                ConsoleRenderer renderer = new ConsoleRenderer(System.out, System.err, !hideReasoning);
                TurnResult result = binding.engine().send(message, renderer);
                String savedId = binding.save();
                System.out.println("Session: " + savedId);
                return result.status() == TurnStatus.COMPLETED ? 0 : 1;
            }
        } catch (Exception e) {
            System.err.println("Send command failed: " + e.getMessage());
            return 1;
        }
    }
}
