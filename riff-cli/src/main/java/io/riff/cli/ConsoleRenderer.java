package io.riff.cli;

import io.riff.core.event.TurnEvent;
import io.riff.core.event.TurnListener;
import java.io.PrintStream;
import java.util.Map;

public final class ConsoleRenderer implements TurnListener {
    private final PrintStream out;
    private final PrintStream err;
    private final boolean showReasoning;

    public ConsoleRenderer(PrintStream out, PrintStream err, boolean showReasoning) {
        this.out = out;
        this.err = err;
        this.showReasoning = showReasoning;
    }

    @Override
    public void onEvent(TurnEvent event) {
        switch (event.type()) {
            case REASONING_STARTED -> {
                if (showReasoning) {
                    out.print("[thinking] ");
                }
            }
            case REASONING_CHUNK -> {
                if (showReasoning) {
                    out.print(event.text());
                }
            }
            case REASONING_ENDED -> {
                if (showReasoning) {
                    out.println();
                }
            }
            case NARRATION_CHUNK -> out.print(event.text());
            case NARRATION_ENDED -> out.println();
            case CALL_RESOLVED -> out.println(describeCall(event.payload()));
            case ERROR -> err.println("Error: " + event.payload().get("message"));
            default -> {
            }
        }
        out.flush();
    }

    private String describeCall(Map<String, Object> payload) {
        StringBuilder line = new StringBuilder("  > ").append(payload.get("name"));
        if (payload.get("result") instanceof Map<?, ?> result) {
            line.append(" [").append(result.get("status")).append(']');
            Object code = result.get("code");
            if (code != null) {
                line.append(' ').append(code);
            }
            Object error = result.get("error");
            if (error != null) {
                line.append(" (").append(error).append(')');
            }
        }
        return line.toString();
    }
}
