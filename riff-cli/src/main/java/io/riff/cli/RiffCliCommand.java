package io.riff.cli;

import picocli.CommandLine.Command;

@Command(name = "riff", mixinStandardHelpOptions = true, description = "Conversational live-coding music agent")
public final class RiffCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
