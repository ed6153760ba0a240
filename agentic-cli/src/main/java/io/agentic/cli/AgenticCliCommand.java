package io.agentic.cli;

import picocli.CommandLine.Command;

@Command(name = "agentic", mixinStandardHelpOptions = true, description = "Conversational chat service backed by an LLM")
public final class AgenticCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
