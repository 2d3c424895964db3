package io.operable.cli;

import picocli.CommandLine.Command;

@Command(
    name = "operable",
    mixinStandardHelpOptions = true,
    version = OperableApplication.VERSION,
    description = "MCP diagnostics server for Google Cloud and GKE"
)
public final class OperableCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
