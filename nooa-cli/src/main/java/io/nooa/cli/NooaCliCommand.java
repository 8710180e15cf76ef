package io.nooa.cli;

import picocli.CommandLine.Command;

@Command(name = "nooa", mixinStandardHelpOptions = true, description = "Developer automation CLI")
public final class NooaCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
