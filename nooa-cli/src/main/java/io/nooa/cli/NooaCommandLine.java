package io.nooa.cli;

import picocli.CommandLine;

public final class NooaCommandLine {

    private NooaCommandLine() {
    }

    public static CommandLine create(CliContext context) {
        CommandLine commandLine = new CommandLine(new NooaCliCommand());
        commandLine.addSubcommand("cron", CronCommand.create(context));
        return commandLine;
    }
}
