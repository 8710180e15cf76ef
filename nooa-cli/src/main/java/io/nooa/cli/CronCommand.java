package io.nooa.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(name = "cron", mixinStandardHelpOptions = true, description = "Manage recurring jobs")
public final class CronCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    public static CommandLine create(CliContext context) {
        CommandLine cron = new CommandLine(new CronCommand());
        cron.addSubcommand("add", new CronAddCommand(context));
        cron.addSubcommand("list", new CronListCommand(context));
        cron.addSubcommand("status", new CronStatusCommand(context));
        cron.addSubcommand("remove", new CronRemoveCommand(context));
        cron.addSubcommand("enable", new CronEnableCommand(context), "resume");
        cron.addSubcommand("disable", new CronDisableCommand(context), "pause");
        cron.addSubcommand("edit", new CronEditCommand(context));
        cron.addSubcommand("run", new CronRunCommand(context));
        cron.addSubcommand("logs", new CronLogsCommand(context), "history");
        cron.addSubcommand("daemon", new CronDaemonCommand(context));
        return cron;
    }
}
