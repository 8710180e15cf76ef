package io.nooa.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "logs", description = "Show execution logs, newest first")
public final class CronLogsCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Option(names = "--limit", description = "How many entries to show (default: 10)")
    Integer limit;

    @Option(names = "--since", description = "Only entries started at or after this ISO-8601 instant")
    String since;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronLogsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        return CliOutput.emit(context.cronService().logs(name, limit, since), json, logs -> CliOutput.formatLogs(name, logs));
    }
}
