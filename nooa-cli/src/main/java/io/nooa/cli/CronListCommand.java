package io.nooa.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List jobs")
public final class CronListCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--active", description = "Only enabled jobs")
    boolean active;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        return CliOutput.emit(context.cronService().list(active), json, CliOutput::formatJobs);
    }
}
