package io.nooa.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "disable", description = "Disable a job")
public final class CronDisableCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronDisableCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        return CliOutput.emit(context.cronService().disable(name), json, job -> "Job '" + job.name() + "' is disabled.");
    }
}
