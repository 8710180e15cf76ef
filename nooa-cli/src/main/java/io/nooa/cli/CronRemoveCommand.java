package io.nooa.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Remove a job and its logs (requires --force)")
public final class CronRemoveCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Option(names = "--force", description = "Confirm removal")
    boolean force;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronRemoveCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        return CliOutput.emit(context.cronService().remove(name, force), json, removed -> "Job '" + name + "' removed.");
    }
}
