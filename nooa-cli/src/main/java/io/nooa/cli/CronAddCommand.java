package io.nooa.cli;

import io.nooa.core.cron.FailurePolicy;
import io.nooa.core.cron.JobSpec;
import io.nooa.core.sdk.CronResult;
import io.nooa.core.sdk.ErrorCode;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "add", description = "Create a job: add <name> --schedule <5m> --command <cmd> (or -- <cmd...>)")
public final class CronAddCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Parameters(index = "1..*", arity = "0..*", description = "Command words (after --)")
    List<String> commandWords;

    @Option(names = {"--schedule", "--every"}, description = "Interval (30s, 5m, 6h, 1d), @hourly, @daily or an ISO-8601 instant")
    String schedule;

    @Option(names = "--command", description = "Command to run")
    String command;

    @Option(names = "--description", description = "Job description")
    String description;

    @Option(names = "--on-failure", description = "notify, retry or ignore (default: notify)")
    String onFailure;

    @Option(names = {"--retries", "--retry"}, description = "Retry budget for --on-failure retry")
    Integer retries;

    @Option(names = "--timeout", description = "Max runtime, e.g. 30m")
    String timeout;

    @Option(names = "--start-at", description = "Do not run before this ISO-8601 instant")
    String startAt;

    @Option(names = "--end-at", description = "Do not run after this ISO-8601 instant")
    String endAt;

    @Option(names = "--max-runs", description = "Maximum number of runs (0 = unlimited)")
    Integer maxRuns;

    @Option(names = "--disabled", description = "Create the job disabled")
    boolean disabled;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronAddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        FailurePolicy policy;
        try {
            policy = onFailure == null ? null : FailurePolicy.fromValue(onFailure);
        } catch (IllegalArgumentException e) {
            return CliOutput.emit(CronResult.failure(ErrorCode.INVALID_INPUT, e.getMessage()), json, ignored -> "");
        }
        String resolvedCommand = command;
        if ((resolvedCommand == null || resolvedCommand.isBlank()) && commandWords != null && !commandWords.isEmpty()) {
            resolvedCommand = String.join(" ", commandWords);
        }

        JobSpec spec = new JobSpec(
            name,
            schedule,
            resolvedCommand,
            description,
            !disabled,
            policy,
            retries,
            timeout,
            startAt,
            endAt,
            maxRuns
        );
        return CliOutput.emit(
            context.cronService().add(spec),
            json,
            job -> "Job '" + job.name() + "' scheduled for '" + job.schedule() + "'."
        );
    }
}
