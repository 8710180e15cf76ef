package io.nooa.cli;

import io.nooa.core.cron.FailurePolicy;
import io.nooa.core.cron.JobUpdate;
import io.nooa.core.sdk.CronResult;
import io.nooa.core.sdk.ErrorCode;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "edit", description = "Update a job definition")
public final class CronEditCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Option(names = {"--schedule", "--every"}, description = "New schedule")
    String schedule;

    @Option(names = "--command", description = "New command")
    String command;

    @Option(names = "--description", description = "New description")
    String description;

    @Option(names = "--on-failure", description = "notify, retry or ignore")
    String onFailure;

    @Option(names = {"--retries", "--retry"}, description = "Retry budget")
    Integer retries;

    @Option(names = "--timeout", description = "Max runtime, e.g. 30m")
    String timeout;

    @Option(names = "--start-at", description = "Do not run before this ISO-8601 instant")
    String startAt;

    @Option(names = "--end-at", description = "Do not run after this ISO-8601 instant")
    String endAt;

    @Option(names = "--max-runs", description = "Maximum number of runs (0 = unlimited)")
    Integer maxRuns;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronEditCommand(CliContext context) {
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
        JobUpdate update = JobUpdate.definition(
            schedule,
            command,
            description,
            policy,
            retries,
            timeout,
            startAt,
            endAt,
            maxRuns
        );
        return CliOutput.emit(context.cronService().edit(name, update), json, job -> "Job '" + job.name() + "' updated.");
    }
}
