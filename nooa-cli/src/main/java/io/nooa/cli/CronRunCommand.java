package io.nooa.cli;

import io.nooa.core.cron.ExecutionLogEntry;
import io.nooa.core.cron.ExecutionStatus;
import io.nooa.core.sdk.CronResult;
import io.nooa.core.sdk.ErrorCode;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "run", description = "Run a job immediately and record the result")
public final class CronRunCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Job name")
    String name;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronRunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        CronResult<ExecutionLogEntry> result = context.cronService().run(name);
        int code = CliOutput.emit(result, json, log -> CliOutput.formatLogs(name, List.of(log)));
        if (code == 0 && result.data().status() == ExecutionStatus.FAILURE) {
            return ErrorCode.EXECUTION_FAILURE.exitCode();
        }
        return code;
    }
}
