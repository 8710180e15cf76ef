package io.nooa.cli;

import io.nooa.core.daemon.DaemonStatus;
import io.nooa.core.sdk.ErrorCode;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "daemon", description = "Manage the background scheduler: start, stop, status, run (foreground)")
public final class CronDaemonCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "start, stop, status or run")
    String action;

    @Option(names = "--json", description = "Emit JSON output")
    boolean json;

    public CronDaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return switch (action.toLowerCase(Locale.ROOT)) {
                case "start" -> print(context.supervisor().start(context.daemonEntrypoint()));
                case "stop" -> print(context.supervisor().stop());
                case "status" -> print(context.supervisor().status());
                case "run" -> context.daemonRunner().run();
                default -> {
                    System.err.println("Unknown daemon action '" + action + "'. Use start, stop, status or run.");
                    yield ErrorCode.INVALID_INPUT.exitCode();
                }
            };
        } catch (Exception e) {
            System.err.println("Daemon command failed: " + e.getMessage());
            return ErrorCode.RUNTIME_ERROR.exitCode();
        }
    }

    private int print(DaemonStatus status) {
        if (json) {
            System.out.println(CliOutput.toJson(status));
        } else if (status.running()) {
            System.out.println("Cron daemon running (pid " + status.pid() + ").");
        } else {
            System.out.println("Cron daemon not running.");
        }
        return 0;
    }
}
