package io.nooa.cli;

import io.nooa.core.daemon.ProcessSupervisor;
import io.nooa.core.sdk.CronService;
import java.util.List;

public record CliContext(
    CronService cronService,
    ProcessSupervisor supervisor,
    List<String> daemonEntrypoint,
    DaemonRunner daemonRunner
) {
}
