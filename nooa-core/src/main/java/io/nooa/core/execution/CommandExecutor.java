package io.nooa.core.execution;

import io.nooa.core.cron.JobRecord;

@FunctionalInterface
public interface CommandExecutor {
    ExecutionResult execute(JobRecord job);
}
