package io.nooa.core.execution;

import io.nooa.core.cron.ExecutionStatus;

public record ExecutionResult(ExecutionStatus status, String output, String error) {

    public static ExecutionResult success(String output) {
        return new ExecutionResult(ExecutionStatus.SUCCESS, output, null);
    }

    public static ExecutionResult failure(String output, String error) {
        return new ExecutionResult(ExecutionStatus.FAILURE, output, error);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
