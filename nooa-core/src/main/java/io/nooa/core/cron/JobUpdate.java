package io.nooa.core.cron;

import java.time.Instant;

// null fields are left unchanged
public record JobUpdate(
    String schedule,
    String command,
    String description,
    Boolean enabled,
    FailurePolicy onFailure,
    Integer retries,
    String timeout,
    String startAt,
    String endAt,
    Integer maxRuns,
    Instant lastRunAt,
    ExecutionStatus lastStatus,
    String nextRunAt,
    boolean clearNextRun
) {

    public static JobUpdate empty() {
        return new JobUpdate(null, null, null, null, null, null, null, null, null, null, null, null, null, false);
    }

    public static JobUpdate enabled(boolean value) {
        return new JobUpdate(null, null, null, value, null, null, null, null, null, null, null, null, null, false);
    }

    public static JobUpdate nextRun(Instant nextRunAt) {
        return new JobUpdate(null, null, null, null, null, null, null, null, null, null, null, null, nextRunAt.toString(), false);
    }

    public static JobUpdate afterRun(Instant finishedAt, ExecutionStatus status, Instant nextRunAt) {
        return new JobUpdate(
            null, null, null, null, null, null, null, null, null, null,
            finishedAt,
            status,
            nextRunAt == null ? null : nextRunAt.toString(),
            false
        );
    }

    public static JobUpdate definition(
        String schedule,
        String command,
        String description,
        FailurePolicy onFailure,
        Integer retries,
        String timeout,
        String startAt,
        String endAt,
        Integer maxRuns
    ) {
        return new JobUpdate(
            schedule, command, description, null, onFailure, retries, timeout, startAt, endAt, maxRuns,
            null, null, null,
            schedule != null
        );
    }

    public boolean changesDefinition() {
        return schedule != null
            || command != null
            || description != null
            || onFailure != null
            || retries != null
            || timeout != null
            || startAt != null
            || endAt != null
            || maxRuns != null;
    }
}
