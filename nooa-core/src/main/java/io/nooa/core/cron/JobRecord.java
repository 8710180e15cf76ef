package io.nooa.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobRecord(
    String id,
    String name,
    String schedule,
    String command,
    String description,
    boolean enabled,
    FailurePolicy onFailure,
    int retries,
    String timeout,
    String startAt,
    String endAt,
    int maxRuns,
    Instant lastRunAt,
    ExecutionStatus lastStatus,
    String nextRunAt,
    Instant createdAt,
    Instant updatedAt
) {

    public static JobRecord create(String id, JobSpec spec, Instant now) {
        return new JobRecord(
            id,
            spec.name(),
            spec.schedule(),
            spec.command(),
            spec.description(),
            spec.enabledOrDefault(),
            spec.onFailureOrDefault(),
            spec.retriesOrDefault(),
            spec.timeout(),
            spec.startAt(),
            spec.endAt(),
            spec.maxRunsOrDefault(),
            null,
            null,
            null,
            now,
            now
        );
    }

    public boolean hasNextRun() {
        return nextRunAt != null && !nextRunAt.isBlank();
    }

    /**
     * Applies the non-null fields of {@code update} on top of this record.
     */
    public JobRecord merge(JobUpdate update, Instant now) {
        return new JobRecord(
            id,
            name,
            pick(update.schedule(), schedule),
            pick(update.command(), command),
            pick(update.description(), description),
            pick(update.enabled(), enabled),
            pick(update.onFailure(), onFailure),
            pick(update.retries(), retries),
            pick(update.timeout(), timeout),
            pick(update.startAt(), startAt),
            pick(update.endAt(), endAt),
            pick(update.maxRuns(), maxRuns),
            pick(update.lastRunAt(), lastRunAt),
            pick(update.lastStatus(), lastStatus),
            update.clearNextRun() ? null : pick(update.nextRunAt(), nextRunAt),
            createdAt,
            now
        );
    }

    private static <T> T pick(T candidate, T current) {
        return candidate != null ? candidate : current;
    }
}
