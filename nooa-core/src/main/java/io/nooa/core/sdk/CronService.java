package io.nooa.core.sdk;

import io.nooa.core.cron.ExecutionLogEntry;
import io.nooa.core.cron.JobConflictException;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.JobSpec;
import io.nooa.core.cron.JobStore;
import io.nooa.core.cron.JobUpdate;
import io.nooa.core.cron.ScheduleCalculator;
import io.nooa.core.daemon.JobRunner;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Job management operations for the CLI and other callers. Nothing here throws: validation,
 * lookup and store failures come back as {@link CronResult} errors.
 */
public final class CronService {
    public static final int DEFAULT_LOG_LIMIT = 10;

    private final JobStore store;
    private final JobRunner runner;

    public CronService(JobStore store, JobRunner runner) {
        this.store = store;
        this.runner = runner;
    }

    public CronResult<JobRecord> add(JobSpec spec) {
        List<String> missing = new ArrayList<>();
        if (blank(spec.name())) {
            missing.add("name");
        }
        if (blank(spec.schedule())) {
            missing.add("schedule");
        }
        if (blank(spec.command())) {
            missing.add("command");
        }
        if (!missing.isEmpty()) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, "Missing required field(s): " + String.join(", ", missing));
        }
        Optional<String> invalid = validate(
            spec.schedule(), spec.retries(), spec.maxRuns(), spec.timeout(), spec.startAt(), spec.endAt()
        );
        if (invalid.isPresent()) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, invalid.get());
        }
        try {
            return CronResult.success(store.create(spec));
        } catch (JobConflictException e) {
            return CronResult.failure(ErrorCode.CONFLICT, e.getMessage());
        } catch (IOException e) {
            return runtimeError("Failed to add job", e);
        }
    }

    public CronResult<List<JobRecord>> list(boolean activeOnly) {
        try {
            List<JobRecord> jobs = store.list();
            return CronResult.success(activeOnly ? jobs.stream().filter(JobRecord::enabled).toList() : jobs);
        } catch (IOException e) {
            return runtimeError("Failed to list jobs", e);
        }
    }

    public CronResult<JobRecord> status(String name) {
        if (blank(name)) {
            return nameRequired();
        }
        try {
            return found(name, store.get(name));
        } catch (IOException e) {
            return runtimeError("Failed to load job", e);
        }
    }

    public CronResult<JobRecord> enable(String name) {
        return toggle(name, true);
    }

    public CronResult<JobRecord> disable(String name) {
        return toggle(name, false);
    }

    public CronResult<Boolean> remove(String name, boolean force) {
        if (blank(name)) {
            return nameRequired();
        }
        if (!force) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, "Use force to remove a job.");
        }
        try {
            if (!store.remove(name)) {
                return notFound(name);
            }
            return CronResult.success(true);
        } catch (IOException e) {
            return runtimeError("Failed to remove job", e);
        }
    }

    /**
     * Updates the definition of a job. Changing the schedule clears the stored next run.
     */
    public CronResult<JobRecord> edit(String name, JobUpdate update) {
        if (blank(name)) {
            return nameRequired();
        }
        if (update == null || !update.changesDefinition()) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, "Provide at least one field to change.");
        }
        if (update.schedule() != null && blank(update.schedule())
            || update.command() != null && blank(update.command())) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, "schedule and command must not be blank");
        }
        Optional<String> invalid = validate(
            update.schedule(), update.retries(), update.maxRuns(), update.timeout(), update.startAt(), update.endAt()
        );
        if (invalid.isPresent()) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, invalid.get());
        }
        try {
            if (!store.update(name, update)) {
                return notFound(name);
            }
            return found(name, store.get(name));
        } catch (IOException e) {
            return runtimeError("Failed to edit job", e);
        }
    }

    /**
     * Runs a job right away through the daemon's execution path. The schedule is left untouched.
     */
    public CronResult<ExecutionLogEntry> run(String name) {
        if (blank(name)) {
            return nameRequired();
        }
        try {
            Optional<JobRecord> job = store.get(name);
            if (job.isEmpty()) {
                return notFound(name);
            }
            Optional<ExecutionLogEntry> entry = runner.run(job.get(), false);
            if (entry.isEmpty()) {
                return notFound(name);
            }
            return CronResult.success(entry.get());
        } catch (IOException e) {
            return runtimeError("Failed to run job", e);
        }
    }

    /**
     * @param since ISO-8601 instant, inclusive; blank for no lower bound
     */
    public CronResult<List<ExecutionLogEntry>> logs(String name, Integer limit, String since) {
        if (blank(name)) {
            return nameRequired();
        }
        if (limit != null && limit <= 0) {
            return CronResult.failure(ErrorCode.INVALID_INPUT, "limit must be > 0");
        }
        Instant sinceInstant = null;
        if (!blank(since)) {
            Optional<Instant> parsed = ScheduleCalculator.parseInstant(since);
            if (parsed.isEmpty()) {
                return CronResult.failure(ErrorCode.INVALID_INPUT, "since must be an ISO-8601 instant: " + since);
            }
            sinceInstant = parsed.get();
        }
        try {
            if (store.get(name).isEmpty()) {
                return notFound(name);
            }
            return CronResult.success(store.listLogs(name, limit == null ? DEFAULT_LOG_LIMIT : limit, sinceInstant));
        } catch (IOException e) {
            return runtimeError("Failed to list logs", e);
        }
    }

    private CronResult<JobRecord> toggle(String name, boolean enabled) {
        if (blank(name)) {
            return nameRequired();
        }
        try {
            if (!store.setEnabled(name, enabled)) {
                return notFound(name);
            }
            return found(name, store.get(name));
        } catch (IOException e) {
            return runtimeError(enabled ? "Failed to enable job" : "Failed to disable job", e);
        }
    }

    private Optional<String> validate(
        String schedule,
        Integer retries,
        Integer maxRuns,
        String timeout,
        String startAt,
        String endAt
    ) {
        if (schedule != null && !ScheduleCalculator.isValid(schedule)) {
            return Optional.of("Unsupported schedule '" + schedule
                + "': use <N><s|m|h|d>, @hourly, @daily or an ISO-8601 instant");
        }
        if (retries != null && retries < 0) {
            return Optional.of("retries must be >= 0");
        }
        if (maxRuns != null && maxRuns < 0) {
            return Optional.of("maxRuns must be >= 0");
        }
        if (!blank(timeout) && ScheduleCalculator.interval(timeout).isEmpty()) {
            return Optional.of("timeout must look like <N><s|m|h|d>: " + timeout);
        }
        if (!blank(startAt) && ScheduleCalculator.parseInstant(startAt).isEmpty()) {
            return Optional.of("startAt must be an ISO-8601 instant: " + startAt);
        }
        if (!blank(endAt) && ScheduleCalculator.parseInstant(endAt).isEmpty()) {
            return Optional.of("endAt must be an ISO-8601 instant: " + endAt);
        }
        return Optional.empty();
    }

    private CronResult<JobRecord> found(String name, Optional<JobRecord> job) {
        return job.map(CronResult::success).orElseGet(() -> notFound(name));
    }

    private static <T> CronResult<T> notFound(String name) {
        return CronResult.failure(ErrorCode.NOT_FOUND, "Job '" + name + "' not found.");
    }

    private static <T> CronResult<T> nameRequired() {
        return CronResult.failure(ErrorCode.INVALID_INPUT, "Job name is required.");
    }

    private static <T> CronResult<T> runtimeError(String message, IOException e) {
        return CronResult.failure(ErrorCode.RUNTIME_ERROR, message + ": " + e.getMessage());
    }

    private static boolean blank(String value) {
        return value == null || value.isBlank();
    }
}
