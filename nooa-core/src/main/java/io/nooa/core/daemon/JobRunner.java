package io.nooa.core.daemon;

import io.nooa.core.cron.ExecutionLogEntry;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.JobStore;
import io.nooa.core.cron.JobUpdate;
import io.nooa.core.cron.ScheduleCalculator;
import io.nooa.core.execution.CommandExecutor;
import io.nooa.core.execution.ExecutionResult;
import io.nooa.core.heartbeat.HeartbeatService;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JobRunner {
    private static final Logger LOG = LoggerFactory.getLogger(JobRunner.class);

    private final JobStore store;
    private final CommandExecutor executor;
    private final HeartbeatService heartbeat;
    private final Clock clock;

    public JobRunner(JobStore store, CommandExecutor executor, HeartbeatService heartbeat, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.heartbeat = heartbeat;
        this.clock = clock;
    }

    /**
     * @param reschedule when true the next run is computed from the finish instant and one-shot
     *                   jobs are deleted; when false only {@code lastRunAt}/{@code lastStatus} change
     * @return the stored log entry, or empty when the job was removed while it ran
     */
    public Optional<ExecutionLogEntry> run(JobRecord job, boolean reschedule) throws IOException {
        Instant startedAt = clock.instant();
        ExecutionResult result = execute(job);
        Instant finishedAt = clock.instant();

        ExecutionLogEntry stored;
        try {
            stored = store.appendLog(job.id(), new ExecutionLogEntry(
                null,
                job.id(),
                job.name(),
                result.status(),
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt).toMillis(),
                result.output(),
                result.error(),
                null
            ));
        } catch (IllegalArgumentException e) {
            LOG.debug("Job {} was removed while it was running", job.name());
            return Optional.empty();
        }
        LOG.debug("Job {} finished with {} in {} ms", job.name(), result.status().value(), stored.durationMs());

        if (!reschedule) {
            store.update(job.name(), JobUpdate.afterRun(finishedAt, result.status(), null));
        } else if (ScheduleCalculator.isOneShot(job.schedule())) {
            store.remove(job.name());
        } else {
            Instant next = ScheduleCalculator.computeNextRun(job.schedule(), finishedAt);
            store.update(job.name(), JobUpdate.afterRun(finishedAt, result.status(), next));
        }
        return Optional.of(stored);
    }

    private ExecutionResult execute(JobRecord job) {
        if (HeartbeatService.isHeartbeat(job.command())) {
            return heartbeat.run();
        }
        try {
            ExecutionResult result = executor.execute(job);
            return result != null ? result : ExecutionResult.failure("", "Executor returned no result");
        } catch (RuntimeException e) {
            LOG.debug("Executor failed for job {}", job.name(), e);
            return ExecutionResult.failure("", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }
}
