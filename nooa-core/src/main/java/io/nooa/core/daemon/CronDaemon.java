package io.nooa.core.daemon;

import io.nooa.core.config.CronSettings;
import io.nooa.core.cron.JobConflictException;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.JobSpec;
import io.nooa.core.cron.JobStore;
import io.nooa.core.cron.JobUpdate;
import io.nooa.core.cron.ScheduleCalculator;
import io.nooa.core.heartbeat.HeartbeatService;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CronDaemon {
    private static final Logger LOG = LoggerFactory.getLogger(CronDaemon.class);

    private final JobStore store;
    private final JobRunner runner;
    private final CronSettings settings;
    private final Clock clock;
    private final CountDownLatch wakeUp = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile boolean stopRequested;

    public CronDaemon(JobStore store, JobRunner runner, CronSettings settings, Clock clock) {
        this.store = store;
        this.runner = runner;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Creates the heartbeat job when heartbeat is enabled and the job is missing.
     *
     * @return true when a job was created
     */
    public boolean ensureSystemJobs() throws IOException {
        if (!settings.heartbeatEnabled() || store.get(HeartbeatService.JOB_NAME).isPresent()) {
            return false;
        }
        JobSpec heartbeat = new JobSpec(
            HeartbeatService.JOB_NAME,
            settings.heartbeatSchedule(),
            HeartbeatService.COMMAND,
            HeartbeatService.DESCRIPTION,
            true,
            null,
            null,
            null,
            null,
            null,
            null
        );
        try {
            store.create(heartbeat);
            LOG.info("Created heartbeat job with schedule {}", settings.heartbeatSchedule());
            return true;
        } catch (JobConflictException e) {
            return false;
        }
    }

    /**
     * @return number of jobs executed during this tick
     */
    public int tick(Instant now) throws IOException {
        ensureSystemJobs();
        int executed = 0;
        for (JobRecord job : store.list()) {
            if (!job.enabled()) {
                continue;
            }
            if (!job.hasNextRun()) {
                store.update(job.name(), JobUpdate.nextRun(firstRun(job, now)));
                continue;
            }
            if (!ScheduleCalculator.isDue(now, job.nextRunAt())) {
                continue;
            }
            if (expired(job, now) || exhausted(job)) {
                LOG.debug("Skipping job {}: outside its run window", job.name());
                continue;
            }
            runner.run(job, true);
            executed++;
        }
        return executed;
    }

    /**
     * Blocks until {@link #requestStop()} is called. The tick in progress always completes.
     */
    public void runLoop() throws IOException {
        ensureSystemJobs();
        LOG.info("Cron daemon started, polling every {} ms", settings.pollInterval().toMillis());
        try {
            while (!stopRequested) {
                int executed = tick(clock.instant());
                if (executed > 0) {
                    LOG.debug("Tick executed {} job(s)", executed);
                }
                if (!stopRequested) {
                    pause(settings.pollInterval());
                }
            }
        } finally {
            stopped.countDown();
            LOG.info("Cron daemon stopped");
        }
    }

    public void requestStop() {
        stopRequested = true;
        wakeUp.countDown();
    }

    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void pause(Duration interval) {
        try {
            wakeUp.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    private Instant firstRun(JobRecord job, Instant now) {
        Instant computed = ScheduleCalculator.computeNextRun(job.schedule(), now);
        Optional<Instant> startAt = ScheduleCalculator.parseInstant(job.startAt());
        if (startAt.isPresent() && startAt.get().isAfter(computed)) {
            return startAt.get();
        }
        return computed;
    }

    private boolean expired(JobRecord job, Instant now) {
        return ScheduleCalculator.parseInstant(job.endAt())
            .map(now::isAfter)
            .orElse(false);
    }

    private boolean exhausted(JobRecord job) throws IOException {
        if (job.maxRuns() <= 0) {
            return false;
        }
        return store.listLogs(job.name(), job.maxRuns(), null).size() >= job.maxRuns();
    }
}
