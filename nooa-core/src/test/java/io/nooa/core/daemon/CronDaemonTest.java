package io.nooa.core.daemon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.nooa.core.config.CronSettings;
import io.nooa.core.cron.ExecutionLogEntry;
import io.nooa.core.cron.ExecutionStatus;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.JobSpec;
import io.nooa.core.cron.JobSpecs;
import io.nooa.core.cron.JobUpdate;
import io.nooa.core.cron.MutableClock;
import io.nooa.core.cron.SqliteJobStore;
import io.nooa.core.execution.CommandExecutor;
import io.nooa.core.execution.ExecutionResult;
import io.nooa.core.heartbeat.HeartbeatService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronDaemonTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteJobStore store;
    private List<String> executed;
    private HeartbeatService heartbeat;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW);
        store = new SqliteJobStore(tempDir.resolve("nooa.db"), clock);
        executed = new ArrayList<>();
        heartbeat = new HeartbeatService(tempDir);
    }

    @Test
    void shouldScheduleNewJobsWithoutRunningThem() throws Exception {
        store.create(JobSpecs.of("backup", "5m", "echo backup"));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        int ran = daemon.tick(NOW);

        assertThat(ran).isZero();
        assertThat(executed).isEmpty();
        assertThat(store.get("backup").orElseThrow().nextRunAt()).isEqualTo(NOW.plusSeconds(300).toString());
        assertThat(store.listLogs("backup", 10, null)).isEmpty();
    }

    @Test
    void shouldRunDueJobOnceAndRescheduleFromFinish() throws Exception {
        store.create(JobSpecs.of("backup", "5m", "echo backup"));
        store.update("backup", JobUpdate.nextRun(NOW.minusSeconds(1)));
        CommandExecutor slow = job -> {
            executed.add(job.name());
            clock.advanceSeconds(90);
            return ExecutionResult.success("done");
        };
        CronDaemon daemon = daemon(slow, false);

        int ran = daemon.tick(NOW);

        assertThat(ran).isEqualTo(1);
        assertThat(executed).containsExactly("backup");
        List<ExecutionLogEntry> logs = store.listLogs("backup", 10, null);
        assertThat(logs).singleElement().satisfies(log -> {
            assertThat(log.status()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(log.output()).isEqualTo("done");
            assertThat(log.startedAt()).isEqualTo(NOW);
            assertThat(log.finishedAt()).isEqualTo(NOW.plusSeconds(90));
            assertThat(log.durationMs()).isEqualTo(90_000);
        });
        JobRecord job = store.get("backup").orElseThrow();
        assertThat(job.lastStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(job.lastRunAt()).isEqualTo(NOW.plusSeconds(90));
        assertThat(job.nextRunAt()).isEqualTo(NOW.plusSeconds(90 + 300).toString());

        assertThat(daemon.tick(clock.instant())).isZero();
        assertThat(store.listLogs("backup", 10, null)).hasSize(1);
    }

    @Test
    void shouldKeepTickingWhenStoredScheduleOverflows() throws Exception {
        store.create(JobSpecs.of("huge", "99999999999999d", "echo huge"));
        store.create(JobSpecs.of("normal", "5m", "echo normal"));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        assertThat(daemon.tick(NOW)).isZero();

        assertThat(store.get("huge").orElseThrow().nextRunAt()).isEqualTo(NOW.plusSeconds(60).toString());
        assertThat(store.get("normal").orElseThrow().nextRunAt()).isEqualTo(NOW.plusSeconds(300).toString());

        clock.advanceSeconds(61);
        assertThat(daemon.tick(clock.instant())).isEqualTo(1);
        assertThat(executed).containsExactly("huge");
    }

    @Test
    void shouldSkipFutureAndDisabledJobs() throws Exception {
        store.create(JobSpecs.of("later", "5m", "echo later"));
        store.update("later", JobUpdate.nextRun(NOW.plusSeconds(10)));
        store.create(JobSpecs.disabled("off", "5m", "echo off"));
        store.update("off", JobUpdate.nextRun(NOW.minusSeconds(10)));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        assertThat(daemon.tick(NOW)).isZero();
        assertThat(executed).isEmpty();
    }

    @Test
    void shouldRecordFailuresAndKeepGoing() throws Exception {
        store.create(JobSpecs.of("broken", "1m", "exit 9"));
        store.update("broken", JobUpdate.nextRun(NOW.minusSeconds(5)));
        store.create(JobSpecs.of("healthy", "1m", "echo ok"));
        store.update("healthy", JobUpdate.nextRun(NOW.minusSeconds(5)));
        CommandExecutor executor = job -> {
            executed.add(job.name());
            if (job.name().equals("broken")) {
                throw new IllegalStateException("exploded");
            }
            return ExecutionResult.success("ok");
        };
        CronDaemon daemon = daemon(executor, false);

        assertThat(daemon.tick(NOW)).isEqualTo(2);

        assertThat(executed).containsExactlyInAnyOrder("broken", "healthy");
        JobRecord broken = store.get("broken").orElseThrow();
        assertThat(broken.enabled()).isTrue();
        assertThat(broken.lastStatus()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(store.listLogs("broken", 1, null).get(0).error()).contains("exploded");
        assertThat(store.get("healthy").orElseThrow().lastStatus()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    void shouldDeleteOneShotJobsAfterTheirRun() throws Exception {
        String at = NOW.plusSeconds(30).toString();
        store.create(JobSpecs.of("once", "at " + at, "echo once"));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        daemon.tick(NOW);
        assertThat(store.get("once").orElseThrow().nextRunAt()).isEqualTo(at);

        clock.advanceSeconds(31);
        assertThat(daemon.tick(clock.instant())).isEqualTo(1);

        assertThat(executed).containsExactly("once");
        assertThat(store.get("once")).isEmpty();
    }

    @Test
    void shouldCreateHeartbeatJobOnlyOnce() throws Exception {
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), true);

        assertThat(daemon.ensureSystemJobs()).isTrue();
        assertThat(daemon.ensureSystemJobs()).isFalse();
        daemon.tick(NOW);

        assertThat(store.list())
            .filteredOn(job -> job.name().equals(HeartbeatService.JOB_NAME))
            .singleElement()
            .satisfies(job -> {
                assertThat(job.command()).isEqualTo(HeartbeatService.COMMAND);
                assertThat(job.schedule()).isEqualTo("15m");
            });
    }

    @Test
    void shouldNotCreateHeartbeatWhenDisabled() throws Exception {
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        daemon.tick(NOW);

        assertThat(store.get(HeartbeatService.JOB_NAME)).isEmpty();
    }

    @Test
    void shouldRunHeartbeatNativelyRegardlessOfExecutor() throws Exception {
        Files.createDirectories(tempDir.resolve(".nooa"));
        Files.writeString(tempDir.resolve(".nooa/HEARTBEAT.md"), "  check the inbox \n");
        CommandExecutor failing = job -> {
            throw new IllegalStateException("should not be called");
        };
        CronDaemon daemon = daemon(failing, true);
        daemon.ensureSystemJobs();
        store.update(HeartbeatService.JOB_NAME, JobUpdate.nextRun(NOW.minusSeconds(1)));

        assertThat(daemon.tick(NOW)).isEqualTo(1);

        ExecutionLogEntry log = store.listLogs(HeartbeatService.JOB_NAME, 1, null).get(0);
        assertThat(log.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(log.output()).isEqualTo("check the inbox");
    }

    @Test
    void shouldRespectRunWindowAndMaxRuns() throws Exception {
        store.create(new JobSpec("limited", "1m", "echo hi", null, true, null, null, null, null, null, 1));
        store.update("limited", JobUpdate.nextRun(NOW.minusSeconds(1)));
        store.create(new JobSpec("expired", "1m", "echo hi", null, true, null, null, null, null, NOW.minusSeconds(60).toString(), null));
        store.update("expired", JobUpdate.nextRun(NOW.minusSeconds(1)));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        assertThat(daemon.tick(NOW)).isEqualTo(1);
        clock.advanceSeconds(120);
        assertThat(daemon.tick(clock.instant())).isZero();

        assertThat(executed).containsExactly("limited");
    }

    @Test
    void shouldDelayFirstRunUntilStartAt() throws Exception {
        Instant startAt = NOW.plusSeconds(3_600);
        store.create(new JobSpec("later", "1m", "echo hi", null, true, null, null, null, startAt.toString(), null, null));
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        daemon.tick(NOW);

        assertThat(store.get("later").orElseThrow().nextRunAt()).isEqualTo(startAt.toString());
    }

    @Test
    void shouldStopLoopWhenRequested() throws Exception {
        store.create(JobSpecs.of("backup", "5m", "echo backup"));
        CronSettings settings = CronSettings.defaults(tempDir)
            .withHeartbeat(false, "30m")
            .withPollInterval(Duration.ofMillis(50));
        CronDaemon daemon = new CronDaemon(store, runner(recording(ExecutionResult.success("ok"))), settings, clock);

        CompletableFuture<Void> loop = CompletableFuture.runAsync(() -> {
            try {
                daemon.runLoop();
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(150);
        daemon.requestStop();

        assertThat(daemon.awaitStopped(Duration.ofSeconds(5))).isTrue();
        loop.get(5, TimeUnit.SECONDS);
        assertThat(store.get("backup").orElseThrow().hasNextRun()).isTrue();
    }

    @Test
    void shouldPropagateStoreFailures() throws Exception {
        store.create(JobSpecs.of("backup", "5m", "echo backup"));
        Path db = tempDir.resolve("nooa.db");
        Files.delete(db);
        Files.createDirectories(db);
        CronDaemon daemon = daemon(recording(ExecutionResult.success("ok")), false);

        assertThatThrownBy(() -> daemon.tick(NOW)).isInstanceOf(IOException.class);
    }

    private CronDaemon daemon(CommandExecutor executor, boolean heartbeatEnabled) {
        CronSettings settings = CronSettings.defaults(tempDir).withHeartbeat(heartbeatEnabled, "15m");
        return new CronDaemon(store, runner(executor), settings, clock);
    }

    private JobRunner runner(CommandExecutor executor) {
        return new JobRunner(store, executor, heartbeat, clock);
    }

    private CommandExecutor recording(ExecutionResult result) {
        return job -> {
            executed.add(job.name());
            return result;
        };
    }
}
