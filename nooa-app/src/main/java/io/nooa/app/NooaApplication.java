package io.nooa.app;

import io.nooa.cli.CliContext;
import io.nooa.cli.NooaCommandLine;
import io.nooa.core.config.ConfigPaths;
import io.nooa.core.config.CronSettings;
import io.nooa.core.config.StoreBackend;
import io.nooa.core.cron.FileJobStore;
import io.nooa.core.cron.JobStore;
import io.nooa.core.cron.SqliteJobStore;
import io.nooa.core.daemon.CronDaemon;
import io.nooa.core.daemon.DaemonEntrypoint;
import io.nooa.core.daemon.JobRunner;
import io.nooa.core.daemon.ProcessSupervisor;
import io.nooa.core.execution.ShellCommandExecutor;
import io.nooa.core.heartbeat.HeartbeatService;
import io.nooa.core.sdk.CronService;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class NooaApplication {
    private static final Logger LOG = LoggerFactory.getLogger(NooaApplication.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private NooaApplication() {
    }

    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        Path workspace = ConfigPaths.resolveWorkspace(env.get("NOOA_WORKSPACE"));
        CronSettings settings = CronSettings.fromEnv(env, workspace);
        Clock clock = Clock.systemUTC();

        JobStore store = buildJobStore(settings, clock);
        HeartbeatService heartbeat = new HeartbeatService(workspace);
        JobRunner runner = new JobRunner(store, new ShellCommandExecutor(workspace, heartbeat), heartbeat, clock);
        CronService cronService = new CronService(store, runner);

        CliContext context = new CliContext(
            cronService,
            new ProcessSupervisor(settings.pidPath(), workspace),
            DaemonEntrypoint.forMainClass(NooaApplication.class, "cron", "daemon", "run"),
            () -> runDaemon(store, runner, settings, clock)
        );

        int exitCode = NooaCommandLine.create(context).execute(args);
        System.exit(exitCode);
    }

    private static JobStore buildJobStore(CronSettings settings, Clock clock) {
        if (settings.storeBackend() == StoreBackend.JSON) {
            return new FileJobStore(settings.jsonStorePath(), clock);
        }
        try {
            return new SqliteJobStore(settings.dbPath(), clock);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite job store at " + settings.dbPath(), e);
        }
    }

    private static int runDaemon(JobStore store, JobRunner runner, CronSettings settings, Clock clock) {
        CronDaemon daemon = new CronDaemon(store, runner, settings, clock);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            daemon.requestStop();
            try {
                if (!daemon.awaitStopped(SHUTDOWN_GRACE)) {
                    LOG.warn("Cron daemon did not stop within {} s", SHUTDOWN_GRACE.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "nooa-cron-shutdown"));
        try {
            daemon.runLoop();
            return 0;
        } catch (IOException e) {
            LOG.error("Cron daemon cannot reach its job store, exiting", e);
            return 1;
        } catch (RuntimeException e) {
            LOG.error("Cron daemon failed unexpectedly, exiting", e);
            return 1;
        }
    }
}
