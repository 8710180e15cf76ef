package io.nooa.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

public record CronSettings(
    Path workspace,
    StoreBackend storeBackend,
    Path dbPath,
    Path jsonStorePath,
    Path pidPath,
    Duration pollInterval,
    boolean heartbeatEnabled,
    String heartbeatSchedule
) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    public static final String DEFAULT_HEARTBEAT_SCHEDULE = "30m";
    private static final long MIN_POLL_MS = 100;

    public static CronSettings fromEnv(Map<String, String> env) {
        return fromEnv(env, ConfigPaths.resolveWorkspace(env.get("NOOA_WORKSPACE")));
    }

    public static CronSettings fromEnv(Map<String, String> env, Path workspace) {
        return new CronSettings(
            workspace,
            StoreBackend.fromValue(env.get("NOOA_CRON_STORE")),
            ConfigPaths.resolve(workspace, env.get("NOOA_DB_PATH"), "nooa.db"),
            ConfigPaths.resolve(workspace, env.get("NOOA_CRON_JSON_PATH"), ".nooa/cron-jobs.json"),
            ConfigPaths.resolve(workspace, env.get("NOOA_CRON_DAEMON_PID_PATH"), ".nooa/cron-daemon.pid"),
            pollInterval(env.get("NOOA_CRON_DAEMON_POLL_MS")),
            !"0".equals(trim(env.get("NOOA_HEARTBEAT_ENABLED"))),
            value(env.get("NOOA_HEARTBEAT_SCHEDULE"), DEFAULT_HEARTBEAT_SCHEDULE)
        );
    }

    public static CronSettings defaults(Path workspace) {
        return fromEnv(Map.of(), workspace);
    }

    public CronSettings withHeartbeat(boolean enabled, String schedule) {
        return new CronSettings(workspace, storeBackend, dbPath, jsonStorePath, pidPath, pollInterval, enabled, schedule);
    }

    public CronSettings withPollInterval(Duration interval) {
        return new CronSettings(workspace, storeBackend, dbPath, jsonStorePath, pidPath, interval, heartbeatEnabled, heartbeatSchedule);
    }

    private static Duration pollInterval(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_POLL_INTERVAL;
        }
        try {
            long millis = Long.parseLong(raw.trim());
            return millis < MIN_POLL_MS ? DEFAULT_POLL_INTERVAL : Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            return DEFAULT_POLL_INTERVAL;
        }
    }

    private static String value(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    private static String trim(String raw) {
        return raw == null ? "" : raw.trim();
    }
}
