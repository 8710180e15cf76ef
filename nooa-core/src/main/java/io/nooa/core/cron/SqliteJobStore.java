package io.nooa.core.cron;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public final class SqliteJobStore implements JobStore {
    private static final String JOB_COLUMNS = """
        id, name, schedule, command, description, enabled, on_failure, retries, timeout,
        start_at, end_at, max_runs, last_run_at, last_status, next_run_at, created_at, updated_at
        """;
    private static final String LOG_COLUMNS = """
        id, job_id, job_name, status, started_at, finished_at, duration_ms, output, error, created_at
        """;

    // Fixed width so that text ordering matches chronological ordering.
    private static final DateTimeFormatter STAMP = DateTimeFormatter
        .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'")
        .withZone(ZoneOffset.UTC);

    private final String jdbcUrl;
    private final Clock clock;

    public SqliteJobStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Path absolute = dbPath.toAbsolutePath();
        if (absolute.getParent() != null) {
            Files.createDirectories(absolute.getParent());
        }
        this.jdbcUrl = "jdbc:sqlite:" + absolute;
        this.clock = clock;
        init();
    }

    @Override
    public synchronized JobRecord create(JobSpec spec) throws IOException {
        String sql = "INSERT INTO cron_jobs (" + JOB_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        JobRecord record = JobRecord.create(UUID.randomUUID().toString(), spec, clock.instant());
        try (Connection connection = openConnection()) {
            if (findByName(connection, spec.name()).isPresent()) {
                throw new JobConflictException(spec.name());
            }
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                bindJob(statement, record);
                statement.executeUpdate();
            }
            return record;
        } catch (SQLException e) {
            throw new IOException("Failed to create job " + spec.name(), e);
        }
    }

    @Override
    public synchronized Optional<JobRecord> get(String name) throws IOException {
        try (Connection connection = openConnection()) {
            return findByName(connection, name);
        } catch (SQLException e) {
            throw new IOException("Failed to load job " + name, e);
        }
    }

    @Override
    public synchronized List<JobRecord> list() throws IOException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM cron_jobs ORDER BY created_at DESC, rowid DESC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<JobRecord> jobs = new ArrayList<>();
            while (resultSet.next()) {
                jobs.add(readJob(resultSet));
            }
            return jobs;
        } catch (SQLException e) {
            throw new IOException("Failed to list jobs", e);
        }
    }

    @Override
    public synchronized boolean remove(String name) throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement logs = connection.prepareStatement("DELETE FROM cron_job_logs WHERE job_name = ?");
                 PreparedStatement job = connection.prepareStatement("DELETE FROM cron_jobs WHERE name = ?")) {
                logs.setString(1, name);
                logs.executeUpdate();
                job.setString(1, name);
                int deleted = job.executeUpdate();
                connection.commit();
                return deleted > 0;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to remove job " + name, e);
        }
    }

    @Override
    public boolean setEnabled(String name, boolean enabled) throws IOException {
        return update(name, JobUpdate.enabled(enabled));
    }

    @Override
    public synchronized boolean update(String name, JobUpdate update) throws IOException {
        String sql = """
            UPDATE cron_jobs SET
                schedule = ?, command = ?, description = ?, enabled = ?, on_failure = ?, retries = ?,
                timeout = ?, start_at = ?, end_at = ?, max_runs = ?, last_run_at = ?, last_status = ?,
                next_run_at = ?, updated_at = ?
            WHERE id = ?
            """;
        try (Connection connection = openConnection()) {
            Optional<JobRecord> existing = findByName(connection, name);
            if (existing.isEmpty()) {
                return false;
            }
            JobRecord merged = existing.get().merge(update, clock.instant());
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, merged.schedule());
                statement.setString(2, merged.command());
                setNullable(statement, 3, merged.description());
                statement.setInt(4, merged.enabled() ? 1 : 0);
                statement.setString(5, merged.onFailure().value());
                statement.setInt(6, merged.retries());
                setNullable(statement, 7, merged.timeout());
                setNullable(statement, 8, merged.startAt());
                setNullable(statement, 9, merged.endAt());
                statement.setInt(10, merged.maxRuns());
                setNullable(statement, 11, stamp(merged.lastRunAt()));
                setNullable(statement, 12, merged.lastStatus() == null ? null : merged.lastStatus().value());
                setNullable(statement, 13, merged.nextRunAt());
                statement.setString(14, stamp(merged.updatedAt()));
                statement.setString(15, merged.id());
                return statement.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + name, e);
        }
    }

    @Override
    public synchronized ExecutionLogEntry appendLog(String jobId, ExecutionLogEntry entry) throws IOException {
        String sql = "INSERT INTO cron_job_logs (" + LOG_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = openConnection()) {
            String jobName = jobNameById(connection, jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job id: " + jobId));
            ExecutionLogEntry stored = new ExecutionLogEntry(
                entry.id() == null ? UUID.randomUUID().toString() : entry.id(),
                jobId,
                jobName,
                entry.status(),
                entry.startedAt(),
                entry.finishedAt(),
                entry.durationMs(),
                entry.output(),
                entry.error(),
                entry.createdAt() == null ? clock.instant() : entry.createdAt()
            );
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, stored.id());
                statement.setString(2, stored.jobId());
                statement.setString(3, stored.jobName());
                statement.setString(4, stored.status().value());
                statement.setString(5, stamp(stored.startedAt()));
                statement.setString(6, stamp(stored.finishedAt()));
                statement.setLong(7, stored.durationMs());
                setNullable(statement, 8, stored.output());
                setNullable(statement, 9, stored.error());
                statement.setString(10, stamp(stored.createdAt()));
                statement.executeUpdate();
            }
            return stored;
        } catch (SQLException e) {
            throw new IOException("Failed to append log for job " + jobId, e);
        }
    }

    @Override
    public synchronized List<ExecutionLogEntry> listLogs(String jobName, int limit, Instant since) throws IOException {
        String sql = "SELECT " + LOG_COLUMNS + " FROM cron_job_logs WHERE job_name = ?"
            + (since == null ? "" : " AND started_at >= ?")
            + " ORDER BY started_at DESC, rowid DESC LIMIT ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            statement.setString(index++, jobName);
            if (since != null) {
                statement.setString(index++, stamp(since));
            }
            statement.setInt(index, Math.max(1, limit));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExecutionLogEntry> logs = new ArrayList<>();
                while (resultSet.next()) {
                    logs.add(readLog(resultSet));
                }
                return logs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list logs for job " + jobName, e);
        }
    }

    private Optional<JobRecord> findByName(Connection connection, String name) throws SQLException {
        String sql = "SELECT " + JOB_COLUMNS + " FROM cron_jobs WHERE name = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, name);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(readJob(resultSet)) : Optional.empty();
            }
        }
    }

    private Optional<String> jobNameById(Connection connection, String jobId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT name FROM cron_jobs WHERE id = ?")) {
            statement.setString(1, jobId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString("name")) : Optional.empty();
            }
        }
    }

    private void bindJob(PreparedStatement statement, JobRecord record) throws SQLException {
        statement.setString(1, record.id());
        statement.setString(2, record.name());
        statement.setString(3, record.schedule());
        statement.setString(4, record.command());
        setNullable(statement, 5, record.description());
        statement.setInt(6, record.enabled() ? 1 : 0);
        statement.setString(7, record.onFailure().value());
        statement.setInt(8, record.retries());
        setNullable(statement, 9, record.timeout());
        setNullable(statement, 10, record.startAt());
        setNullable(statement, 11, record.endAt());
        statement.setInt(12, record.maxRuns());
        setNullable(statement, 13, stamp(record.lastRunAt()));
        setNullable(statement, 14, record.lastStatus() == null ? null : record.lastStatus().value());
        setNullable(statement, 15, record.nextRunAt());
        statement.setString(16, stamp(record.createdAt()));
        statement.setString(17, stamp(record.updatedAt()));
    }

    private JobRecord readJob(ResultSet resultSet) throws SQLException {
        try {
            return mapJob(resultSet);
        } catch (IllegalArgumentException e) {
            throw new SQLException("Invalid job row " + resultSet.getString("name") + ": " + e.getMessage(), e);
        }
    }

    private JobRecord mapJob(ResultSet resultSet) throws SQLException {
        return new JobRecord(
            resultSet.getString("id"),
            resultSet.getString("name"),
            resultSet.getString("schedule"),
            resultSet.getString("command"),
            resultSet.getString("description"),
            resultSet.getInt("enabled") != 0,
            FailurePolicy.fromValue(resultSet.getString("on_failure")),
            resultSet.getInt("retries"),
            resultSet.getString("timeout"),
            resultSet.getString("start_at"),
            resultSet.getString("end_at"),
            resultSet.getInt("max_runs"),
            instant(resultSet.getString("last_run_at")),
            ExecutionStatus.fromValue(resultSet.getString("last_status")),
            resultSet.getString("next_run_at"),
            instant(resultSet.getString("created_at")),
            instant(resultSet.getString("updated_at"))
        );
    }

    private ExecutionLogEntry readLog(ResultSet resultSet) throws SQLException {
        try {
            return mapLog(resultSet);
        } catch (IllegalArgumentException e) {
            throw new SQLException("Invalid log row " + resultSet.getString("id") + ": " + e.getMessage(), e);
        }
    }

    private ExecutionLogEntry mapLog(ResultSet resultSet) throws SQLException {
        return new ExecutionLogEntry(
            resultSet.getString("id"),
            resultSet.getString("job_id"),
            resultSet.getString("job_name"),
            ExecutionStatus.fromValue(resultSet.getString("status")),
            instant(resultSet.getString("started_at")),
            instant(resultSet.getString("finished_at")),
            resultSet.getLong("duration_ms"),
            resultSet.getString("output"),
            resultSet.getString("error"),
            instant(resultSet.getString("created_at"))
        );
    }

    private String stamp(Instant instant) {
        return instant == null ? null : STAMP.format(instant);
    }

    private Instant instant(String raw) {
        return ScheduleCalculator.parseInstant(raw).orElse(null);
    }

    private void setNullable(PreparedStatement statement, int index, String value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
        } else {
            statement.setString(index, value);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
        }
        return connection;
    }

    private void init() throws IOException {
        String jobs = """
            CREATE TABLE IF NOT EXISTS cron_jobs (
                id TEXT PRIMARY KEY,
                name TEXT NOT NULL UNIQUE,
                schedule TEXT NOT NULL,
                command TEXT NOT NULL,
                description TEXT,
                enabled INTEGER DEFAULT 1,
                on_failure TEXT DEFAULT 'notify',
                retries INTEGER DEFAULT 0,
                timeout TEXT,
                start_at TEXT,
                end_at TEXT,
                max_runs INTEGER DEFAULT 0,
                last_run_at TEXT,
                last_status TEXT,
                next_run_at TEXT,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """;
        String logs = """
            CREATE TABLE IF NOT EXISTS cron_job_logs (
                id TEXT PRIMARY KEY,
                job_id TEXT NOT NULL REFERENCES cron_jobs(id) ON DELETE CASCADE,
                job_name TEXT NOT NULL,
                status TEXT NOT NULL,
                started_at TEXT NOT NULL,
                finished_at TEXT NOT NULL,
                duration_ms INTEGER,
                output TEXT,
                error TEXT,
                created_at TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(jobs);
            addMissingColumns(connection);
            statement.execute(logs);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_cron_jobs_created_at ON cron_jobs(created_at DESC)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_cron_job_logs_job_started ON cron_job_logs(job_name, started_at DESC)");
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }

    // Databases created by older releases lack the optional columns.
    private void addMissingColumns(Connection connection) throws SQLException {
        Map<String, String> optional = new LinkedHashMap<>();
        optional.put("description", "TEXT");
        optional.put("on_failure", "TEXT DEFAULT 'notify'");
        optional.put("retries", "INTEGER DEFAULT 0");
        optional.put("timeout", "TEXT");
        optional.put("start_at", "TEXT");
        optional.put("end_at", "TEXT");
        optional.put("max_runs", "INTEGER DEFAULT 0");
        optional.put("last_run_at", "TEXT");
        optional.put("last_status", "TEXT");

        Set<String> present = new HashSet<>();
        try (Statement statement = connection.createStatement();
             ResultSet columns = statement.executeQuery("PRAGMA table_info(cron_jobs)")) {
            while (columns.next()) {
                present.add(columns.getString("name"));
            }
        }
        try (Statement statement = connection.createStatement()) {
            for (Map.Entry<String, String> column : optional.entrySet()) {
                if (!present.contains(column.getKey())) {
                    statement.execute("ALTER TABLE cron_jobs ADD COLUMN " + column.getKey() + " " + column.getValue());
                }
            }
        }
    }
}
