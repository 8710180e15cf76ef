package io.nooa.core.cron;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for job definitions and their execution logs. All lookups are by job name.
 */
public interface JobStore {

    /**
     * @throws JobConflictException when a job with the same name already exists
     */
    JobRecord create(JobSpec spec) throws IOException;

    Optional<JobRecord> get(String name) throws IOException;

    /**
     * Jobs ordered by creation time, newest first.
     */
    List<JobRecord> list() throws IOException;

    /**
     * Deletes the job and its logs. Returns {@code false} when no such job exists.
     */
    boolean remove(String name) throws IOException;

    boolean setEnabled(String name, boolean enabled) throws IOException;

    boolean update(String name, JobUpdate update) throws IOException;

    ExecutionLogEntry appendLog(String jobId, ExecutionLogEntry entry) throws IOException;

    /**
     * Newest first. {@code since} is inclusive and may be {@code null}.
     */
    List<ExecutionLogEntry> listLogs(String jobName, int limit, Instant since) throws IOException;
}
