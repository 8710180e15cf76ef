package io.nooa.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionLogEntry(
    String id,
    String jobId,
    String jobName,
    ExecutionStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String output,
    String error,
    Instant createdAt
) {
}
