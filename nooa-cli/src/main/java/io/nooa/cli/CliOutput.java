package io.nooa.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.nooa.core.cron.ExecutionLogEntry;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.sdk.CronResult;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

final class CliOutput {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private CliOutput() {
    }

    static <T> int emit(CronResult<T> result, boolean json, Function<T, String> text) {
        if (json) {
            System.out.println(toJson(result));
        } else if (result.ok()) {
            System.out.println(text.apply(result.data()));
        } else {
            System.err.println(result.error().message());
        }
        return result.ok() ? 0 : result.error().code().exitCode();
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize CLI output", e);
        }
    }

    static String formatJobs(List<JobRecord> jobs) {
        if (jobs.isEmpty()) {
            return "No cron jobs defined.";
        }
        List<String> lines = new ArrayList<>();
        for (JobRecord job : jobs) {
            String state = job.enabled() ? "enabled" : "disabled";
            String last = job.lastStatus() == null ? "no runs yet" : "last:" + job.lastStatus().value();
            String next = job.hasNextRun() ? " next:" + job.nextRunAt() : "";
            lines.add("[" + state + "] " + job.name() + " (" + job.schedule() + ") - " + last + next);
        }
        return String.join("\n", lines);
    }

    static String formatJob(JobRecord job) {
        List<String> lines = new ArrayList<>();
        lines.add("Name: " + job.name());
        lines.add("Id: " + job.id());
        lines.add("Schedule: " + job.schedule());
        lines.add("Command: " + job.command());
        if (job.description() != null && !job.description().isBlank()) {
            lines.add("Description: " + job.description());
        }
        lines.add("Enabled: " + job.enabled());
        lines.add("On failure: " + job.onFailure().value() + " (retries " + job.retries() + ")");
        String lastStatus = job.lastStatus() == null ? "" : " " + job.lastStatus().value();
        lines.add("Last run: " + (job.lastRunAt() == null ? "-" : job.lastRunAt() + lastStatus));
        lines.add("Next run: " + (job.hasNextRun() ? job.nextRunAt() : "-"));
        return String.join("\n", lines);
    }

    static String formatLogs(String name, List<ExecutionLogEntry> logs) {
        if (logs.isEmpty()) {
            return "No logs for job '" + name + "'.";
        }
        List<String> lines = new ArrayList<>();
        for (ExecutionLogEntry log : logs) {
            StringBuilder line = new StringBuilder()
                .append(log.startedAt())
                .append(" ")
                .append(log.status().value())
                .append(" (")
                .append(log.durationMs())
                .append(" ms)");
            if (log.output() != null && !log.output().isBlank()) {
                line.append(" ").append(firstLine(log.output()));
            }
            if (log.error() != null && !log.error().isBlank()) {
                line.append(" error: ").append(firstLine(log.error()));
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    private static String firstLine(String value) {
        String trimmed = value.trim();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline) + " ...";
    }
}
