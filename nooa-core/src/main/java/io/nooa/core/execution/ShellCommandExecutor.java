package io.nooa.core.execution;

import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.ScheduleCalculator;
import io.nooa.core.heartbeat.HeartbeatService;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ShellCommandExecutor implements CommandExecutor {
    private static final int MAX_OUTPUT_CHARS = 12_000;

    private final Path workspace;
    private final HeartbeatService heartbeat;

    public ShellCommandExecutor(Path workspace, HeartbeatService heartbeat) {
        this.workspace = workspace;
        this.heartbeat = heartbeat;
    }

    @Override
    public ExecutionResult execute(JobRecord job) {
        if (HeartbeatService.isHeartbeat(job.command())) {
            return heartbeat.run();
        }
        String command = job.command() == null ? "" : job.command().trim();
        if (command.isBlank()) {
            return ExecutionResult.failure("", "command is required");
        }

        try {
            Process process = new ProcessBuilder("/bin/sh", "-lc", command)
                .directory(workspace.toFile())
                .start();
            process.getOutputStream().close();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            Optional<Duration> timeout = ScheduleCalculator.interval(job.timeout());
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.descendants().forEach(ProcessHandle::destroyForcibly);
                    process.destroyForcibly();
                    process.waitFor();
                    return ExecutionResult.failure(
                        truncate(partial(stdout)),
                        "Command timed out after " + job.timeout().trim()
                    );
                }
            } else {
                process.waitFor();
            }

            int code = process.exitValue();
            String out = truncate(stdout.get().trim());
            if (code == 0) {
                return ExecutionResult.success(out);
            }
            String err = truncate(stderr.get().trim());
            return ExecutionResult.failure(out, err.isEmpty() ? "Command exited with code " + code : err);
        } catch (IOException e) {
            return ExecutionResult.failure("", "Failed to run command: " + e.getMessage());
        } catch (ExecutionException e) {
            return ExecutionResult.failure("", "Failed to read command output: " + e.getCause().getMessage());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("", "Command interrupted");
        }
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private String partial(CompletableFuture<String> stream) {
        try {
            return stream.get(1, TimeUnit.SECONDS).trim();
        } catch (ExecutionException | TimeoutException e) {
            return "";
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return "";
        }
    }

    private String truncate(String value) {
        if (value.length() <= MAX_OUTPUT_CHARS) {
            return value;
        }
        return value.substring(0, MAX_OUTPUT_CHARS) + "\n[truncated]";
    }
}
