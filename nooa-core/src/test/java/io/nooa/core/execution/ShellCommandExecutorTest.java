package io.nooa.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.nooa.core.cron.ExecutionStatus;
import io.nooa.core.cron.JobRecord;
import io.nooa.core.cron.JobSpec;
import io.nooa.core.heartbeat.HeartbeatService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShellCommandExecutorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnTrimmedStdoutOnSuccess() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job("echo '  hello  '", null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(result.output()).isEqualTo("hello");
        assertThat(result.error()).isNull();
    }

    @Test
    void shouldCaptureStderrOnFailure() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job("echo partial; echo boom 1>&2; exit 9", null));

        assertThat(result.status()).isEqualTo(ExecutionStatus.FAILURE);
        assertThat(result.output()).isEqualTo("partial");
        assertThat(result.error()).contains("boom");
    }

    @Test
    void shouldSynthesizeErrorWhenStderrIsEmpty() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job("exit 3", null));

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).isEqualTo("Command exited with code 3");
    }

    @Test
    void shouldRunInsideWorkspace() throws Exception {
        Files.writeString(tempDir.resolve("marker.txt"), "found");
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job("cat marker.txt", null));

        assertThat(result.output()).isEqualTo("found");
    }

    @Test
    void shouldKillCommandsThatExceedTheirTimeout() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        long started = System.nanoTime();
        ExecutionResult result = executor.execute(job("sleep 30", "1s"));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertThat(result.succeeded()).isFalse();
        assertThat(result.error()).isEqualTo("Command timed out after 1s");
        assertThat(elapsedMs).isLessThan(15_000);
    }

    @Test
    void shouldTruncateLargeOutput() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job("head -c 20000 /dev/zero | tr '\\0' 'x'", null));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).endsWith("[truncated]");
        assertThat(result.output().length()).isLessThan(12_100);
    }

    @Test
    void shouldAnswerHeartbeatWithoutShell() {
        ShellCommandExecutor executor = new ShellCommandExecutor(tempDir, new HeartbeatService(tempDir));

        ExecutionResult result = executor.execute(job(HeartbeatService.COMMAND, null));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.output()).isEqualTo(HeartbeatService.OK);
    }

    private static JobRecord job(String command, String timeout) {
        JobSpec spec = new JobSpec("test", "1m", command, null, true, null, null, timeout, null, null, null);
        return JobRecord.create("job-1", spec, Instant.parse("2026-03-01T10:00:00Z"));
    }
}
