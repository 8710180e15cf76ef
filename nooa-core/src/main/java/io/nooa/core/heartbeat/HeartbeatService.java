package io.nooa.core.heartbeat;

import io.nooa.core.execution.ExecutionResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class HeartbeatService {
    public static final String JOB_NAME = "__system_heartbeat__";
    public static final String COMMAND = "heartbeat:run";
    public static final String DESCRIPTION = "Native heartbeat runner";
    public static final String OK = "HEARTBEAT_OK";

    private final Path instructionsFile;

    public HeartbeatService(Path workspace) {
        this.instructionsFile = workspace.resolve(".nooa").resolve("HEARTBEAT.md");
    }

    public static boolean isHeartbeat(String command) {
        return COMMAND.equals(command);
    }

    public Path instructionsFile() {
        return instructionsFile;
    }

    /**
     * Never fails: a missing, empty or unreadable file yields {@link #OK}.
     */
    public ExecutionResult run() {
        return ExecutionResult.success(read());
    }

    private String read() {
        if (!Files.isRegularFile(instructionsFile)) {
            return OK;
        }
        try {
            String trimmed = Files.readString(instructionsFile, StandardCharsets.UTF_8).trim();
            return trimmed.isEmpty() ? OK : trimmed;
        } catch (IOException e) {
            return OK;
        }
    }
}
