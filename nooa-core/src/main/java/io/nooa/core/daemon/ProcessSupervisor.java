package io.nooa.core.daemon;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProcessSupervisor {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessSupervisor.class);

    private final Path pidPath;
    private final Path workspace;

    public ProcessSupervisor(Path pidPath, Path workspace) {
        this.pidPath = pidPath;
        this.workspace = workspace;
    }

    public Path pidPath() {
        return pidPath;
    }

    public synchronized DaemonStatus status() throws IOException {
        OptionalLong pid = readPid();
        if (pid.isEmpty()) {
            return DaemonStatus.stopped();
        }
        if (!isAlive(pid.getAsLong())) {
            Files.deleteIfExists(pidPath);
            return DaemonStatus.stopped();
        }
        return DaemonStatus.running(pid.getAsLong());
    }

    /**
     * Spawns {@code entrypoint} in its own session (through {@code setsid} when available) with
     * discarded stdio and records its PID. Does nothing when a daemon is already running.
     */
    public synchronized DaemonStatus start(List<String> entrypoint) throws IOException {
        DaemonStatus current = status();
        if (current.running()) {
            return current;
        }
        if (entrypoint == null || entrypoint.isEmpty()) {
            throw new IllegalArgumentException("entrypoint must not be empty");
        }
        Path parent = pidPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Process process = new ProcessBuilder(detached(entrypoint))
            .directory(workspace.toFile())
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .redirectError(ProcessBuilder.Redirect.DISCARD)
            .start();
        process.getOutputStream().close();

        long pid = process.pid();
        Files.writeString(pidPath, Long.toString(pid), StandardCharsets.UTF_8);
        LOG.info("Started cron daemon with pid {}", pid);
        return DaemonStatus.running(pid);
    }

    /**
     * Sends a termination request to the running daemon and removes the PID file.
     */
    public synchronized DaemonStatus stop() throws IOException {
        DaemonStatus current = status();
        if (current.running()) {
            // The process may exit between the status check and the signal.
            boolean signalled = ProcessHandle.of(current.pid())
                .map(ProcessHandle::destroy)
                .orElse(false);
            LOG.info("Stopping cron daemon with pid {} (signalled={})", current.pid(), signalled);
        }
        Files.deleteIfExists(pidPath);
        return DaemonStatus.stopped();
    }

    // setsid execs in place because a forked child is never a process group leader, so the
    // recorded PID stays the daemon's own.
    static List<String> detached(List<String> entrypoint) {
        Optional<Path> setsid = findOnPath("setsid");
        if (setsid.isEmpty()) {
            LOG.debug("setsid not found on PATH, daemon shares the caller's session");
            return entrypoint;
        }
        List<String> command = new ArrayList<>();
        command.add(setsid.get().toString());
        command.addAll(entrypoint);
        return command;
    }

    private static Optional<Path> findOnPath(String executable) {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir).resolve(executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private OptionalLong readPid() throws IOException {
        if (!Files.isRegularFile(pidPath)) {
            return OptionalLong.empty();
        }
        long pid = parsePid(Files.readString(pidPath, StandardCharsets.UTF_8));
        if (pid > 0) {
            return OptionalLong.of(pid);
        }
        Files.deleteIfExists(pidPath);
        return OptionalLong.empty();
    }

    private long parsePid(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
