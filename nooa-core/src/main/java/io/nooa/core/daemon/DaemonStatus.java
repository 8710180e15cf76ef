package io.nooa.core.daemon;

public record DaemonStatus(boolean running, Long pid) {

    public static DaemonStatus running(long pid) {
        return new DaemonStatus(true, pid);
    }

    public static DaemonStatus stopped() {
        return new DaemonStatus(false, null);
    }
}
