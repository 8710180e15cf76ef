package io.nooa.core.cron;

public final class JobSpecs {

    private JobSpecs() {
    }

    public static JobSpec of(String name, String schedule, String command) {
        return new JobSpec(name, schedule, command, null, null, null, null, null, null, null, null);
    }

    public static JobSpec disabled(String name, String schedule, String command) {
        return new JobSpec(name, schedule, command, null, false, null, null, null, null, null, null);
    }
}
