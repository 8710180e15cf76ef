package io.nooa.core.cron;

public final class JobConflictException extends IllegalStateException {

    public JobConflictException(String name) {
        super("Job '" + name + "' already exists");
    }
}
