package io.nooa.core.cron;

public record JobSpec(
    String name,
    String schedule,
    String command,
    String description,
    Boolean enabled,
    FailurePolicy onFailure,
    Integer retries,
    String timeout,
    String startAt,
    String endAt,
    Integer maxRuns
) {

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    public FailurePolicy onFailureOrDefault() {
        return onFailure == null ? FailurePolicy.NOTIFY : onFailure;
    }

    public int retriesOrDefault() {
        return retries == null ? 0 : retries;
    }

    public int maxRunsOrDefault() {
        return maxRuns == null ? 0 : maxRuns;
    }
}
