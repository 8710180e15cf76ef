package io.nooa.core.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FailurePolicy {
    NOTIFY,
    RETRY,
    IGNORE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FailurePolicy fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return NOTIFY;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (FailurePolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("onFailure must be one of notify, retry, ignore: " + raw);
    }
}
