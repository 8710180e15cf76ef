package io.nooa.core.sdk;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ErrorCode {
    NOT_FOUND(1),
    INVALID_INPUT(2),
    CONFLICT(3),
    RUNTIME_ERROR(4),
    EXECUTION_FAILURE(5);

    private final int exitCode;

    ErrorCode(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
