package io.nooa.core.sdk;

public record CronError(ErrorCode code, String message) {
}
