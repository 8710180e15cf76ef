package io.nooa.core.sdk;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronResult<T>(boolean ok, T data, CronError error) {

    public static <T> CronResult<T> success(T data) {
        return new CronResult<>(true, data, null);
    }

    public static <T> CronResult<T> failure(ErrorCode code, String message) {
        return new CronResult<>(false, null, new CronError(code, message));
    }
}
