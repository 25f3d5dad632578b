package com.tradingrisk.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope that {@link com.tradingrisk.config.ApiResponseAdvice} wraps around every JSON
 * body under {@code /api}: a decision, journal entries, stats or coach insights.
 * Failures use {@link ApiErrorResponse} instead.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(T data) {
        this.success = true;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data);
    }
}
