package com.riskrails.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope for controller bodies: {@code {success, data, path, timestamp}}. Applied by
 * {@code ApiResponseAdvice}; the timestamp comes from the application clock.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String path;
    private final Instant timestamp;

    private ApiResponse(T data, String path, Instant timestamp) {
        this.data = data;
        this.path = path;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, String path, Instant timestamp) {
        return new ApiResponse<>(data, path, timestamp);
    }
}
