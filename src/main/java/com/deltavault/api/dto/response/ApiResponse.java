package com.deltavault.api.dto.response;

import java.time.Instant;

/**
 * Success envelope for every vault API body: {@code {"success": true, "data": ..., "timestamp": ...}}.
 */
public record ApiResponse<T>(boolean success, T data, Instant timestamp) {

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
