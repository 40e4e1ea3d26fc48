package com.example.shifthybrid.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope for every HTTP response: a {@code success} flag, an optional message,
 * the payload and free-form meta data.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
