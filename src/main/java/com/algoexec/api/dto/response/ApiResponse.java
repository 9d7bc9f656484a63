package com.algoexec.api.dto.response;

import java.time.Instant;
import lombok.Value;

/** Envelope for successful portfolio API responses. */
@Value
public class ApiResponse<T> {

    boolean success;
    T data;
    Instant timestamp;

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, Instant.now());
    }
}
