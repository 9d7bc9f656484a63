package com.algoexec.api.dto.response;

import com.algoexec.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Error envelope: {@code success} is always false and {@code error} says what went wrong where. */
@Value
public class ApiErrorResponse {

    boolean success;
    Failure error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Failure failure = Failure.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(false, failure);
    }

    @Value
    @Builder
    public static class Failure {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
