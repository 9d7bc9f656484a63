package com.algoexec.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/** Error categories surfaced by the engine. The REST view reports {@link #name()} as the code. */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    PRICE_NOT_FOUND(HttpStatus.CONFLICT),
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    BROKER_ERROR(HttpStatus.BAD_GATEWAY),
    BROKER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    PERSISTENCE_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return name();
    }
}
