package com.algoexec.exception;

/**
 * Broker connectivity or protocol failure. {@link ErrorCode#BROKER_UNAVAILABLE} means the
 * session is not usable right now; {@link ErrorCode#BROKER_ERROR} covers everything else.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        this(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
