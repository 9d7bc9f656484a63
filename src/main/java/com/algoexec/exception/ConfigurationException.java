package com.algoexec.exception;

/**
 * Invalid engine configuration: unknown market data type, malformed instrument,
 * unsupported security type. Raised at construction and never recovered.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
