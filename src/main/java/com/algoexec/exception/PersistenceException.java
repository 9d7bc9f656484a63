package com.algoexec.exception;

/** The persistence backend rejected a request or could not be reached after retries. */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_ERROR, message, cause);
    }
}
