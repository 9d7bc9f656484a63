package com.algoexec.broker;

/** Ends the process on unrecoverable broker errors. Replaced by a recording stub in tests. */
public interface ProcessTerminator {

    void terminate(int exitCode, String reason);
}
