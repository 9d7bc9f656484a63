package com.algoexec.event;

/** Kinds of events flowing through the engine queue. */
public enum EngineEventType {
    MARKET,
    SIGNAL,
    ORDER,
    EXECUTION,
    EOD
}
