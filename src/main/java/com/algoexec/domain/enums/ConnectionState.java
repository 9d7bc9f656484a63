package com.algoexec.domain.enums;

/** Live broker connection lifecycle. Orders are accepted only in READY. */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    READY
}
