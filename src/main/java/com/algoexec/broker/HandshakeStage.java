package com.algoexec.broker;

/** Replies the live client waits for, in order, before it accepts orders. */
public enum HandshakeStage {
    CONNECT_ACK,
    NEXT_VALID_ID,
    ACCOUNT_DOWNLOAD,
    OPEN_ORDERS
}
