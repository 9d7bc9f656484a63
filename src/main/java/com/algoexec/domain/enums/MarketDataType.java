package com.algoexec.domain.enums;

/** The single kind of market data an order book serves. */
public enum MarketDataType {
    BAR,
    QUOTE
}
