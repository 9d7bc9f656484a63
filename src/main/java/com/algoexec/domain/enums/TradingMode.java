package com.algoexec.domain.enums;

/**
 * Execution mode of the engine.
 * BACKTEST replays stored bars through the simulated broker; LIVE relays orders to the broker.
 */
public enum TradingMode {
    BACKTEST,
    LIVE
}
