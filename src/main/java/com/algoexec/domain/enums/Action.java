package com.algoexec.domain.enums;

/**
 * Trade direction emitted by a strategy.
 *
 * <p>LONG and SHORT open new exposure; SELL and COVER close existing exposure of the
 * opposite sign. The broker only knows BUY and SELL: LONG/COVER buy, SHORT/SELL sell.
 */
public enum Action {
    LONG,
    SHORT,
    SELL,
    COVER;

    public BrokerSide toBrokerSide() {
        return this == LONG || this == COVER ? BrokerSide.BUY : BrokerSide.SELL;
    }

    public boolean isEntry() {
        return this == LONG || this == SHORT;
    }

    public boolean isExit() {
        return !isEntry();
    }

    /** +1 for buy-side actions, -1 for sell-side actions. */
    public int sign() {
        return toBrokerSide() == BrokerSide.BUY ? 1 : -1;
    }
}
