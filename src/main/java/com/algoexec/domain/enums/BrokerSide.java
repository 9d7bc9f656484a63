package com.algoexec.domain.enums;

import java.math.BigDecimal;

/** Buy or sell side as understood by the broker. */
public enum BrokerSide {
    BUY,
    SELL;

    public BrokerSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Side implied by a signed quantity: positive = BUY, negative = SELL. */
    public static BrokerSide of(BigDecimal signedQuantity) {
        return signedQuantity.signum() >= 0 ? BUY : SELL;
    }

    /** Parses the broker's action string (BUY/BOT, SELL/SLD). */
    public static BrokerSide fromBrokerAction(String action) {
        if ("BUY".equalsIgnoreCase(action) || "BOT".equalsIgnoreCase(action)) {
            return BUY;
        }
        if ("SELL".equalsIgnoreCase(action) || "SLD".equalsIgnoreCase(action)) {
            return SELL;
        }
        throw new IllegalArgumentException("Unknown broker action: " + action);
    }
}
