package com.algoexec.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Security kinds carried by the instrument registry. Codes match the broker's secType. */
@Getter
@RequiredArgsConstructor
public enum SecurityType {
    EQUITY("STK"),
    FUTURE("FUT"),
    OPTION("OPT"),
    INDEX("IND");

    private final String brokerCode;

    /** Leveraged instruments reserve initial margin instead of paying notional. */
    public boolean isLeveraged() {
        return this == FUTURE;
    }

    public static SecurityType fromBrokerCode(String code) {
        for (SecurityType type : values()) {
            if (type.brokerCode.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown security type code: " + code);
    }
}
