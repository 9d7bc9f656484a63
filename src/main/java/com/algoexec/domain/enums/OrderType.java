package com.algoexec.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Order kinds the engine can route. The code is the broker's order type string. */
@Getter
@RequiredArgsConstructor
public enum OrderType {
    MARKET("MKT"),
    LIMIT("LMT"),
    STOP("STP");

    private final String brokerCode;

    public static OrderType fromBrokerCode(String code) {
        for (OrderType type : values()) {
            if (type.brokerCode.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type code: " + code);
    }
}
