package com.algoexec.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Broker order status as reported by order-status and open-order callbacks.
 * FILLED, CANCELLED and INACTIVE take the order out of the active set.
 */
@Getter
@RequiredArgsConstructor
public enum ActiveOrderStatus {
    PENDING_SUBMIT("PendingSubmit"),
    PENDING_CANCEL("PendingCancel"),
    PRE_SUBMITTED("PreSubmitted"),
    SUBMITTED("Submitted"),
    CANCELLED("Cancelled"),
    FILLED("Filled"),
    INACTIVE("Inactive");

    private final String brokerName;

    public boolean isTerminal() {
        return this == CANCELLED || this == FILLED || this == INACTIVE;
    }

    public static ActiveOrderStatus fromBrokerName(String name) {
        for (ActiveOrderStatus status : values()) {
            if (status.brokerName.equalsIgnoreCase(name)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + name);
    }
}
