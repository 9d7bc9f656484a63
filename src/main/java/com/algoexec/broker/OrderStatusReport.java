package com.algoexec.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Status and fill progress of an order, as delivered by the broker's order-status callback. */
@Value
@Builder
public class OrderStatusReport {

    int orderId;
    String status;
    BigDecimal filled;
    BigDecimal remaining;
    BigDecimal averageFillPrice;
    Long permId;
    Integer parentId;
    BigDecimal lastFillPrice;
    Integer clientId;
    String whyHeld;
}
