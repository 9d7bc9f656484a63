package com.algoexec.broker;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A broker fill. Commission arrives later in a separate report keyed by the same
 * {@code execId}.
 */
@Value
@Builder
public class ExecutionReport {

    String execId;
    int orderId;
    Instant time;
    String account;
    String symbol;
    String side;
    BigDecimal shares;
    BigDecimal price;
    BigDecimal cumulativeQuantity;
    BigDecimal averagePrice;
}
