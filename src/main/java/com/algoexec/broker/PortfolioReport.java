package com.algoexec.broker;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** One holding from the broker's portfolio stream. A zero position means the holding was closed. */
@Value
@Builder
public class PortfolioReport {

    String account;
    String symbol;
    String securityType;
    BigDecimal position;
    BigDecimal marketPrice;
    BigDecimal marketValue;
    BigDecimal averageCost;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;
}
