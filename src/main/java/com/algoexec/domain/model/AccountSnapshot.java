package com.algoexec.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Account-level figures at a point in time.
 *
 * <p>In backtests the first five fields are computed by the simulator and satisfy
 * {@code netLiquidation = availableFunds + sum of position liquidation values}. In live mode
 * they are copied from the broker's account stream together with the optional fields.
 */
@Value
@Builder(toBuilder = true)
public class AccountSnapshot {

    Instant timestamp;
    BigDecimal availableFunds;
    BigDecimal requiredInitialMargin;
    BigDecimal netLiquidation;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;

    BigDecimal maintenanceMargin;
    BigDecimal excessLiquidity;
    BigDecimal buyingPower;
    BigDecimal futuresPnl;
    BigDecimal totalCashBalance;
    String currency;

    /** Funds not tied up as initial margin. */
    public BigDecimal freeCapital() {
        BigDecimal funds = availableFunds == null ? BigDecimal.ZERO : availableFunds;
        BigDecimal margin = requiredInitialMargin == null ? BigDecimal.ZERO : requiredInitialMargin;
        return funds.subtract(margin);
    }
}
