package com.algoexec.domain.model;

import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One leg of a strategy signal.
 *
 * <p>When {@code quantity} is null the order manager sizes the leg from the signal's trade
 * capital and {@code weight}.
 */
@Value
public class TradeInstruction {

    String ticker;
    OrderType orderType;
    Action action;
    long tradeId;
    long legId;
    BigDecimal weight;
    BigDecimal quantity;
    BigDecimal limitPrice;
    BigDecimal auxPrice;

    @Builder
    private TradeInstruction(
            String ticker,
            OrderType orderType,
            Action action,
            long tradeId,
            long legId,
            BigDecimal weight,
            BigDecimal quantity,
            BigDecimal limitPrice,
            BigDecimal auxPrice) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Trade instruction ticker must not be blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("Trade instruction action is required for " + ticker);
        }
        if (tradeId <= 0 || legId <= 0) {
            throw new IllegalArgumentException("Trade and leg ids must be positive for " + ticker);
        }
        if (quantity != null && quantity.signum() == 0) {
            throw new IllegalArgumentException("Trade instruction quantity must be non-zero for " + ticker);
        }
        this.ticker = ticker;
        this.orderType = orderType == null ? OrderType.MARKET : orderType;
        this.action = action;
        this.tradeId = tradeId;
        this.legId = legId;
        this.weight = weight == null ? BigDecimal.ONE : weight;
        this.quantity = quantity;
        this.limitPrice = limitPrice;
        this.auxPrice = auxPrice;
    }
}
