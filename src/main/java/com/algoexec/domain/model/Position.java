package com.algoexec.domain.model;

import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.enums.SecurityType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the holding in one instrument.
 *
 * <p>Quantity is signed: positive = long, negative = short. Average cost is expressed in
 * money per unit (fill price x price multiplier x quantity multiplier), so
 * {@code averageCost x quantity} is the cost basis of the whole holding.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String ticker;
    SecurityType securityType;
    BrokerSide side;
    BigDecimal quantity;
    BigDecimal averageCost;
    BigDecimal priceMultiplier;
    BigDecimal quantityMultiplier;
    BigDecimal initialMargin;
    BigDecimal marketPrice;
    BigDecimal unrealizedPnl;
    BigDecimal realizedPnl;

    /** A zero-quantity position; publishing it removes the ticker from the portfolio. */
    public static Position flat(String ticker) {
        return Position.builder()
                .ticker(ticker)
                .side(BrokerSide.BUY)
                .quantity(BigDecimal.ZERO)
                .averageCost(BigDecimal.ZERO)
                .unrealizedPnl(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .build();
    }

    public boolean isFlat() {
        return quantity == null || quantity.signum() == 0;
    }

    public BigDecimal contractMultiplier() {
        BigDecimal pm = priceMultiplier == null ? BigDecimal.ONE : priceMultiplier;
        BigDecimal qm = quantityMultiplier == null ? BigDecimal.ONE : quantityMultiplier;
        return pm.multiply(qm);
    }

    /** Quoted market price converted to money per unit and multiplied by the signed quantity. */
    public BigDecimal marketValue() {
        if (marketPrice == null || isFlat()) {
            return BigDecimal.ZERO;
        }
        return marketPrice.multiply(contractMultiplier()).multiply(quantity);
    }
}
