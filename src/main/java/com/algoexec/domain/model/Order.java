package com.algoexec.domain.model;

import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Value;

/**
 * An order ready to be routed to a broker.
 *
 * <p>The quantity is signed from the action: LONG and COVER are positive, SHORT and SELL
 * negative, whatever sign the caller passed. LIMIT orders carry a limit price and STOP
 * orders an aux (trigger) price.
 */
@Value
public class Order {

    Instrument instrument;
    Action action;
    BigDecimal quantity;
    OrderType orderType;
    BigDecimal limitPrice;
    BigDecimal auxPrice;

    private Order(
            Instrument instrument,
            Action action,
            BigDecimal quantity,
            OrderType orderType,
            BigDecimal limitPrice,
            BigDecimal auxPrice) {
        if (instrument == null || action == null || orderType == null) {
            throw new IllegalArgumentException("Order requires instrument, action and order type");
        }
        if (quantity == null || quantity.signum() == 0) {
            throw new IllegalArgumentException("Order quantity must be non-zero for " + instrument.getTicker());
        }
        if (orderType == OrderType.LIMIT && (limitPrice == null || limitPrice.signum() <= 0)) {
            throw new IllegalArgumentException("LIMIT order requires a positive limit price");
        }
        if (orderType == OrderType.STOP && (auxPrice == null || auxPrice.signum() <= 0)) {
            throw new IllegalArgumentException("STOP order requires a positive aux price");
        }
        this.instrument = instrument;
        this.action = action;
        this.quantity = action.sign() > 0 ? quantity.abs() : quantity.abs().negate();
        this.orderType = orderType;
        this.limitPrice = orderType == OrderType.LIMIT ? limitPrice : null;
        this.auxPrice = orderType == OrderType.STOP ? auxPrice : null;
    }

    public static Order market(Instrument instrument, Action action, BigDecimal quantity) {
        return new Order(instrument, action, quantity, OrderType.MARKET, null, null);
    }

    public static Order limit(Instrument instrument, Action action, BigDecimal quantity, BigDecimal limitPrice) {
        return new Order(instrument, action, quantity, OrderType.LIMIT, limitPrice, null);
    }

    public static Order stop(Instrument instrument, Action action, BigDecimal quantity, BigDecimal auxPrice) {
        return new Order(instrument, action, quantity, OrderType.STOP, null, auxPrice);
    }

    public static Order of(
            Instrument instrument,
            Action action,
            BigDecimal quantity,
            OrderType orderType,
            BigDecimal limitPrice,
            BigDecimal auxPrice) {
        return new Order(instrument, action, quantity, orderType, limitPrice, auxPrice);
    }

    public BigDecimal quantity() {
        return quantity;
    }

    public BrokerSide side() {
        return action.toBrokerSide();
    }

    /** Commission charged for the whole order: |quantity| x fee per unit. */
    public BigDecimal commission() {
        return quantity.abs().multiply(instrument.getFees());
    }

    /**
     * Signed money value of the order. MARKET orders are valued at {@code marketPrice};
     * LIMIT and STOP orders at their own limit/aux price.
     */
    public BigDecimal orderValue(BigDecimal marketPrice) {
        BigDecimal price = switch (orderType) {
            case MARKET -> marketPrice;
            case LIMIT -> limitPrice;
            case STOP -> auxPrice;
        };
        return price.multiply(instrument.contractMultiplier()).multiply(quantity);
    }
}
