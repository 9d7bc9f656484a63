package com.algoexec.domain.model;

import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.enums.BrokerSide;
import com.algoexec.domain.enums.OrderType;
import com.algoexec.domain.enums.SecurityType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A working order as reported by the broker.
 *
 * <p>Open-order reports carry the contract and order terms, order-status reports carry
 * status and fill progress. Reports are combined with {@link #merge(ActiveOrder)}; any
 * field left null in a report keeps its previous value.
 */
@Value
@Builder(toBuilder = true)
public class ActiveOrder {

    int orderId;
    Long permId;
    Integer clientId;
    Integer parentId;
    String account;
    String ticker;
    SecurityType securityType;
    String venue;
    BrokerSide side;
    OrderType orderType;
    BigDecimal totalQuantity;
    BigDecimal limitPrice;
    BigDecimal auxPrice;
    ActiveOrderStatus status;
    BigDecimal filledQuantity;
    BigDecimal remainingQuantity;
    BigDecimal averageFillPrice;
    BigDecimal lastFillPrice;
    String whyHeld;

    public ActiveOrder merge(ActiveOrder update) {
        if (update.orderId != orderId) {
            throw new IllegalArgumentException("Cannot merge order " + update.orderId + " into " + orderId);
        }
        return toBuilder()
                .permId(pick(update.permId, permId))
                .clientId(pick(update.clientId, clientId))
                .parentId(pick(update.parentId, parentId))
                .account(pick(update.account, account))
                .ticker(pick(update.ticker, ticker))
                .securityType(pick(update.securityType, securityType))
                .venue(pick(update.venue, venue))
                .side(pick(update.side, side))
                .orderType(pick(update.orderType, orderType))
                .totalQuantity(pick(update.totalQuantity, totalQuantity))
                .limitPrice(pick(update.limitPrice, limitPrice))
                .auxPrice(pick(update.auxPrice, auxPrice))
                .status(pick(update.status, status))
                .filledQuantity(pick(update.filledQuantity, filledQuantity))
                .remainingQuantity(pick(update.remainingQuantity, remainingQuantity))
                .averageFillPrice(pick(update.averageFillPrice, averageFillPrice))
                .lastFillPrice(pick(update.lastFillPrice, lastFillPrice))
                .whyHeld(pick(update.whyHeld, whyHeld))
                .build();
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
