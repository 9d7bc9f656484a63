package com.algoexec.event;

import com.algoexec.domain.model.ActiveOrder;
import java.util.Map;

/** Published after the active order set changes. Keyed by broker order id. */
public class OrderUpdateEvent extends PortfolioEvent {

    private final Map<Integer, ActiveOrder> activeOrders;

    public OrderUpdateEvent(Object source, Map<Integer, ActiveOrder> activeOrders) {
        super(source, PortfolioEventType.ORDER_UPDATE);
        this.activeOrders = Map.copyOf(activeOrders);
    }

    public Map<Integer, ActiveOrder> getActiveOrders() {
        return activeOrders;
    }
}
