package com.algoexec.event;

import com.algoexec.domain.model.Order;
import java.time.Instant;
import lombok.Value;

/** An order accepted by the order manager and waiting to be routed to the broker gateway. */
@Value
public class OrderEvent implements EngineEvent {

    Instant timestamp;
    long tradeId;
    long legId;
    Order order;

    @Override
    public EngineEventType getType() {
        return EngineEventType.ORDER;
    }
}
