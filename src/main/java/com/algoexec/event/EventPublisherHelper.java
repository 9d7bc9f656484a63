package com.algoexec.event;

import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Position;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for portfolio
 * change notifications. Delivery is synchronous unless a listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishPositionUpdate(Object source, Map<String, Position> positions) {
        applicationEventPublisher.publishEvent(new PositionUpdateEvent(source, positions));
    }

    public void publishOrderUpdate(Object source, Map<Integer, ActiveOrder> activeOrders) {
        applicationEventPublisher.publishEvent(new OrderUpdateEvent(source, activeOrders));
    }

    public void publishAccountDetailUpdate(Object source, AccountSnapshot account) {
        applicationEventPublisher.publishEvent(new AccountDetailUpdateEvent(source, account));
    }
}
