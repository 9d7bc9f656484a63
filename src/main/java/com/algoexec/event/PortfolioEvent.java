package com.algoexec.event;

import org.springframework.context.ApplicationEvent;

/**
 * Base of the Spring events published by the portfolio server after each change.
 *
 * <p>Listeners (the REST view, metrics, UI bridges) receive immutable snapshots and never
 * see the server's internal maps.
 */
public abstract class PortfolioEvent extends ApplicationEvent {

    private final PortfolioEventType eventType;

    protected PortfolioEvent(Object source, PortfolioEventType eventType) {
        super(source);
        this.eventType = eventType;
    }

    public PortfolioEventType getEventType() {
        return eventType;
    }
}
