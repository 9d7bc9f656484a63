package com.algoexec.event;

/** What part of the portfolio a {@link PortfolioEvent} reports on. */
public enum PortfolioEventType {
    POSITION_UPDATE,
    ORDER_UPDATE,
    ACCOUNT_DETAIL_UPDATE
}
