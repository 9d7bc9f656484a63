package com.algoexec.broker;

import java.math.BigDecimal;

/** Callbacks the broker transport delivers, one method per message kind. */
public interface BrokerCallbacks {

    void connectAck();

    void connectionClosed();

    void nextValidId(int orderId);

    void contractDetails(int reqId, String symbol);

    void contractDetailsEnd(int reqId);

    void updateAccountValue(String key, String value, String currency, String account);

    void updatePortfolio(PortfolioReport report);

    void accountDownloadEnd(String account);

    void openOrder(OpenOrderReport report);

    void openOrderEnd();

    void orderStatus(OrderStatusReport report);

    void accountSummary(int reqId, String account, String tag, String value, String currency);

    void accountSummaryEnd(int reqId);

    void execDetails(int reqId, ExecutionReport report);

    void commissionReport(String execId, BigDecimal commission, String currency);

    /**
     * @param id the request or order id the error refers to, -1 for connection-level messages
     */
    void error(int id, int code, String message);
}
