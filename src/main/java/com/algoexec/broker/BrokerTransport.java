package com.algoexec.broker;

import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.Order;

/**
 * Outbound requests to the broker's API client. Replies arrive asynchronously on the
 * {@link BrokerCallbacks} passed to {@link #connect}, on the transport's own reader thread.
 *
 * <p>The adapter to a concrete broker library is provided by the deployment as a Spring
 * bean; the engine never sees wire formats.
 */
public interface BrokerTransport {

    void connect(String host, int port, int clientId, BrokerCallbacks callbacks);

    void disconnect();

    boolean isConnected();

    void placeOrder(int orderId, Instrument instrument, Order order);

    void cancelOrder(int orderId);

    void reqAccountUpdates(boolean subscribe, String account);

    void reqOpenOrders();

    void reqAccountSummary(int reqId, String group, String tags);

    void cancelAccountSummary(int reqId);

    void reqContractDetails(int reqId, Instrument instrument);
}
