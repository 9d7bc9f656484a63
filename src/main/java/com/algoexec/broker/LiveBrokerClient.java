package com.algoexec.broker;

import com.algoexec.config.EngineProperties;
import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.enums.ConnectionState;
import com.algoexec.domain.model.ActiveOrder;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.Order;
import com.algoexec.event.OrderEvent;
import com.algoexec.exception.BrokerException;
import com.algoexec.exception.ErrorCode;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.portfolio.PortfolioServer;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live implementation of {@link BrokerGateway}.
 *
 * <p>{@link #connect()} runs the handshake: connect and wait for the acknowledgement, wait
 * for the first valid order id, subscribe to account updates and wait for the download to
 * finish, then request open orders and wait for their end marker. Every wait is bounded by
 * {@code algoexec.broker.handshake-timeout}; on timeout the client disconnects and throws.
 * Orders are refused until the handshake completes, and again after the connection closes.
 * A placed order is in the portfolio's active orders as PENDING_SUBMIT before the transport
 * sends it.
 */
public class LiveBrokerClient implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(LiveBrokerClient.class);

    static final String ACCOUNT_SUMMARY_TAGS =
            "NetLiquidation,TotalCashValue,AvailableFunds,InitMarginReq,MaintMarginReq,BuyingPower,ExcessLiquidity";

    private final BrokerTransport transport;
    private final BrokerCallbackHandler callbackHandler;
    private final ContractValidator contractValidator;
    private final OrderIdAllocator orderIdAllocator;
    private final PortfolioServer portfolioServer;
    private final EngineMetricsService metricsService;
    private final EngineProperties.Broker config;

    public LiveBrokerClient(
            BrokerTransport transport,
            BrokerCallbackHandler callbackHandler,
            ContractValidator contractValidator,
            OrderIdAllocator orderIdAllocator,
            PortfolioServer portfolioServer,
            EngineMetricsService metricsService,
            EngineProperties.Broker config) {
        this.transport = transport;
        this.callbackHandler = callbackHandler;
        this.contractValidator = contractValidator;
        this.orderIdAllocator = orderIdAllocator;
        this.portfolioServer = portfolioServer;
        this.metricsService = metricsService;
        this.config = config;
    }

    @Override
    public void start() {
        connect();
    }

    /**
     * Connects and completes the handshake.
     *
     * @throws BrokerException if any stage does not complete within the handshake timeout
     */
    public void connect() {
        log.info("Connecting to broker at {}:{} as client {}", config.getHost(), config.getPort(), config.getClientId());
        callbackHandler.beginHandshake();
        transport.connect(config.getHost(), config.getPort(), config.getClientId(), callbackHandler);
        awaitStage(HandshakeStage.CONNECT_ACK);
        awaitStage(HandshakeStage.NEXT_VALID_ID);
        transport.reqAccountUpdates(true, config.getAccount());
        awaitStage(HandshakeStage.ACCOUNT_DOWNLOAD);
        transport.reqOpenOrders();
        awaitStage(HandshakeStage.OPEN_ORDERS);
        callbackHandler.markReady();
        log.info("Broker handshake complete");
    }

    @Override
    public void placeOrder(OrderEvent event) {
        if (callbackHandler.getConnectionState() != ConnectionState.READY) {
            throw new BrokerException(
                    ErrorCode.BROKER_UNAVAILABLE,
                    "Broker not ready (" + callbackHandler.getConnectionState() + "), order refused");
        }
        Order order = event.getOrder();
        Instrument instrument = order.getInstrument();
        if (!contractValidator.validate(instrument)) {
            log.warn("Order for {} dropped: contract not recognised by broker", instrument.getTicker());
            return;
        }
        int orderId = orderIdAllocator.next();
        ActiveOrder pending = ActiveOrder.builder()
                .orderId(orderId)
                .ticker(instrument.getTicker())
                .securityType(instrument.getSecurityType())
                .side(order.side())
                .orderType(order.getOrderType())
                .totalQuantity(order.getQuantity().abs())
                .limitPrice(order.getLimitPrice())
                .auxPrice(order.getAuxPrice())
                .status(ActiveOrderStatus.PENDING_SUBMIT)
                .build();
        // Registered before transmission so no later signal sees the ticker without an order.
        portfolioServer.updateOrders(List.of(pending));
        transport.placeOrder(orderId, instrument, order);
        metricsService.recordOrderSubmitted();
        log.info(
                "Order {} placed: {} {} {} (trade {}, leg {})",
                orderId,
                order.getAction(),
                order.getQuantity().abs(),
                instrument.getTicker(),
                event.getTradeId(),
                event.getLegId());
    }

    public void cancelOrder(int orderId) {
        if (callbackHandler.getConnectionState() != ConnectionState.READY) {
            throw new BrokerException(ErrorCode.BROKER_UNAVAILABLE, "Broker not ready, cancel refused");
        }
        transport.cancelOrder(orderId);
        log.info("Cancel requested for order {}", orderId);
    }

    /**
     * Requests the account summary and waits for it.
     *
     * @throws BrokerException if the summary does not arrive within the handshake timeout
     */
    public Map<String, String> requestAccountSummary() {
        int reqId = orderIdAllocator.next();
        CompletableFuture<Map<String, String>> summary = callbackHandler.expectAccountSummary(reqId);
        transport.reqAccountSummary(reqId, "All", ACCOUNT_SUMMARY_TAGS);
        try {
            return summary.get(config.getHandshakeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new BrokerException("Timed out waiting for account summary " + reqId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted waiting for account summary " + reqId, e);
        } catch (ExecutionException e) {
            throw new BrokerException("Account summary " + reqId + " failed", e.getCause());
        } finally {
            transport.cancelAccountSummary(reqId);
        }
    }

    /** Requests the final account summary, then unsubscribes and disconnects. */
    @Override
    public void stop(Instant timestamp) {
        try {
            if (callbackHandler.getConnectionState() == ConnectionState.READY) {
                requestAccountSummary();
                transport.reqAccountUpdates(false, config.getAccount());
            }
        } finally {
            disconnect();
        }
    }

    public void disconnect() {
        transport.disconnect();
        callbackHandler.markDisconnected();
        log.info("Disconnected from broker");
    }

    public ConnectionState getConnectionState() {
        return callbackHandler.getConnectionState();
    }

    private void awaitStage(HandshakeStage stage) {
        boolean completed;
        try {
            completed = callbackHandler.awaitStage(stage, config.getHandshakeTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disconnect();
            throw new BrokerException("Interrupted during broker handshake at " + stage, e);
        }
        if (!completed) {
            disconnect();
            throw new BrokerException(
                    ErrorCode.BROKER_UNAVAILABLE,
                    "Broker handshake timed out after " + config.getHandshakeTimeout() + " waiting for " + stage);
        }
        log.debug("Handshake stage {} complete", stage);
    }
}
