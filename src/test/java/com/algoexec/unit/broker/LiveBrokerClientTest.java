package com.algoexec.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.algoexec.broker.BrokerCallbackHandler;
import com.algoexec.broker.BrokerCallbacks;
import com.algoexec.broker.BrokerTransport;
import com.algoexec.broker.ContractValidator;
import com.algoexec.broker.LiveBrokerClient;
import com.algoexec.broker.OrderIdAllocator;
import com.algoexec.broker.PortfolioMailbox;
import com.algoexec.broker.ProcessTerminator;
import com.algoexec.config.EngineProperties;
import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.ActiveOrderStatus;
import com.algoexec.domain.enums.ConnectionState;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.Order;
import com.algoexec.event.EventPublisherHelper;
import com.algoexec.event.OrderEvent;
import com.algoexec.exception.BrokerException;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.portfolio.PortfolioServer;
import com.algoexec.unit.TestInstruments;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class LiveBrokerClientTest {

    private static final Instant T1 = Instant.parse("2024-03-01T15:00:00Z");

    @Mock
    private BrokerTransport transport;

    @Mock
    private ContractValidator contractValidator;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private EngineMetricsService metricsService;

    @Mock
    private ProcessTerminator processTerminator;

    @Mock
    private TaskScheduler taskScheduler;

    private PortfolioServer portfolioServer;
    private PerformanceRecorder performanceRecorder;
    private BrokerCallbackHandler handler;
    private LiveBrokerClient client;
    private EngineProperties.Broker config;
    private Instrument aapl;

    @BeforeEach
    void setUp() {
        aapl = TestInstruments.aapl();
        portfolioServer = new PortfolioServer(eventPublisherHelper);
        performanceRecorder = new PerformanceRecorder();
        config = new EngineProperties.Broker();
        config.setAccount("DU1");
        config.setHandshakeTimeout(Duration.ofMillis(100));
        wire(new PortfolioMailbox(Runnable::run));
    }

    private void wire(PortfolioMailbox mailbox) {
        OrderIdAllocator allocator = new OrderIdAllocator();
        handler = new BrokerCallbackHandler(
                mailbox,
                portfolioServer,
                contractValidator,
                allocator,
                performanceRecorder,
                metricsService,
                new InstrumentRegistry(List.of(aapl)),
                processTerminator,
                taskScheduler,
                Duration.ofSeconds(2));
        client = new LiveBrokerClient(
                transport, handler, contractValidator, allocator, portfolioServer, metricsService, config);
    }

    @Test
    void connect_walksTheHandshakeAndBecomesReady() {
        brokerAnswersHandshake();

        client.connect();

        assertThat(client.getConnectionState()).isEqualTo(ConnectionState.READY);
        verify(transport).reqAccountUpdates(true, "DU1");
        verify(transport).reqOpenOrders();
    }

    @Test
    void connect_timesOutAndDisconnects() {
        assertThatThrownBy(client::connect)
                .isInstanceOf(BrokerException.class)
                .hasMessageContaining("CONNECT_ACK");

        verify(transport).disconnect();
        verify(transport, never()).reqAccountUpdates(eq(true), anyString());
        assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void placeOrder_beforeHandshake_isRefused() {
        OrderEvent event = new OrderEvent(T1, 1, 1, Order.market(aapl, Action.LONG, BigDecimal.TEN));

        assertThatThrownBy(() -> client.placeOrder(event)).isInstanceOf(BrokerException.class);
        verify(transport, never()).placeOrder(anyInt(), any(), any());
    }

    @Test
    void placeOrder_registersPendingOrderAndSubmits() {
        brokerAnswersHandshake();
        client.connect();
        when(contractValidator.validate(aapl)).thenReturn(true);
        Order order = Order.market(aapl, Action.LONG, BigDecimal.TEN);

        client.placeOrder(new OrderEvent(T1, 1, 1, order));

        verify(transport).placeOrder(100, aapl, order);
        verify(metricsService).recordOrderSubmitted();
        assertThat(portfolioServer.getActiveOrderTickers()).containsExactly("AAPL");
        assertThat(portfolioServer.getActiveOrders().get(100).getStatus()).isEqualTo(ActiveOrderStatus.PENDING_SUBMIT);
    }

    @Test
    void placeOrder_registersPendingOrderBeforeTransmitting_evenWhenCallbacksQueueUp() {
        List<Runnable> queued = new ArrayList<>();
        wire(new PortfolioMailbox(queued::add));
        brokerAnswersHandshake();
        client.connect();
        when(contractValidator.validate(aapl)).thenReturn(true);
        Order order = Order.market(aapl, Action.LONG, BigDecimal.TEN);
        List<String> tickersAtTransmit = new ArrayList<>();
        doAnswer(inv -> {
                    tickersAtTransmit.addAll(portfolioServer.getActiveOrderTickers());
                    return null;
                })
                .when(transport)
                .placeOrder(100, aapl, order);
        int queuedBefore = queued.size();

        client.placeOrder(new OrderEvent(T1, 1, 1, order));

        assertThat(tickersAtTransmit).containsExactly("AAPL");
        assertThat(portfolioServer.getActiveOrderTickers()).containsExactly("AAPL");
        assertThat(queued).hasSize(queuedBefore);
    }

    @Test
    void placeOrder_forUnknownContract_isDropped() {
        brokerAnswersHandshake();
        client.connect();
        when(contractValidator.validate(aapl)).thenReturn(false);

        client.placeOrder(new OrderEvent(T1, 1, 1, Order.market(aapl, Action.LONG, BigDecimal.TEN)));

        verify(transport, never()).placeOrder(anyInt(), any(), any());
        assertThat(portfolioServer.getActiveOrders()).isEmpty();
    }

    @Test
    void placeOrder_afterConnectionClosed_isRefused() {
        brokerAnswersHandshake();
        client.connect();
        handler.connectionClosed();

        assertThatThrownBy(() ->
                        client.placeOrder(new OrderEvent(T1, 1, 1, Order.market(aapl, Action.LONG, BigDecimal.TEN))))
                .isInstanceOf(BrokerException.class);
    }

    @Test
    void stop_collectsAccountSummaryThenDisconnects() {
        brokerAnswersHandshake();
        client.connect();
        doAnswer(inv -> {
                    int reqId = inv.getArgument(0);
                    handler.accountSummary(reqId, "DU1", "NetLiquidation", "100500", "USD");
                    handler.accountSummaryEnd(reqId);
                    return null;
                })
                .when(transport)
                .reqAccountSummary(anyInt(), eq("All"), anyString());

        client.stop(T1);

        verify(transport).cancelAccountSummary(100);
        verify(transport).reqAccountUpdates(false, "DU1");
        verify(transport).disconnect();
        assertThat(client.getConnectionState()).isEqualTo(ConnectionState.DISCONNECTED);
        Map<String, String> summary = performanceRecorder
                .buildSummary(null, "live", List.of(), BigDecimal.ONE, T1, T1)
                .getAccountSummary();
        assertThat(summary).containsEntry("NetLiquidation", "100500");
    }

    @Test
    void stop_whenNotConnected_onlyDisconnects() {
        client.stop(T1);

        verify(transport, never()).reqAccountSummary(anyInt(), anyString(), anyString());
        verify(transport).disconnect();
    }

    private void brokerAnswersHandshake() {
        doAnswer(inv -> {
                    BrokerCallbacks callbacks = inv.getArgument(3);
                    callbacks.connectAck();
                    callbacks.nextValidId(100);
                    return null;
                })
                .when(transport)
                .connect(anyString(), anyInt(), anyInt(), any());
        doAnswer(inv -> {
                    handler.accountDownloadEnd("DU1");
                    return null;
                })
                .when(transport)
                .reqAccountUpdates(true, "DU1");
        doAnswer(inv -> {
                    handler.openOrderEnd();
                    return null;
                })
                .when(transport)
                .reqOpenOrders();
    }
}
