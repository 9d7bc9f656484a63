package com.algoexec.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.algoexec.broker.BrokerGateway;
import com.algoexec.config.EngineProperties;
import com.algoexec.core.engine.EngineController;
import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.MarketDataType;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.Execution;
import com.algoexec.domain.model.Order;
import com.algoexec.domain.model.TradeInstruction;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.EodEvent;
import com.algoexec.event.ExecutionEvent;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.event.OrderEvent;
import com.algoexec.event.SignalEvent;
import com.algoexec.exception.BrokerException;
import com.algoexec.marketdata.HistoricalDataFeed;
import com.algoexec.marketdata.MarketDataBatch;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.oms.OrderManager;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.performance.RunSummary;
import com.algoexec.persistence.PersistenceClient;
import com.algoexec.strategy.Strategy;
import com.algoexec.unit.TestInstruments;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EngineControllerTest {

    private static final Instant T1 = Instant.parse("2024-03-01T15:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T16:00:00Z");

    @Mock
    private OrderManager orderManager;

    @Mock
    private BrokerGateway brokerGateway;

    @Mock
    private Strategy strategy;

    @Mock
    private PerformanceRecorder performanceRecorder;

    @Mock
    private PersistenceClient persistenceClient;

    @Mock
    private HistoricalDataFeed historicalDataFeed;

    private EngineProperties properties;
    private EngineEventQueue queue;
    private EngineController controller;
    private RunSummary summary;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getBacktest().setStrategyName("demo");
        properties.getBacktest().setTickers(List.of("AAPL"));
        queue = new EngineEventQueue();
        controller = new EngineController(
                properties,
                queue,
                new OrderBook(MarketDataType.BAR, queue),
                orderManager,
                brokerGateway,
                List.of(strategy),
                performanceRecorder,
                persistenceClient,
                historicalDataFeed);
        summary = RunSummary.builder().runId("run-1").build();
    }

    @Test
    void runBacktest_routesEveryEventKindAndSavesTheRun() {
        SignalEvent signal = new SignalEvent(
                T1,
                null,
                List.of(TradeInstruction.builder()
                        .ticker("AAPL")
                        .action(Action.LONG)
                        .tradeId(1)
                        .legId(1)
                        .quantity(BigDecimal.TEN)
                        .build()));
        OrderEvent order = new OrderEvent(T1, 1, 1, Order.market(TestInstruments.aapl(), Action.LONG, BigDecimal.TEN));
        ExecutionEvent execution = new ExecutionEvent(Execution.builder()
                .timestamp(T1)
                .tradeId(1)
                .legId(1)
                .ticker("AAPL")
                .quantity(BigDecimal.TEN)
                .fillPrice(new BigDecimal("100"))
                .action(Action.LONG)
                .fees(BigDecimal.ZERO)
                .build());
        when(strategy.onMarketData(any(MarketDataEvent.class))).thenReturn(List.of(signal), List.of());
        doAnswer(inv -> {
                    queue.put(order);
                    return List.of(order);
                })
                .when(orderManager)
                .onSignal(signal);
        doAnswer(inv -> {
                    queue.put(execution);
                    return null;
                })
                .when(brokerGateway)
                .placeOrder(order);
        when(performanceRecorder.buildSummary(
                        eq(TradingMode.BACKTEST),
                        eq("demo"),
                        eq(List.of("AAPL")),
                        eq(properties.getCapital()),
                        any(),
                        any()))
                .thenReturn(summary);

        RunSummary result = controller.runBacktest(List.of(
                new MarketDataBatch(T1, TestInstruments.bars(T1, "AAPL", "100"), false),
                new MarketDataBatch(T2, TestInstruments.bars(T2, "AAPL", "101"), true)));

        assertThat(result).isSameAs(summary);
        InOrder inOrder = inOrder(brokerGateway, performanceRecorder, orderManager, persistenceClient);
        inOrder.verify(brokerGateway).start();
        inOrder.verify(brokerGateway).onMarketData(any(MarketDataEvent.class));
        inOrder.verify(performanceRecorder).recordSignal(signal);
        inOrder.verify(orderManager).onSignal(signal);
        inOrder.verify(brokerGateway).placeOrder(order);
        inOrder.verify(brokerGateway).onExecution(execution);
        inOrder.verify(brokerGateway).onMarketData(any(MarketDataEvent.class));
        inOrder.verify(brokerGateway).onEndOfDay(new EodEvent(T2));
        inOrder.verify(brokerGateway).stop(T2);
        inOrder.verify(persistenceClient).saveBacktest(summary);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void runBacktest_withoutData_doesNotStopTheGateway() {
        when(performanceRecorder.buildSummary(any(), any(), any(), any(), any(), any())).thenReturn(summary);

        controller.runBacktest(List.of());

        verify(brokerGateway).start();
        verify(brokerGateway, never()).stop(any());
        verify(persistenceClient).saveBacktest(summary);
    }

    @Test
    void runBacktest_loadsTheConfiguredWindow() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-02-01T00:00:00Z");
        properties.getBacktest().setStart(start);
        properties.getBacktest().setEnd(end);
        when(historicalDataFeed.load(List.of("AAPL"), start, end)).thenReturn(List.of());
        when(performanceRecorder.buildSummary(any(), any(), any(), any(), any(), any())).thenReturn(summary);

        controller.runBacktest();

        verify(historicalDataFeed).load(List.of("AAPL"), start, end);
    }

    @Test
    void runLive_survivesBrokerErrorsAndSavesTheSessionOnStop() throws Exception {
        doThrow(new BrokerException("broker down")).when(brokerGateway).onMarketData(any(MarketDataEvent.class));
        when(performanceRecorder.buildSummary(eq(TradingMode.LIVE), any(), any(), isNull(), any(), any()))
                .thenReturn(summary);
        controller.updateMarketData(TestInstruments.bars(T1, "AAPL", "100"), T1);
        controller.updateMarketData(TestInstruments.bars(T2, "AAPL", "101"), T2);

        CompletableFuture<RunSummary> session = CompletableFuture.supplyAsync(controller::runLive);
        long deadline = System.currentTimeMillis() + 5_000;
        while (!queue.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        controller.stop();

        assertThat(session.get(5, TimeUnit.SECONDS)).isSameAs(summary);
        verify(brokerGateway, times(2)).onMarketData(any(MarketDataEvent.class));
        verify(brokerGateway).stop(any());
        verify(persistenceClient).saveLiveSession(summary);
        assertThat(controller.isRunning()).isFalse();
    }
}
