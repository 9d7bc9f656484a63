package com.algoexec.core.engine;

import com.algoexec.broker.BrokerGateway;
import com.algoexec.config.EngineProperties;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.MarketData;
import com.algoexec.event.EngineEvent;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.EodEvent;
import com.algoexec.event.ExecutionEvent;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.event.OrderEvent;
import com.algoexec.event.SignalEvent;
import com.algoexec.exception.BaseException;
import com.algoexec.marketdata.HistoricalDataFeed;
import com.algoexec.marketdata.MarketDataBatch;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.oms.OrderManager;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.performance.RunSummary;
import com.algoexec.persistence.PersistenceClient;
import com.algoexec.strategy.Strategy;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the engine loop: takes events off the {@link EngineEventQueue} and routes them.
 *
 * <ul>
 *   <li>MARKET: broker gateway valuation, then every strategy</li>
 *   <li>SIGNAL: performance recorder, then order manager</li>
 *   <li>ORDER: broker gateway</li>
 *   <li>EXECUTION: broker gateway (portfolio and recorder updates)</li>
 *   <li>EOD: broker gateway (settlement and margin check)</li>
 * </ul>
 *
 * <p>Backtests replay the historical feed one batch at a time and drain the queue fully
 * before the next batch. Live sessions block on the queue until {@link #stop()}.
 */
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private static final Duration LIVE_POLL_INTERVAL = Duration.ofMillis(500);

    private final EngineProperties properties;
    private final EngineEventQueue eventQueue;
    private final OrderBook orderBook;
    private final OrderManager orderManager;
    private final BrokerGateway brokerGateway;
    private final List<Strategy> strategies;
    private final PerformanceRecorder performanceRecorder;
    private final PersistenceClient persistenceClient;
    private final HistoricalDataFeed historicalDataFeed;

    private volatile boolean running;

    public EngineController(
            EngineProperties properties,
            EngineEventQueue eventQueue,
            OrderBook orderBook,
            OrderManager orderManager,
            BrokerGateway brokerGateway,
            List<Strategy> strategies,
            PerformanceRecorder performanceRecorder,
            PersistenceClient persistenceClient,
            HistoricalDataFeed historicalDataFeed) {
        this.properties = properties;
        this.eventQueue = eventQueue;
        this.orderBook = orderBook;
        this.orderManager = orderManager;
        this.brokerGateway = brokerGateway;
        this.strategies = List.copyOf(strategies);
        this.performanceRecorder = performanceRecorder;
        this.persistenceClient = persistenceClient;
        this.historicalDataFeed = historicalDataFeed;
    }

    /** Market-data entry point: applies the batch to the order book, which enqueues a MARKET event. */
    public void updateMarketData(Map<String, MarketData> data, Instant timestamp) {
        orderBook.update(data, timestamp);
    }

    /** Loads the configured window from the persistence backend and replays it. */
    public RunSummary runBacktest() {
        EngineProperties.Backtest backtest = properties.getBacktest();
        return runBacktest(historicalDataFeed.load(backtest.getTickers(), backtest.getStart(), backtest.getEnd()));
    }

    public RunSummary runBacktest(List<MarketDataBatch> batches) {
        Instant startedAt = Instant.now();
        EngineProperties.Backtest backtest = properties.getBacktest();
        log.info(
                "Backtest '{}' starting: {} batches, {} strategies",
                backtest.getStrategyName(),
                batches.size(),
                strategies.size());
        running = true;
        brokerGateway.start();

        Instant lastTimestamp = null;
        for (MarketDataBatch batch : batches) {
            if (!running) {
                log.info("Backtest stopped before {}", batch.getTimestamp());
                break;
            }
            updateMarketData(batch.getData(), batch.getTimestamp());
            drainQueue();
            if (batch.isEndOfDay()) {
                eventQueue.put(new EodEvent(batch.getTimestamp()));
                drainQueue();
            }
            lastTimestamp = batch.getTimestamp();
        }

        if (lastTimestamp != null) {
            brokerGateway.stop(lastTimestamp);
            drainQueue();
        }
        running = false;

        RunSummary summary = performanceRecorder.buildSummary(
                TradingMode.BACKTEST,
                backtest.getStrategyName(),
                backtest.getTickers(),
                properties.getCapital(),
                startedAt,
                Instant.now());
        persistenceClient.saveBacktest(summary);
        return summary;
    }

    /** Runs until {@link #stop()}; then requests the final account summary and saves the session. */
    public RunSummary runLive() {
        Instant startedAt = Instant.now();
        running = true;
        brokerGateway.start();
        log.info("Live session started with {} strategies", strategies.size());

        while (running) {
            try {
                Optional<EngineEvent> event = eventQueue.poll(LIVE_POLL_INTERVAL);
                if (event.isPresent()) {
                    dispatchLive(event.get());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Live loop interrupted, shutting down");
                running = false;
            }
        }

        brokerGateway.stop(Instant.now());
        RunSummary summary = performanceRecorder.buildSummary(
                TradingMode.LIVE,
                properties.getBacktest().getStrategyName(),
                List.of(),
                null,
                startedAt,
                Instant.now());
        persistenceClient.saveLiveSession(summary);
        return summary;
    }

    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /** Processes queued events until the queue is empty, including events they enqueue. */
    void drainQueue() {
        Optional<EngineEvent> event = eventQueue.poll();
        while (event.isPresent()) {
            dispatch(event.get());
            event = eventQueue.poll();
        }
    }

    void dispatch(EngineEvent event) {
        switch (event.getType()) {
            case MARKET -> onMarketData((MarketDataEvent) event);
            case SIGNAL -> onSignal((SignalEvent) event);
            case ORDER -> brokerGateway.placeOrder((OrderEvent) event);
            case EXECUTION -> brokerGateway.onExecution((ExecutionEvent) event);
            case EOD -> brokerGateway.onEndOfDay((EodEvent) event);
            default -> throw new IllegalStateException("Unhandled engine event type: " + event.getType());
        }
    }

    private void dispatchLive(EngineEvent event) {
        try {
            dispatch(event);
        } catch (BaseException e) {
            log.error("Failed to process {} event at {}: {}", event.getType(), event.getTimestamp(), e.getMessage(), e);
        }
    }

    private void onMarketData(MarketDataEvent event) {
        brokerGateway.onMarketData(event);
        for (Strategy strategy : strategies) {
            List<SignalEvent> signals = strategy.onMarketData(event);
            if (signals != null) {
                signals.forEach(eventQueue::put);
            }
        }
    }

    private void onSignal(SignalEvent event) {
        performanceRecorder.recordSignal(event);
        orderManager.onSignal(event);
    }
}
