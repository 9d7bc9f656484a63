package com.algoexec.simulator;

import com.algoexec.broker.BrokerGateway;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.Execution;
import com.algoexec.domain.model.Order;
import com.algoexec.event.EodEvent;
import com.algoexec.event.ExecutionEvent;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.event.OrderEvent;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.portfolio.PortfolioServer;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backtest implementation of {@link BrokerGateway}: orders go to the {@link SimulatedBroker}
 * and each resulting execution is pushed to the portfolio server and the performance
 * recorder, the way broker callbacks feed them in live mode.
 */
public class BacktestBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(BacktestBrokerGateway.class);

    private final SimulatedBroker simulatedBroker;
    private final PortfolioServer portfolioServer;
    private final PerformanceRecorder performanceRecorder;
    private final EngineMetricsService metricsService;

    public BacktestBrokerGateway(
            SimulatedBroker simulatedBroker,
            PortfolioServer portfolioServer,
            PerformanceRecorder performanceRecorder,
            EngineMetricsService metricsService) {
        this.simulatedBroker = simulatedBroker;
        this.portfolioServer = portfolioServer;
        this.performanceRecorder = performanceRecorder;
        this.metricsService = metricsService;
    }

    @Override
    public void start() {
        AccountSnapshot account = simulatedBroker.getAccount();
        log.info("Backtest gateway started with capital {}", simulatedBroker.getInitialCapital());
        portfolioServer.updateAccountDetails(account);
    }

    @Override
    public void placeOrder(OrderEvent event) {
        Order order = event.getOrder();
        log.debug(
                "Simulator placeOrder: {} {} {} qty={}",
                order.getAction(),
                order.getOrderType(),
                order.getInstrument().getTicker(),
                order.getQuantity());
        simulatedBroker.placeOrder(
                event.getTimestamp(),
                event.getTradeId(),
                event.getLegId(),
                order.getAction(),
                order.getInstrument(),
                order);
        metricsService.recordOrderSubmitted();
    }

    @Override
    public void onMarketData(MarketDataEvent event) {
        AccountSnapshot account = simulatedBroker.updateValuation(event.getTimestamp());
        performanceRecorder.recordEquity(event.getTimestamp(), account.getNetLiquidation());
    }

    @Override
    public void onExecution(ExecutionEvent event) {
        Execution execution = event.getExecution();
        if (!performanceRecorder.recordTrade(execution)) {
            return;
        }
        metricsService.recordExecution();
        portfolioServer.updatePositions(List.of(simulatedBroker.getPosition(execution.getTicker())));
        publishAccount(execution.getTimestamp(), simulatedBroker.getAccount());
    }

    @Override
    public void onEndOfDay(EodEvent event) {
        AccountSnapshot account = simulatedBroker.markToMarket(event.getTimestamp());
        if (simulatedBroker.checkMarginCall()) {
            metricsService.recordMarginCall();
        }
        portfolioServer.updatePositions(simulatedBroker.getPositions().values());
        publishAccount(event.getTimestamp(), account);
    }

    /**
     * Closes all positions. The liquidation executions are enqueued by the simulator and
     * reach {@link #onExecution} when the engine drains its queue.
     */
    @Override
    public void stop(Instant timestamp) {
        List<Execution> executions = simulatedBroker.liquidatePositions(timestamp);
        log.info("Backtest gateway stopped, {} positions liquidated", executions.size());
    }

    public SimulatedBroker getSimulatedBroker() {
        return simulatedBroker;
    }

    private void publishAccount(Instant timestamp, AccountSnapshot account) {
        portfolioServer.updateAccountDetails(account);
        performanceRecorder.recordAccount(account);
        performanceRecorder.recordEquity(timestamp, account.getNetLiquidation());
    }
}
