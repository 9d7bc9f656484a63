package com.algoexec.config;

import com.algoexec.event.EngineEventQueue;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.portfolio.PortfolioServer;
import com.algoexec.simulator.BacktestBrokerGateway;
import com.algoexec.simulator.SimulatedBroker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Simulator-backed gateway, active when {@code algoexec.mode=BACKTEST} (the default). */
@Configuration
@ConditionalOnProperty(name = "algoexec.mode", havingValue = "BACKTEST", matchIfMissing = true)
public class BacktestConfig {

    @Bean
    public SimulatedBroker simulatedBroker(
            OrderBook orderBook, EngineEventQueue engineEventQueue, EngineProperties engineProperties) {
        return new SimulatedBroker(
                orderBook,
                engineEventQueue,
                engineProperties.getCapital(),
                engineProperties.getDefaultSlippageFactor());
    }

    @Bean
    public BacktestBrokerGateway backtestBrokerGateway(
            SimulatedBroker simulatedBroker,
            PortfolioServer portfolioServer,
            PerformanceRecorder performanceRecorder,
            EngineMetricsService engineMetricsService) {
        return new BacktestBrokerGateway(simulatedBroker, portfolioServer, performanceRecorder, engineMetricsService);
    }
}
