package com.algoexec.config;

import com.algoexec.broker.BrokerGateway;
import com.algoexec.core.engine.EngineController;
import com.algoexec.core.engine.EngineRunner;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.marketdata.HistoricalDataFeed;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.oms.OrderManager;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.persistence.PersistenceClient;
import com.algoexec.strategy.Strategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Mode-independent engine beans. The {@link BrokerGateway} comes from
 * {@link BacktestConfig} or {@link LiveBrokerConfig} depending on {@code algoexec.mode}.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public InstrumentRegistry instrumentRegistry(EngineProperties engineProperties) {
        return InstrumentRegistry.fromProperties(engineProperties);
    }

    @Bean
    public OrderBook orderBook(EngineProperties engineProperties, EngineEventQueue engineEventQueue) {
        return OrderBook.forType(engineProperties.getDataType(), engineEventQueue);
    }

    @Bean
    public HistoricalDataFeed historicalDataFeed(
            PersistenceClient persistenceClient, InstrumentRegistry instrumentRegistry) {
        return new HistoricalDataFeed(persistenceClient, instrumentRegistry);
    }

    @Bean
    public EngineController engineController(
            EngineProperties engineProperties,
            EngineEventQueue engineEventQueue,
            OrderBook orderBook,
            OrderManager orderManager,
            BrokerGateway brokerGateway,
            ObjectProvider<Strategy> strategies,
            PerformanceRecorder performanceRecorder,
            PersistenceClient persistenceClient,
            HistoricalDataFeed historicalDataFeed) {
        return new EngineController(
                engineProperties,
                engineEventQueue,
                orderBook,
                orderManager,
                brokerGateway,
                strategies.orderedStream().toList(),
                performanceRecorder,
                persistenceClient,
                historicalDataFeed);
    }

    @Bean
    @ConditionalOnProperty(name = "algoexec.runner.enabled", havingValue = "true", matchIfMissing = true)
    public EngineRunner engineRunner(EngineController engineController, EngineProperties engineProperties) {
        return new EngineRunner(engineController, engineProperties);
    }
}
