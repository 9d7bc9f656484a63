package com.algoexec.config;

import com.algoexec.broker.BrokerCallbackHandler;
import com.algoexec.broker.BrokerTransport;
import com.algoexec.broker.ContractValidator;
import com.algoexec.broker.LiveBrokerClient;
import com.algoexec.broker.OrderIdAllocator;
import com.algoexec.broker.PortfolioMailbox;
import com.algoexec.broker.ProcessTerminator;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.observability.EngineMetricsService;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.portfolio.PortfolioServer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Live broker wiring, active when {@code algoexec.mode=LIVE}.
 *
 * <p>Requires a {@link BrokerTransport} bean: the adapter to the broker's client library,
 * supplied by the deployment.
 */
@Configuration
@ConditionalOnProperty(name = "algoexec.mode", havingValue = "LIVE")
public class LiveBrokerConfig {

    @Bean
    public OrderIdAllocator orderIdAllocator() {
        return new OrderIdAllocator();
    }

    @Bean
    public PortfolioMailbox portfolioMailbox(
            @Qualifier("portfolioMailboxExecutor") ThreadPoolTaskExecutor portfolioMailboxExecutor) {
        return new PortfolioMailbox(portfolioMailboxExecutor);
    }

    @Bean
    public ThreadPoolTaskScheduler brokerTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("broker-debounce-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public ContractValidator contractValidator(
            BrokerTransport brokerTransport, OrderIdAllocator orderIdAllocator, EngineProperties engineProperties) {
        return new ContractValidator(
                brokerTransport, orderIdAllocator, engineProperties.getBroker().getHandshakeTimeout());
    }

    @Bean
    public BrokerCallbackHandler brokerCallbackHandler(
            PortfolioMailbox portfolioMailbox,
            PortfolioServer portfolioServer,
            ContractValidator contractValidator,
            OrderIdAllocator orderIdAllocator,
            PerformanceRecorder performanceRecorder,
            EngineMetricsService engineMetricsService,
            InstrumentRegistry instrumentRegistry,
            ProcessTerminator processTerminator,
            @Qualifier("brokerTaskScheduler") ThreadPoolTaskScheduler brokerTaskScheduler,
            EngineProperties engineProperties) {
        return new BrokerCallbackHandler(
                portfolioMailbox,
                portfolioServer,
                contractValidator,
                orderIdAllocator,
                performanceRecorder,
                engineMetricsService,
                instrumentRegistry,
                processTerminator,
                brokerTaskScheduler,
                engineProperties.getBroker().getAccountDebounce());
    }

    @Bean
    public LiveBrokerClient liveBrokerClient(
            BrokerTransport brokerTransport,
            BrokerCallbackHandler brokerCallbackHandler,
            ContractValidator contractValidator,
            OrderIdAllocator orderIdAllocator,
            PortfolioServer portfolioServer,
            EngineMetricsService engineMetricsService,
            EngineProperties engineProperties) {
        return new LiveBrokerClient(
                brokerTransport,
                brokerCallbackHandler,
                contractValidator,
                orderIdAllocator,
                portfolioServer,
                engineMetricsService,
                engineProperties.getBroker());
    }
}
