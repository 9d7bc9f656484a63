package com.algoexec.observability;

import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.portfolio.PortfolioServer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the execution engine:
 * <ul>
 *   <li><b>signals.rejected</b> (counter): signals dropped by the order manager</li>
 *   <li><b>orders.submitted</b> (counter): orders handed to a broker gateway</li>
 *   <li><b>executions.count</b> (counter): fills, simulated or reported by the broker</li>
 *   <li><b>margin.calls</b> (counter): end-of-day checks where funds fell below margin</li>
 *   <li><b>account.net.liquidation</b> (gauge): latest net liquidation from the portfolio server</li>
 * </ul>
 */
@Service
public class EngineMetricsService {

    private final Counter signalsRejectedCounter;
    private final Counter ordersSubmittedCounter;
    private final Counter executionsCounter;
    private final Counter marginCallsCounter;

    public EngineMetricsService(MeterRegistry meterRegistry, PortfolioServer portfolioServer) {
        this.signalsRejectedCounter = Counter.builder("signals.rejected")
                .description("Signals rejected by capital, margin or busy-ticker checks")
                .register(meterRegistry);
        this.ordersSubmittedCounter = Counter.builder("orders.submitted")
                .description("Orders submitted to the broker gateway")
                .register(meterRegistry);
        this.executionsCounter = Counter.builder("executions.count")
                .description("Executions processed")
                .register(meterRegistry);
        this.marginCallsCounter = Counter.builder("margin.calls")
                .description("Margin calls detected at end of day")
                .register(meterRegistry);

        meterRegistry.gauge("account.net.liquidation", portfolioServer, server -> server.getAccount()
                .map(AccountSnapshot::getNetLiquidation)
                .map(BigDecimal::doubleValue)
                .orElse(0.0));
    }

    public void recordSignalRejected() {
        signalsRejectedCounter.increment();
    }

    public void recordOrderSubmitted() {
        ordersSubmittedCounter.increment();
    }

    public void recordExecution() {
        executionsCounter.increment();
    }

    public void recordMarginCall() {
        marginCallsCounter.increment();
    }
}
