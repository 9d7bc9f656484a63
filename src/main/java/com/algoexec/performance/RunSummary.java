package com.algoexec.performance;

import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.Execution;
import com.algoexec.event.SignalEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Everything persisted at the end of a backtest or live session. */
@Value
@Builder
public class RunSummary {

    String runId;
    TradingMode mode;
    String strategyName;
    List<String> tickers;
    Instant startedAt;
    Instant endedAt;

    BigDecimal initialCapital;
    BigDecimal endingEquity;
    BigDecimal netProfit;
    BigDecimal totalReturn;
    BigDecimal totalFees;
    BigDecimal maxDrawdown;
    BigDecimal maxDrawdownPercent;
    int tradeCount;
    int signalCount;

    List<SignalEvent> signals;
    List<Execution> trades;
    List<EquityPoint> equityCurve;
    List<AccountSnapshot> accountLog;
    List<LiveTrade> liveTrades;
    Map<String, String> accountSummary;
}
