package com.algoexec.performance;

import com.algoexec.broker.ExecutionReport;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.AccountSnapshot;
import com.algoexec.domain.model.Execution;
import com.algoexec.event.SignalEvent;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Collects the run's signals, trades, equity curve and account log, and turns them into a
 * {@link RunSummary} at the end.
 *
 * <p>Trades are kept once per distinct execution and the equity curve once per timestamp
 * (a later value for the same timestamp replaces the earlier one). Live fills are keyed by
 * the broker's execution id so that the commission report can be attached afterwards.
 */
@Service
public class PerformanceRecorder {

    private static final Logger log = LoggerFactory.getLogger(PerformanceRecorder.class);

    private static final int RATIO_SCALE = 6;

    private final List<SignalEvent> signals = new ArrayList<>();
    private final Set<Execution> trades = new LinkedHashSet<>();
    private final TreeMap<Instant, BigDecimal> equityCurve = new TreeMap<>();
    private final List<AccountSnapshot> accountLog = new ArrayList<>();
    private final Map<String, LiveTrade> liveTrades = new LinkedHashMap<>();
    private final Map<String, BigDecimal> pendingCommissions = new LinkedHashMap<>();
    private final Map<String, String> accountSummary = new LinkedHashMap<>();

    public synchronized void recordSignal(SignalEvent signal) {
        signals.add(signal);
    }

    /** Returns false if the same execution was already recorded. */
    public synchronized boolean recordTrade(Execution execution) {
        boolean added = trades.add(execution);
        if (!added) {
            log.debug("Trade already recorded: {} {}", execution.getTicker(), execution.getTimestamp());
        }
        return added;
    }

    public synchronized void recordEquity(Instant timestamp, BigDecimal equity) {
        if (timestamp == null || equity == null) {
            return;
        }
        equityCurve.put(timestamp, equity);
    }

    public synchronized void recordAccount(AccountSnapshot snapshot) {
        accountLog.add(snapshot);
    }

    public synchronized void recordLiveExecution(ExecutionReport report) {
        LiveTrade previous = liveTrades.get(report.getExecId());
        BigDecimal commission = previous != null ? previous.getCommission() : pendingCommissions.remove(report.getExecId());
        liveTrades.put(
                report.getExecId(),
                LiveTrade.builder().execution(report).commission(commission).build());
        log.info(
                "Live execution {}: {} {} {} @ {}",
                report.getExecId(),
                report.getSide(),
                report.getShares(),
                report.getSymbol(),
                report.getPrice());
    }

    /** Attaches a commission to a live fill. A commission that arrives first is held until the fill does. */
    public synchronized void recordCommission(String execId, BigDecimal commission) {
        LiveTrade trade = liveTrades.get(execId);
        if (trade == null) {
            pendingCommissions.put(execId, commission);
            return;
        }
        liveTrades.put(execId, trade.toBuilder().commission(commission).build());
    }

    public synchronized void recordAccountSummary(Map<String, String> values) {
        accountSummary.putAll(values);
    }

    public synchronized List<Execution> getTrades() {
        return List.copyOf(trades);
    }

    public synchronized List<EquityPoint> getEquityCurve() {
        List<EquityPoint> points = new ArrayList<>();
        equityCurve.forEach((timestamp, equity) -> points.add(new EquityPoint(timestamp, equity)));
        return points;
    }

    public synchronized List<LiveTrade> getLiveTrades() {
        return List.copyOf(liveTrades.values());
    }

    public synchronized List<SignalEvent> getSignals() {
        return List.copyOf(signals);
    }

    public synchronized RunSummary buildSummary(
            TradingMode mode,
            String strategyName,
            List<String> tickers,
            BigDecimal initialCapital,
            Instant startedAt,
            Instant endedAt) {
        List<EquityPoint> curve = getEquityCurve();
        BigDecimal start = initialCapital != null ? initialCapital : firstEquity(curve);
        BigDecimal ending = curve.isEmpty() ? start : curve.get(curve.size() - 1).getEquity();
        BigDecimal netProfit = ending != null && start != null ? ending.subtract(start) : BigDecimal.ZERO;
        BigDecimal totalReturn = start != null && start.signum() != 0
                ? netProfit.divide(start, RATIO_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal peak = null;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal maxDrawdownPercent = BigDecimal.ZERO;
        for (EquityPoint point : curve) {
            BigDecimal equity = point.getEquity();
            if (peak == null || equity.compareTo(peak) > 0) {
                peak = equity;
                continue;
            }
            BigDecimal drawdown = peak.subtract(equity);
            if (drawdown.compareTo(maxDrawdown) > 0) {
                maxDrawdown = drawdown;
                maxDrawdownPercent =
                        peak.signum() > 0 ? drawdown.divide(peak, RATIO_SCALE, RoundingMode.HALF_UP) : BigDecimal.ZERO;
            }
        }

        BigDecimal totalFees = trades.stream().map(Execution::getFees).reduce(BigDecimal.ZERO, BigDecimal::add);
        for (LiveTrade trade : liveTrades.values()) {
            if (trade.getCommission() != null) {
                totalFees = totalFees.add(trade.getCommission());
            }
        }

        RunSummary summary = RunSummary.builder()
                .runId(UUID.randomUUID().toString())
                .mode(mode)
                .strategyName(strategyName)
                .tickers(tickers == null ? List.of() : List.copyOf(tickers))
                .startedAt(startedAt)
                .endedAt(endedAt)
                .initialCapital(start)
                .endingEquity(ending)
                .netProfit(netProfit)
                .totalReturn(totalReturn)
                .totalFees(totalFees)
                .maxDrawdown(maxDrawdown)
                .maxDrawdownPercent(maxDrawdownPercent)
                .tradeCount(trades.size() + liveTrades.size())
                .signalCount(signals.size())
                .signals(List.copyOf(signals))
                .trades(List.copyOf(trades))
                .equityCurve(curve)
                .accountLog(List.copyOf(accountLog))
                .liveTrades(List.copyOf(liveTrades.values()))
                .accountSummary(Map.copyOf(accountSummary))
                .build();
        log.info(
                "Run {} summary: netProfit={} return={} maxDrawdown={} trades={} fees={}",
                summary.getRunId(),
                netProfit,
                totalReturn,
                maxDrawdown,
                summary.getTradeCount(),
                totalFees);
        return summary;
    }

    public synchronized void reset() {
        signals.clear();
        trades.clear();
        equityCurve.clear();
        accountLog.clear();
        liveTrades.clear();
        pendingCommissions.clear();
        accountSummary.clear();
    }

    private static BigDecimal firstEquity(List<EquityPoint> curve) {
        return curve.isEmpty() ? null : curve.get(0).getEquity();
    }
}
