package com.algoexec.unit.performance;

import static org.assertj.core.api.Assertions.assertThat;

import com.algoexec.broker.ExecutionReport;
import com.algoexec.domain.enums.Action;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.Execution;
import com.algoexec.performance.PerformanceRecorder;
import com.algoexec.performance.RunSummary;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PerformanceRecorderTest {

    private static final Instant T1 = Instant.parse("2024-03-01T15:00:00Z");

    private PerformanceRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new PerformanceRecorder();
    }

    @Test
    void recordTrade_isIdempotentPerExecution() {
        Execution execution = execution("0.5");

        assertThat(recorder.recordTrade(execution)).isTrue();
        assertThat(recorder.recordTrade(execution)).isFalse();
        assertThat(recorder.getTrades()).hasSize(1);
    }

    @Test
    void recordEquity_keepsLatestValuePerTimestamp() {
        recorder.recordEquity(T1, new BigDecimal("100"));
        recorder.recordEquity(T1, new BigDecimal("101"));
        recorder.recordEquity(T1.minusSeconds(60), new BigDecimal("99"));
        recorder.recordEquity(null, BigDecimal.ONE);

        assertThat(recorder.getEquityCurve()).hasSize(2);
        assertThat(recorder.getEquityCurve().get(0).getEquity()).isEqualByComparingTo("99");
        assertThat(recorder.getEquityCurve().get(1).getEquity()).isEqualByComparingTo("101");
    }

    @Test
    void buildSummary_computesReturnAndDrawdown() {
        recordCurve("100000", "101000", "98980", "99500", "102000");
        recorder.recordTrade(execution("1.25"));

        RunSummary summary = recorder.buildSummary(
                TradingMode.BACKTEST, "demo", List.of("AAPL"), new BigDecimal("100000"), T1, T1.plusSeconds(600));

        assertThat(summary.getEndingEquity()).isEqualByComparingTo("102000");
        assertThat(summary.getNetProfit()).isEqualByComparingTo("2000");
        assertThat(summary.getTotalReturn()).isEqualByComparingTo("0.02");
        assertThat(summary.getMaxDrawdown()).isEqualByComparingTo("2020");
        assertThat(summary.getMaxDrawdownPercent()).isEqualByComparingTo("0.02");
        assertThat(summary.getTotalFees()).isEqualByComparingTo("1.25");
        assertThat(summary.getTradeCount()).isEqualTo(1);
        assertThat(summary.getStrategyName()).isEqualTo("demo");
        assertThat(summary.getRunId()).isNotBlank();
    }

    @Test
    void buildSummary_withoutCapital_startsFromFirstEquityPoint() {
        recordCurve("50000", "50500");

        RunSummary summary = recorder.buildSummary(TradingMode.LIVE, "live", List.of(), null, T1, T1);

        assertThat(summary.getInitialCapital()).isEqualByComparingTo("50000");
        assertThat(summary.getNetProfit()).isEqualByComparingTo("500");
    }

    @Test
    void commission_attachesWhicheverArrivesFirst() {
        recorder.recordCommission("e-2", new BigDecimal("0.70"));
        recorder.recordLiveExecution(report("e-1"));
        recorder.recordLiveExecution(report("e-2"));
        recorder.recordCommission("e-1", new BigDecimal("0.35"));

        assertThat(recorder.getLiveTrades()).hasSize(2);
        assertThat(recorder.getLiveTrades().get(0).getCommission()).isEqualByComparingTo("0.35");
        assertThat(recorder.getLiveTrades().get(1).getCommission()).isEqualByComparingTo("0.70");

        RunSummary summary = recorder.buildSummary(TradingMode.LIVE, "live", List.of(), BigDecimal.ONE, T1, T1);
        assertThat(summary.getTotalFees()).isEqualByComparingTo("1.05");
    }

    @Test
    void reset_clearsEverything() {
        recorder.recordTrade(execution("0"));
        recorder.recordEquity(T1, BigDecimal.TEN);

        recorder.reset();

        assertThat(recorder.getTrades()).isEmpty();
        assertThat(recorder.getEquityCurve()).isEmpty();
    }

    private void recordCurve(String... values) {
        for (int i = 0; i < values.length; i++) {
            recorder.recordEquity(T1.plusSeconds(60L * i), new BigDecimal(values[i]));
        }
    }

    private static Execution execution(String fees) {
        return Execution.builder()
                .timestamp(T1)
                .tradeId(1)
                .legId(1)
                .ticker("AAPL")
                .quantity(BigDecimal.TEN)
                .fillPrice(new BigDecimal("100"))
                .notional(new BigDecimal("1000"))
                .action(Action.LONG)
                .fees(new BigDecimal(fees))
                .build();
    }

    private static ExecutionReport report(String execId) {
        return ExecutionReport.builder()
                .execId(execId)
                .orderId(11)
                .symbol("AAPL")
                .side("BOT")
                .shares(BigDecimal.TEN)
                .price(new BigDecimal("100"))
                .build();
    }
}
