package com.algoexec.persistence;

import com.algoexec.domain.model.HistoricalBar;
import com.algoexec.performance.RunSummary;
import java.time.Instant;
import java.util.List;

/** Boundary to the service that stores historical bars and run results. */
public interface PersistenceClient {

    /** Bars for {@code tickers} (data tickers) with {@code start <= timestamp <= end}. */
    List<HistoricalBar> getBars(List<String> tickers, Instant start, Instant end);

    /** Uploads bars in chunks. Returns the number of bars sent. */
    int uploadBars(List<HistoricalBar> bars);

    void saveBacktest(RunSummary summary);

    void saveLiveSession(RunSummary summary);
}
