package com.algoexec.marketdata;

import com.algoexec.domain.model.HistoricalBar;
import com.algoexec.domain.model.Instrument;
import com.algoexec.domain.model.MarketData;
import com.algoexec.instrument.InstrumentRegistry;
import com.algoexec.persistence.PersistenceClient;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays stored bars as per-timestamp batches for the backtest loop.
 *
 * <p>Stored bars are keyed by data ticker and translated to engine tickers through the
 * registry; bars for unknown data tickers are skipped. A batch is flagged end-of-day when
 * the next batch falls on a different UTC date, and the final batch always is.
 */
public class HistoricalDataFeed {

    private static final Logger log = LoggerFactory.getLogger(HistoricalDataFeed.class);

    private final PersistenceClient persistenceClient;
    private final InstrumentRegistry instrumentRegistry;

    public HistoricalDataFeed(PersistenceClient persistenceClient, InstrumentRegistry instrumentRegistry) {
        this.persistenceClient = persistenceClient;
        this.instrumentRegistry = instrumentRegistry;
    }

    public List<MarketDataBatch> load(List<String> tickers, Instant start, Instant end) {
        List<String> dataTickers = tickers.stream()
                .map(t -> instrumentRegistry.get(t).getDataTicker())
                .toList();
        return toBatches(persistenceClient.getBars(dataTickers, start, end));
    }

    List<MarketDataBatch> toBatches(List<HistoricalBar> bars) {
        TreeMap<Instant, Map<String, MarketData>> byTimestamp = new TreeMap<>();
        int skipped = 0;
        for (HistoricalBar bar : bars) {
            Optional<Instrument> instrument = instrumentRegistry.findByDataTicker(bar.getTicker());
            if (instrument.isEmpty()) {
                skipped++;
                continue;
            }
            byTimestamp
                    .computeIfAbsent(bar.getBar().getTimestamp(), t -> new LinkedHashMap<>())
                    .put(instrument.get().getTicker(), bar.getBar());
        }
        if (skipped > 0) {
            log.warn("Skipped {} bars for data tickers outside the registry", skipped);
        }

        List<MarketDataBatch> batches = new ArrayList<>(byTimestamp.size());
        List<Instant> timestamps = new ArrayList<>(byTimestamp.keySet());
        for (int i = 0; i < timestamps.size(); i++) {
            Instant timestamp = timestamps.get(i);
            boolean endOfDay = i == timestamps.size() - 1 || !utcDate(timestamp).equals(utcDate(timestamps.get(i + 1)));
            batches.add(new MarketDataBatch(timestamp, byTimestamp.get(timestamp), endOfDay));
        }
        log.info("Prepared {} market data batches from {} bars", batches.size(), bars.size());
        return batches;
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }
}
