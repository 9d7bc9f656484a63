package com.algoexec.instrument;

import com.algoexec.config.EngineProperties;
import com.algoexec.domain.model.Instrument;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.exception.InstrumentNotFoundException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup of the tradable universe by ticker and by data ticker.
 *
 * <p>Built once at startup. A malformed instrument or a duplicate ticker aborts startup
 * with a {@link ConfigurationException}.
 */
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final Map<String, Instrument> byTicker;
    private final Map<String, Instrument> byDataTicker;

    public InstrumentRegistry(Collection<Instrument> instruments) {
        Map<String, Instrument> tickers = new LinkedHashMap<>();
        Map<String, Instrument> dataTickers = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            if (tickers.putIfAbsent(instrument.getTicker(), instrument) != null) {
                throw new ConfigurationException("Duplicate instrument ticker: " + instrument.getTicker());
            }
            dataTickers.putIfAbsent(instrument.getDataTicker(), instrument);
        }
        this.byTicker = Collections.unmodifiableMap(tickers);
        this.byDataTicker = Collections.unmodifiableMap(dataTickers);
    }

    public static InstrumentRegistry fromProperties(EngineProperties properties) {
        List<Instrument> instruments = new ArrayList<>();
        for (EngineProperties.InstrumentProperties p : properties.getInstruments()) {
            try {
                instruments.add(Instrument.builder()
                        .ticker(p.getTicker())
                        .securityType(p.getSecurityType())
                        .currency(p.getCurrency())
                        .venue(p.getVenue())
                        .fees(p.getFees())
                        .initialMargin(p.getInitialMargin())
                        .quantityMultiplier(p.getQuantityMultiplier())
                        .priceMultiplier(p.getPriceMultiplier())
                        .tickSize(p.getTickSize())
                        .slippageFactor(p.getSlippageFactor())
                        .dataTicker(p.getDataTicker())
                        .contractMonth(p.getContractMonth())
                        .build());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid instrument configuration: " + e.getMessage(), e);
            }
        }
        InstrumentRegistry registry = new InstrumentRegistry(instruments);
        log.info("Instrument registry loaded with {} instruments: {}", registry.size(), registry.getTickers());
        return registry;
    }

    public Instrument get(String ticker) {
        Instrument instrument = byTicker.get(ticker);
        if (instrument == null) {
            throw new InstrumentNotFoundException(ticker);
        }
        return instrument;
    }

    public Optional<Instrument> find(String ticker) {
        return Optional.ofNullable(byTicker.get(ticker));
    }

    public Optional<Instrument> findByDataTicker(String dataTicker) {
        return Optional.ofNullable(byDataTicker.get(dataTicker));
    }

    public Collection<Instrument> getAll() {
        return byTicker.values();
    }

    public List<String> getTickers() {
        return List.copyOf(byTicker.keySet());
    }

    public int size() {
        return byTicker.size();
    }
}
