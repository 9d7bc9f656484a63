package com.algoexec.marketdata;

import com.algoexec.domain.enums.MarketDataType;
import com.algoexec.domain.model.MarketData;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.exception.PriceNotFoundException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest market data per ticker, the single source of "current price" for the order
 * manager and the simulator.
 *
 * <p>Each {@link #update} replaces the stored entries for the batch's tickers and swaps in
 * a new map, so readers on other threads see either the whole batch or none of it.
 */
public class OrderBook {

    private static final Logger log = LoggerFactory.getLogger(OrderBook.class);

    private final MarketDataType dataType;
    private final EngineEventQueue eventQueue;

    private volatile Map<String, MarketData> book = Collections.emptyMap();
    private volatile Instant lastUpdated;

    public OrderBook(MarketDataType dataType, EngineEventQueue eventQueue) {
        if (dataType == null) {
            throw new ConfigurationException("Order book requires a market data type");
        }
        this.dataType = dataType;
        this.eventQueue = eventQueue;
    }

    /** Parses a configured type name; anything but BAR or QUOTE is a configuration error. */
    public static OrderBook forType(String dataType, EngineEventQueue eventQueue) {
        if (dataType == null) {
            throw new ConfigurationException("Market data type is not configured");
        }
        try {
            return new OrderBook(MarketDataType.valueOf(dataType.trim().toUpperCase(Locale.ROOT)), eventQueue);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unsupported market data type: " + dataType, e);
        }
    }

    /**
     * Applies a batch and enqueues one {@link MarketDataEvent} carrying it.
     *
     * @throws ConfigurationException if an entry is of the wrong kind for this book
     */
    public void update(Map<String, MarketData> data, Instant timestamp) {
        for (Map.Entry<String, MarketData> entry : data.entrySet()) {
            if (entry.getValue().getType() != dataType) {
                throw new ConfigurationException(String.format(
                        "Order book holds %s data but received %s for %s",
                        dataType, entry.getValue().getType(), entry.getKey()));
            }
        }
        Map<String, MarketData> next = new HashMap<>(book);
        next.putAll(data);
        book = Collections.unmodifiableMap(next);
        lastUpdated = timestamp;
        log.debug("Order book updated at {} with {} tickers", timestamp, data.size());
        eventQueue.put(new MarketDataEvent(timestamp, data));
    }

    public Optional<BigDecimal> currentPrice(String ticker) {
        MarketData data = book.get(ticker);
        return data == null ? Optional.empty() : Optional.of(data.price());
    }

    /** Current price or {@link PriceNotFoundException} if the ticker never received data. */
    public BigDecimal requirePrice(String ticker) {
        return currentPrice(ticker).orElseThrow(() -> new PriceNotFoundException(ticker));
    }

    public Map<String, BigDecimal> currentPrices() {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        book.forEach((ticker, data) -> prices.put(ticker, data.price()));
        return prices;
    }

    public Optional<MarketData> latest(String ticker) {
        return Optional.ofNullable(book.get(ticker));
    }

    public MarketDataType getDataType() {
        return dataType;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }
}
