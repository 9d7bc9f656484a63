package com.algoexec.domain.model;

import com.algoexec.domain.enums.MarketDataType;
import java.math.BigDecimal;
import java.time.Instant;

/** One market-data observation for a single ticker. */
public interface MarketData {

    MarketDataType getType();

    /** Reference price: the close for bars, the bid/ask midpoint for quotes. */
    BigDecimal price();

    Instant getTimestamp();
}
