package com.algoexec.marketdata;

import com.algoexec.domain.model.MarketData;
import java.time.Instant;
import java.util.Map;
import lombok.Value;

/** All bars sharing one timestamp, keyed by engine ticker. */
@Value
public class MarketDataBatch {

    Instant timestamp;
    Map<String, MarketData> data;

    /** True for the last batch of a UTC trading day. */
    boolean endOfDay;
}
