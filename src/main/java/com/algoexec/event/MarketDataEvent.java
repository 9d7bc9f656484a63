package com.algoexec.event;

import com.algoexec.domain.model.MarketData;
import java.time.Instant;
import java.util.Map;
import lombok.Value;

/** A batch of market data applied to the order book at one timestamp. */
@Value
public class MarketDataEvent implements EngineEvent {

    Instant timestamp;
    Map<String, MarketData> data;

    public MarketDataEvent(Instant timestamp, Map<String, MarketData> data) {
        this.timestamp = timestamp;
        this.data = Map.copyOf(data);
    }

    @Override
    public EngineEventType getType() {
        return EngineEventType.MARKET;
    }
}
