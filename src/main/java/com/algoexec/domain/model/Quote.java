package com.algoexec.domain.model;

import com.algoexec.domain.enums.MarketDataType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
public class Quote implements MarketData {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    BigDecimal bid;
    BigDecimal bidSize;
    BigDecimal ask;
    BigDecimal askSize;
    Instant timestamp;

    @Builder
    private Quote(BigDecimal bid, BigDecimal bidSize, BigDecimal ask, BigDecimal askSize, Instant timestamp) {
        if (bid == null || bid.signum() <= 0 || ask == null || ask.signum() <= 0) {
            throw new IllegalArgumentException("Quote bid and ask must be > 0");
        }
        if ((bidSize != null && bidSize.signum() < 0) || (askSize != null && askSize.signum() < 0)) {
            throw new IllegalArgumentException("Quote sizes must be >= 0");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Quote timestamp is required");
        }
        this.bid = bid;
        this.bidSize = bidSize == null ? BigDecimal.ZERO : bidSize;
        this.ask = ask;
        this.askSize = askSize == null ? BigDecimal.ZERO : askSize;
        this.timestamp = timestamp;
    }

    @Override
    public MarketDataType getType() {
        return MarketDataType.QUOTE;
    }

    @Override
    public BigDecimal price() {
        return bid.add(ask).divide(TWO, 8, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
