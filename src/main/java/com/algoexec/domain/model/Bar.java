package com.algoexec.domain.model;

import com.algoexec.domain.enums.MarketDataType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
public class Bar implements MarketData {

    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
    Instant timestamp;

    @Builder
    @Jacksonized
    private Bar(
            BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close, BigDecimal volume, Instant timestamp) {
        requirePositive("open", open);
        requirePositive("high", high);
        requirePositive("low", low);
        requirePositive("close", close);
        if (volume != null && volume.signum() < 0) {
            throw new IllegalArgumentException("Bar volume must be >= 0");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Bar timestamp is required");
        }
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume == null ? BigDecimal.ZERO : volume;
        this.timestamp = timestamp;
    }

    /** A bar whose open, high, low and close are all {@code price}. */
    public static Bar flat(BigDecimal price, Instant timestamp) {
        return Bar.builder()
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(BigDecimal.ZERO)
                .timestamp(timestamp)
                .build();
    }

    @Override
    public MarketDataType getType() {
        return MarketDataType.BAR;
    }

    @Override
    public BigDecimal price() {
        return close;
    }

    private static void requirePositive(String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException("Bar " + field + " must be > 0");
        }
    }
}
