package com.algoexec.domain.model;

import com.algoexec.domain.enums.Currency;
import com.algoexec.domain.enums.SecurityType;
import com.algoexec.domain.enums.Venue;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A tradable contract as known to the engine.
 *
 * <p>Fees and initial margin are per unit of quantity. The price and quantity multipliers
 * convert a quoted price into money per unit: a lean-hogs contract quoted in cents per
 * pound has priceMultiplier 0.01 and quantityMultiplier 40000.
 *
 * <p>Instances are immutable and shared by reference from the instrument registry.
 */
@Value
public class Instrument {

    String ticker;
    SecurityType securityType;
    Currency currency;
    Venue venue;
    BigDecimal fees;
    BigDecimal initialMargin;
    BigDecimal quantityMultiplier;
    BigDecimal priceMultiplier;
    BigDecimal tickSize;

    /** Ticks of slippage applied to simulated fills. Null means the engine default. */
    BigDecimal slippageFactor;

    /** Ticker under which historical data is stored. Defaults to the ticker. */
    String dataTicker;

    /** Contract month for futures, e.g. 202412. */
    String contractMonth;

    @Builder
    private Instrument(
            String ticker,
            SecurityType securityType,
            Currency currency,
            Venue venue,
            BigDecimal fees,
            BigDecimal initialMargin,
            BigDecimal quantityMultiplier,
            BigDecimal priceMultiplier,
            BigDecimal tickSize,
            BigDecimal slippageFactor,
            String dataTicker,
            String contractMonth) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Instrument ticker must not be blank");
        }
        if (securityType == null || currency == null || venue == null) {
            throw new IllegalArgumentException("Instrument " + ticker + " requires security type, currency and venue");
        }
        this.ticker = ticker;
        this.securityType = securityType;
        this.currency = currency;
        this.venue = venue;
        this.fees = nonNegative(ticker, "fees", fees == null ? BigDecimal.ZERO : fees);
        this.initialMargin =
                nonNegative(ticker, "initialMargin", initialMargin == null ? BigDecimal.ZERO : initialMargin);
        if (securityType == SecurityType.FUTURE && this.initialMargin.signum() == 0) {
            throw new IllegalArgumentException("Future " + ticker + " requires a positive initial margin");
        }
        this.quantityMultiplier = positive(ticker, "quantityMultiplier", quantityMultiplier);
        this.priceMultiplier = positive(ticker, "priceMultiplier", priceMultiplier);
        this.tickSize = positive(ticker, "tickSize", tickSize);
        if (slippageFactor != null && slippageFactor.signum() < 0) {
            throw new IllegalArgumentException("Instrument " + ticker + " slippageFactor must be >= 0");
        }
        this.slippageFactor = slippageFactor;
        this.dataTicker = dataTicker == null || dataTicker.isBlank() ? ticker : dataTicker;
        this.contractMonth = contractMonth;
    }

    /** Money per unit of quantity per unit of quoted price. */
    public BigDecimal contractMultiplier() {
        return priceMultiplier.multiply(quantityMultiplier);
    }

    public boolean isFuture() {
        return securityType == SecurityType.FUTURE;
    }

    public boolean isEquity() {
        return securityType == SecurityType.EQUITY;
    }

    private static BigDecimal positive(String ticker, String field, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException("Instrument " + ticker + " " + field + " must be > 0");
        }
        return value;
    }

    private static BigDecimal nonNegative(String ticker, String field, BigDecimal value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Instrument " + ticker + " " + field + " must be >= 0");
        }
        return value;
    }
}
