package com.algoexec.config;

import com.algoexec.domain.enums.Currency;
import com.algoexec.domain.enums.SecurityType;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.enums.Venue;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine settings bound from the {@code algoexec.*} prefix.
 *
 * <p>{@code mode} selects which broker gateway is created. {@code instruments} is the
 * full tradable universe; the registry is built from it at startup.
 */
@ConfigurationProperties(prefix = "algoexec")
@Validated
@Getter
@Setter
public class EngineProperties {

    @NotNull
    private TradingMode mode = TradingMode.BACKTEST;

    /** Starting cash for backtests. */
    @NotNull
    @Positive
    private BigDecimal capital = new BigDecimal("100000");

    /** BAR or QUOTE. Parsed by the order book so unknown values fail with a configuration error. */
    @NotBlank
    private String dataType = "BAR";

    /** Ticks of slippage for instruments that do not configure their own. */
    @NotNull
    @PositiveOrZero
    private BigDecimal defaultSlippageFactor = BigDecimal.ONE;

    @Valid
    private List<InstrumentProperties> instruments = new ArrayList<>();

    @Valid
    private Backtest backtest = new Backtest();

    @Valid
    private Broker broker = new Broker();

    @Getter
    @Setter
    public static class InstrumentProperties {
        @NotBlank
        private String ticker;
        private SecurityType securityType = SecurityType.EQUITY;
        private Currency currency = Currency.USD;
        private Venue venue = Venue.SMART;
        private BigDecimal fees = BigDecimal.ZERO;
        private BigDecimal initialMargin = BigDecimal.ZERO;
        private BigDecimal quantityMultiplier = BigDecimal.ONE;
        private BigDecimal priceMultiplier = BigDecimal.ONE;
        private BigDecimal tickSize = new BigDecimal("0.01");
        private BigDecimal slippageFactor;
        private String dataTicker;
        private String contractMonth;
    }

    @Getter
    @Setter
    public static class Backtest {
        private List<String> tickers = new ArrayList<>();
        private Instant start;
        private Instant end;
        private String strategyName = "unnamed";
    }

    @Getter
    @Setter
    public static class Broker {
        @NotBlank
        private String host = "127.0.0.1";
        @Positive
        private int port = 7497;
        private int clientId = 0;
        private String account = "";
        @NotNull
        private Duration handshakeTimeout = Duration.ofSeconds(30);
        @NotNull
        private Duration accountDebounce = Duration.ofSeconds(2);
    }
}
