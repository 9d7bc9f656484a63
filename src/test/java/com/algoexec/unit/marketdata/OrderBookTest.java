package com.algoexec.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.algoexec.domain.enums.MarketDataType;
import com.algoexec.domain.model.MarketData;
import com.algoexec.domain.model.Quote;
import com.algoexec.event.EngineEvent;
import com.algoexec.event.EngineEventQueue;
import com.algoexec.event.EngineEventType;
import com.algoexec.event.MarketDataEvent;
import com.algoexec.exception.ConfigurationException;
import com.algoexec.exception.PriceNotFoundException;
import com.algoexec.marketdata.OrderBook;
import com.algoexec.unit.TestInstruments;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OrderBookTest {

    private static final Instant T1 = Instant.parse("2024-03-01T15:00:00Z");
    private static final Instant T2 = Instant.parse("2024-03-01T15:01:00Z");

    private EngineEventQueue queue;

    @BeforeEach
    void setUp() {
        queue = new EngineEventQueue();
    }

    @Test
    void barBook_pricesAtClose_andEnqueuesMarketEvent() {
        OrderBook book = OrderBook.forType("bar", queue);

        book.update(TestInstruments.bars(T1, "AAPL", "101.5"), T1);

        assertThat(book.getDataType()).isEqualTo(MarketDataType.BAR);
        assertThat(book.requirePrice("AAPL")).isEqualByComparingTo("101.5");
        assertThat(book.getLastUpdated()).isEqualTo(T1);

        EngineEvent event = queue.poll().orElseThrow();
        assertThat(event.getType()).isEqualTo(EngineEventType.MARKET);
        assertThat(((MarketDataEvent) event).getData()).containsOnlyKeys("AAPL");
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void update_replacesOnlyTheBatchTickers() {
        OrderBook book = OrderBook.forType("BAR", queue);
        book.update(TestInstruments.bars(T1, "AAPL", "100", "HE", "80"), T1);

        book.update(TestInstruments.bars(T2, "AAPL", "102"), T2);

        assertThat(book.currentPrices()).containsOnlyKeys("AAPL", "HE");
        assertThat(book.requirePrice("AAPL")).isEqualByComparingTo("102");
        assertThat(book.requirePrice("HE")).isEqualByComparingTo("80");
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void quoteBook_pricesAtMid() {
        OrderBook book = OrderBook.forType("QUOTE", queue);
        Map<String, MarketData> data = Map.of(
                "AAPL",
                Quote.builder()
                        .bid(new BigDecimal("100.00"))
                        .ask(new BigDecimal("100.05"))
                        .timestamp(T1)
                        .build());

        book.update(data, T1);

        assertThat(book.requirePrice("AAPL")).isEqualByComparingTo("100.025");
    }

    @Test
    void wrongDataKind_isConfigurationError() {
        OrderBook book = OrderBook.forType("QUOTE", queue);

        assertThatThrownBy(() -> book.update(TestInstruments.bars(T1, "AAPL", "100"), T1))
                .isInstanceOf(ConfigurationException.class);
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void unknownDataType_isConfigurationError() {
        assertThatThrownBy(() -> OrderBook.forType("TICK", queue)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void missingPrice() {
        OrderBook book = OrderBook.forType("BAR", queue);

        assertThat(book.currentPrice("AAPL")).isEmpty();
        assertThatThrownBy(() -> book.requirePrice("AAPL")).isInstanceOf(PriceNotFoundException.class);
    }
}
