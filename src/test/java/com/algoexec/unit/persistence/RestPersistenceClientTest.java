package com.algoexec.unit.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.algoexec.config.PersistenceConfig;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.domain.model.Bar;
import com.algoexec.domain.model.HistoricalBar;
import com.algoexec.exception.PersistenceException;
import com.algoexec.performance.RunSummary;
import com.algoexec.persistence.RestPersistenceClient;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RestPersistenceClientTest {

    private static final String BASE_URL = "http://persistence.test";
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-02T00:00:00Z");

    private MockRestServiceServer server;
    private RestPersistenceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        PersistenceConfig config = new PersistenceConfig();
        config.setChunkSize(2);
        client = new RestPersistenceClient(builder.build(), config);
    }

    @Test
    void getBars_queriesByDataTickerAndWindow() {
        server.expect(requestTo(startsWith(BASE_URL + "/bars")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("tickers", "AAPL,HE.c.0"))
                .andRespond(withSuccess(
                        """
                        [{"ticker":"AAPL","bar":{"open":100,"high":101,"low":99.5,"close":100.5,
                          "volume":1200,"timestamp":"2024-03-01T15:00:00Z"}}]
                        """,
                        MediaType.APPLICATION_JSON));

        List<HistoricalBar> bars = client.getBars(List.of("AAPL", "HE.c.0"), START, END);

        server.verify();
        assertThat(bars).singleElement().satisfies(bar -> {
            assertThat(bar.getTicker()).isEqualTo("AAPL");
            assertThat(bar.getBar().price()).isEqualByComparingTo("100.5");
            assertThat(bar.getBar().getTimestamp()).isEqualTo(Instant.parse("2024-03-01T15:00:00Z"));
        });
    }

    @Test
    void getBars_serverError_isPersistenceException() {
        server.expect(requestTo(startsWith(BASE_URL + "/bars"))).andRespond(withServerError());

        assertThatThrownBy(() -> client.getBars(List.of("AAPL"), START, END))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("AAPL");
    }

    @Test
    void uploadBars_sendsChunks() {
        server.expect(times(3), requestTo(BASE_URL + "/bars"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        List<HistoricalBar> bars = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            bars.add(HistoricalBar.builder()
                    .ticker("AAPL")
                    .bar(Bar.flat(new BigDecimal("100"), START.plusSeconds(60L * i)))
                    .build());
        }

        int sent = client.uploadBars(bars);

        server.verify();
        assertThat(sent).isEqualTo(5);
    }

    @Test
    void saveBacktest_postsSummary() {
        server.expect(requestTo(BASE_URL + "/backtests"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());

        client.saveBacktest(RunSummary.builder()
                .runId("run-1")
                .mode(TradingMode.BACKTEST)
                .strategyName("demo")
                .tickers(List.of("AAPL"))
                .netProfit(BigDecimal.TEN)
                .build());

        server.verify();
    }

    @Test
    void saveLiveSession_failure_isPersistenceException() {
        server.expect(requestTo(BASE_URL + "/live-sessions")).andRespond(withServerError());

        assertThatThrownBy(() -> client.saveLiveSession(
                        RunSummary.builder().runId("run-2").build()))
                .isInstanceOf(PersistenceException.class);
    }
}
