package com.algoexec.persistence;

import com.algoexec.config.PersistenceConfig;
import com.algoexec.domain.model.HistoricalBar;
import com.algoexec.exception.PersistenceException;
import com.algoexec.performance.RunSummary;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link PersistenceClient} over the persistence backend's REST API.
 *
 * <p>Endpoints: {@code GET /bars}, {@code POST /bars}, {@code POST /backtests},
 * {@code POST /live-sessions}. Calls are retried and guarded by the
 * {@code persistence} circuit breaker; a call that still fails surfaces as a
 * {@link PersistenceException}.
 */
@Service
public class RestPersistenceClient implements PersistenceClient {

    private static final Logger log = LoggerFactory.getLogger(RestPersistenceClient.class);

    private static final ParameterizedTypeReference<List<HistoricalBar>> BAR_LIST = new ParameterizedTypeReference<>() {};

    private final RestClient persistenceRestClient;
    private final int chunkSize;

    public RestPersistenceClient(RestClient persistenceRestClient, PersistenceConfig persistenceConfig) {
        this.persistenceRestClient = persistenceRestClient;
        this.chunkSize = Math.max(1, persistenceConfig.getChunkSize());
    }

    @Override
    @CircuitBreaker(name = "persistence")
    @Retry(name = "persistence")
    public List<HistoricalBar> getBars(List<String> tickers, Instant start, Instant end) {
        try {
            List<HistoricalBar> bars = persistenceRestClient
                    .get()
                    .uri(uri -> uri.path("/bars")
                            .queryParam("tickers", String.join(",", tickers))
                            .queryParam("start", start)
                            .queryParam("end", end)
                            .build())
                    .retrieve()
                    .body(BAR_LIST);
            List<HistoricalBar> result = bars == null ? List.of() : bars;
            log.info("Loaded {} bars for {} between {} and {}", result.size(), tickers, start, end);
            return result;
        } catch (RestClientException e) {
            log.error("Failed to load bars for {}: {}", tickers, e.getMessage());
            throw new PersistenceException("Failed to load bars for " + tickers, e);
        }
    }

    @Override
    @CircuitBreaker(name = "persistence")
    @Retry(name = "persistence")
    public int uploadBars(List<HistoricalBar> bars) {
        int sent = 0;
        try {
            for (int from = 0; from < bars.size(); from += chunkSize) {
                List<HistoricalBar> chunk = bars.subList(from, Math.min(from + chunkSize, bars.size()));
                persistenceRestClient
                        .post()
                        .uri("/bars")
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(chunk)
                        .retrieve()
                        .toBodilessEntity();
                sent += chunk.size();
                log.debug("Uploaded {}/{} bars", sent, bars.size());
            }
        } catch (RestClientException e) {
            log.error("Bar upload failed after {} bars: {}", sent, e.getMessage());
            throw new PersistenceException("Bar upload failed after " + sent + " bars", e);
        }
        log.info("Uploaded {} bars in chunks of {}", sent, chunkSize);
        return sent;
    }

    @Override
    @CircuitBreaker(name = "persistence")
    @Retry(name = "persistence")
    public void saveBacktest(RunSummary summary) {
        post("/backtests", summary);
    }

    @Override
    @CircuitBreaker(name = "persistence")
    @Retry(name = "persistence")
    public void saveLiveSession(RunSummary summary) {
        post("/live-sessions", summary);
    }

    private void post(String path, RunSummary summary) {
        try {
            persistenceRestClient
                    .post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(summary)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Saved run {} to {}", summary.getRunId(), path);
        } catch (RestClientException e) {
            log.error("Failed to save run {} to {}: {}", summary.getRunId(), path, e.getMessage());
            throw new PersistenceException("Failed to save run " + summary.getRunId(), e);
        }
    }
}
