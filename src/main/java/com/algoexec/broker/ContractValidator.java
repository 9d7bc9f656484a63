package com.algoexec.broker;

import com.algoexec.domain.model.Instrument;
import com.algoexec.exception.BrokerException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks with the broker that a contract exists before the first order for it.
 *
 * <p>A successful validation is cached per ticker, so later orders skip the round trip.
 * Failures are not cached. The wait for the broker's answer is bounded by the handshake
 * timeout.
 */
public class ContractValidator {

    private static final Logger log = LoggerFactory.getLogger(ContractValidator.class);

    private final BrokerTransport transport;
    private final OrderIdAllocator orderIdAllocator;
    private final Duration timeout;

    private final Cache<String, Boolean> validated =
            Caffeine.newBuilder().expireAfterWrite(Duration.ofDays(1)).maximumSize(10_000).build();

    private final Map<Integer, CompletableFuture<Boolean>> pending = new ConcurrentHashMap<>();

    public ContractValidator(BrokerTransport transport, OrderIdAllocator orderIdAllocator, Duration timeout) {
        this.transport = transport;
        this.orderIdAllocator = orderIdAllocator;
        this.timeout = timeout;
    }

    /**
     * @return true if the broker knows the contract, false if it answered "not found"
     * @throws BrokerException if the broker does not answer in time
     */
    public boolean validate(Instrument instrument) {
        String ticker = instrument.getTicker();
        if (isValidated(ticker)) {
            return true;
        }
        int reqId = orderIdAllocator.next();
        CompletableFuture<Boolean> answer = new CompletableFuture<>();
        pending.put(reqId, answer);
        try {
            transport.reqContractDetails(reqId, instrument);
            boolean valid = answer.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (valid) {
                validated.put(ticker, Boolean.TRUE);
                log.info("Contract {} validated (request {})", ticker, reqId);
            } else {
                log.warn("Contract {} not found by broker (request {})", ticker, reqId);
            }
            return valid;
        } catch (TimeoutException e) {
            throw new BrokerException("Timed out validating contract " + ticker, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerException("Interrupted validating contract " + ticker, e);
        } catch (ExecutionException e) {
            throw new BrokerException("Contract validation failed for " + ticker, e.getCause());
        } finally {
            pending.remove(reqId);
        }
    }

    public boolean isValidated(String ticker) {
        return validated.getIfPresent(ticker) != null;
    }

    public void onContractDetails(int reqId) {
        complete(reqId, true);
    }

    /** End of the details stream. Resolves to "not found" unless details already arrived. */
    public void onContractDetailsEnd(int reqId) {
        complete(reqId, false);
    }

    public void onContractNotFound(int reqId) {
        complete(reqId, false);
    }

    private void complete(int reqId, boolean valid) {
        CompletableFuture<Boolean> answer = pending.get(reqId);
        if (answer != null) {
            answer.complete(valid);
        }
    }
}
