package com.algoexec.broker;

import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes portfolio mutations coming from broker callbacks onto one consumer thread,
 * in arrival order. The executor must run tasks one at a time in FIFO order.
 */
public class PortfolioMailbox {

    private static final Logger log = LoggerFactory.getLogger(PortfolioMailbox.class);

    private final Executor executor;

    public PortfolioMailbox(Executor executor) {
        this.executor = executor;
    }

    public void post(String description, Runnable update) {
        executor.execute(() -> {
            try {
                update.run();
            } catch (RuntimeException e) {
                log.error("Portfolio update '{}' failed: {}", description, e.getMessage(), e);
            }
        });
    }
}
