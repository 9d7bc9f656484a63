package com.algoexec.broker;

import com.algoexec.exception.BrokerException;
import com.algoexec.exception.ErrorCode;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out broker request ids: order ids, account-summary and contract-details request
 * ids all come from the same monotonic sequence seeded by {@code nextValidId}.
 */
public class OrderIdAllocator {

    private static final Logger log = LoggerFactory.getLogger(OrderIdAllocator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private int nextId = -1;

    /** Seeds the sequence. Never moves it backwards. */
    public void reset(int validId) {
        lock.lock();
        try {
            if (validId > nextId) {
                nextId = validId;
            }
            log.info("Next valid id is {}", nextId);
        } finally {
            lock.unlock();
        }
    }

    public int next() {
        lock.lock();
        try {
            if (nextId < 0) {
                throw new BrokerException(ErrorCode.BROKER_UNAVAILABLE, "No valid id received from broker yet");
            }
            return nextId++;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialized() {
        lock.lock();
        try {
            return nextId >= 0;
        } finally {
            lock.unlock();
        }
    }
}
