package com.algoexec.event;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * FIFO queue shared by the order book, order manager and simulator (producers) and the
 * engine loop (single consumer). Unbounded, so producers never block.
 */
@Component
public class EngineEventQueue {

    private static final Logger log = LoggerFactory.getLogger(EngineEventQueue.class);

    private final BlockingQueue<EngineEvent> queue = new LinkedBlockingQueue<>();

    public void put(EngineEvent event) {
        log.debug("Enqueue {} at {}", event.getType(), event.getTimestamp());
        queue.add(event);
    }

    /** Next event or empty when the queue is drained. */
    public Optional<EngineEvent> poll() {
        return Optional.ofNullable(queue.poll());
    }

    /** Waits up to {@code timeout} for the next event. */
    public Optional<EngineEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }
}
