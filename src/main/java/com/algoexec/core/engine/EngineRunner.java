package com.algoexec.core.engine;

import com.algoexec.config.EngineProperties;
import com.algoexec.domain.enums.TradingMode;
import com.algoexec.performance.RunSummary;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the engine loop on a dedicated thread once the context is up, in the configured
 * mode. Stopping the context ends a live session, which then saves its summary.
 */
public class EngineRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(EngineRunner.class);

    private static final long JOIN_TIMEOUT_MS = 60_000;

    private final EngineController engineController;
    private final EngineProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread engineThread;

    public EngineRunner(EngineController engineController, EngineProperties properties) {
        this.engineController = engineController;
        this.properties = properties;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            engineThread = new Thread(this::run, "engine-loop");
            engineThread.start();
            log.info("Engine runner started in {} mode", properties.getMode());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            engineController.stop();
            if (engineThread != null) {
                try {
                    engineThread.join(JOIN_TIMEOUT_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted waiting for the engine loop to finish");
                }
            }
            log.info("Engine runner stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void run() {
        try {
            RunSummary summary = properties.getMode() == TradingMode.LIVE
                    ? engineController.runLive()
                    : engineController.runBacktest();
            log.info(
                    "{} run {} finished: ending equity {}, net profit {}",
                    summary.getMode(),
                    summary.getRunId(),
                    summary.getEndingEquity(),
                    summary.getNetProfit());
        } catch (RuntimeException e) {
            log.error("Engine run failed: {}", e.getMessage(), e);
        }
    }
}
